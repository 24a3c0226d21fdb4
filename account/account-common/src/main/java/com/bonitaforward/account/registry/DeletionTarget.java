/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.registry;

/**
 * Every table that references an identity. A new table holding a user id or a user
 * e-mail must be added here, otherwise account deletion leaves its rows behind.
 *
 * <p>Declaration order is the execution order inside a phase.
 */
public enum DeletionTarget {

    PROVIDER_CHANGE_REQUESTS("provider_change_requests", "owner_user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    PROVIDER_JOB_POSTS("provider_job_posts", "owner_user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    USER_NOTIFICATIONS("user_notifications", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    DISMISSED_NOTIFICATIONS("dismissed_notifications", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    USER_SAVED_EVENTS("user_saved_events", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    SAVED_PROVIDERS("saved_providers", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    COUPON_REDEMPTIONS("coupon_redemptions", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    CALENDAR_EVENTS("calendar_events", "created_by_user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    EVENT_FLAGS("event_flags", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    EVENT_VOTES("event_votes", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),
    EMAIL_PREFERENCES("email_preferences", "user_id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.DEPENDENT),

    FUNNEL_RESPONSES("funnel_responses", "user_email", KeyType.BY_EMAIL,
            DeletionAction.HARD_DELETE, CascadePhase.EMAIL_KEYED),
    BOOKINGS("bookings", "user_email", KeyType.BY_EMAIL,
            DeletionAction.HARD_DELETE, CascadePhase.EMAIL_KEYED),
    BUSINESS_APPLICATIONS("business_applications", "email", KeyType.BY_EMAIL,
            DeletionAction.HARD_DELETE, CascadePhase.EMAIL_KEYED),

    PROVIDERS("providers", "owner_user_id", KeyType.BY_ID,
            DeletionAction.SOFT_DELETE_OWNERSHIP, CascadePhase.OWNED_ENTITY, "email"),

    PROFILES("profiles", "id", KeyType.BY_ID,
            DeletionAction.HARD_DELETE, CascadePhase.PROFILE);

    private final String table;
    private final String keyColumn;
    private final KeyType keyType;
    private final DeletionAction action;
    private final CascadePhase phase;
    private final String emailColumn;

    DeletionTarget(String table, String keyColumn, KeyType keyType,
                   DeletionAction action, CascadePhase phase) {
        this(table, keyColumn, keyType, action, phase, keyType == KeyType.BY_EMAIL ? keyColumn : null);
    }

    DeletionTarget(String table, String keyColumn, KeyType keyType,
                   DeletionAction action, CascadePhase phase, String emailColumn) {
        this.table = table;
        this.keyColumn = keyColumn;
        this.keyType = keyType;
        this.action = action;
        this.phase = phase;
        this.emailColumn = emailColumn;
    }

    public String getTable() {
        return table;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    public DeletionAction getAction() {
        return action;
    }

    public CascadePhase getPhase() {
        return phase;
    }

    /**
     * Column holding an e-mail for this table, or null when rows cannot be matched by e-mail.
     */
    public String getEmailColumn() {
        return emailColumn;
    }

    public boolean isMatchableByEmail() {
        return emailColumn != null;
    }
}
