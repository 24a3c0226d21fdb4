/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.event;

import com.bonitaforward.account.config.AccountProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Informs the notification dispatcher about profile updates and account deletions.
 * Publishing is fire-and-forget: a failed send is logged and never fails the operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AccountProperties properties;
    private final ObjectMapper objectMapper;

    public void publish(AccountEvent event) {
        if (!properties.getEvents().isEnabled()) {
            log.debug("Account events disabled, dropping {} for {}", event.type(), event.identityId());
            return;
        }

        String topic = getTopicForEventType(event.type());
        String key = event.identityId() != null ? event.identityId().toString() : event.email();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize account event: type={}, key={}", event.type(), key, e);
            return;
        }

        log.info("Publishing account event to Kafka: topic={}, key={}", topic, key);

        try {
            kafkaTemplate.send(topic, key, payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish account event: topic={}, key={}", topic, key, ex);
                        } else {
                            log.debug("Successfully published account event: topic={}, key={}, offset={}",
                                    topic, key, result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Kafka rejected account event: topic={}, key={}", topic, key, e);
        }
    }

    private String getTopicForEventType(AccountEventType type) {
        return switch (type) {
            case PROFILE_UPDATED -> properties.getEvents().getTopics().getProfileUpdated();
            case ACCOUNT_DELETED -> properties.getEvents().getTopics().getAccountDeleted();
        };
    }
}
