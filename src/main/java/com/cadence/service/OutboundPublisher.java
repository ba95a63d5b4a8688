package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Hands engine output to the collaborators that act on it.
 *
 *   send intent → cadence.sends   (mail transport renders and delivers it)
 *   alert       → cadence.alerts  (sales notifications)
 *
 * Publishing is deferred to the commit of the caller's transaction, so an
 * advancement pass that rolls back never leaks a send.
 *
 * Messages are keyed by entity id so everything for one lead lands on the
 * same partition, in order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboundPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CadenceProperties properties;

    public void publishSendIntent(String tenantId, String entityId, UUID enrollmentId,
                                  Map<String, Object> pendingSend) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("tenant_id", tenantId);
        message.put("entity_id", entityId);
        message.put("enrollment_id", enrollmentId.toString());
        message.putAll(pendingSend);

        String topic = properties.getTopics().getSends();
        String json = toJson(message);
        afterCommit(() -> {
            kafkaTemplate.send(topic, entityId, json);
            log.info("Published send intent → topic={}, entity={}, template={}",
                    topic, entityId, pendingSend.get("template_id"));
        });
    }

    public void publishAlert(String tenantId, String entityId, UUID enrollmentId,
                             String channel, String text) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("tenant_id", tenantId);
        message.put("entity_id", entityId);
        message.put("enrollment_id", enrollmentId.toString());
        message.put("channel", channel);
        message.put("message", text);

        String topic = properties.getTopics().getAlerts();
        String json = toJson(message);
        afterCommit(() -> {
            kafkaTemplate.send(topic, entityId, json);
            log.info("Published alert → topic={}, entity={}, channel={}", topic, entityId, channel);
        });
    }

    /**
     * Inside a transaction the message leaves only once it commits; a rolled
     * back pass publishes nothing. Outside one it is sent right away.
     */
    private void afterCommit(Runnable publish) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish.run();
            }
        });
    }

    private String toJson(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Outbound message is not serializable", e);
        }
    }
}
