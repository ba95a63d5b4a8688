package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Parks inbound messages that could not be ingested (unparseable JSON,
 * validation failure, storage error) on the DLQ topic with the error, so
 * nothing a producer sent is silently lost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CadenceProperties properties;
    private final Clock clock;

    public void sendRawToDlq(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> dlqMessage = new HashMap<>();
            dlqMessage.put("rawMessage", rawMessage);
            dlqMessage.put("error", errorMessage);
            dlqMessage.put("timestamp", clock.millis());

            String message = objectMapper.writeValueAsString(dlqMessage);
            kafkaTemplate.send(properties.getTopics().getDlq(), message);
            log.info("Rejected event sent to DLQ: error={}", errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send rejected event to DLQ: {}", e.getMessage(), e);
        }
    }
}
