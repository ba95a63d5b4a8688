package com.cadence.service;

import com.cadence.dto.IncomingEvent;
import com.cadence.dto.IngestResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kafka consumer for interaction events published by tracking webhooks,
 * pixels and CRM hooks.
 *
 * FLOW:
 *   producer → "cadence.events" → IncomingEventListener
 *                                      ↓
 *                               JSON → IncomingEvent (validated)
 *                                      ↓
 *                               EventIngestionService.ingest()
 *
 * Anything that fails on the way goes to the DLQ topic with the error.
 * Duplicates are a normal outcome and are not dead-lettered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IncomingEventListener {

    private final EventIngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final DeadLetterQueueService deadLetterQueueService;

    @KafkaListener(topics = "${cadence.topics.events:cadence.events}", groupId = "cadence-ingest")
    public void onEvent(String message) {
        try {
            IncomingEvent event = objectMapper.readValue(message, IncomingEvent.class);

            Set<ConstraintViolation<IncomingEvent>> violations = validator.validate(event);
            if (!violations.isEmpty()) {
                String problems = violations.stream()
                        .map(ConstraintViolation::getMessage)
                        .sorted()
                        .collect(Collectors.joining(", "));
                deadLetterQueueService.sendRawToDlq(message, "Invalid event: " + problems);
                return;
            }

            IngestResult result = ingestionService.ingest(event);
            log.debug("Consumed event → {} ({})", result.getStatus(), result.getDedupeKey());
        } catch (Exception e) {
            log.error("Failed to ingest event: {}", e.getMessage(), e);
            deadLetterQueueService.sendRawToDlq(message, e.getMessage());
        }
    }
}
