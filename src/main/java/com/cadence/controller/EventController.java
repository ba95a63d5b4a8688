package com.cadence.controller;

import com.cadence.dto.IncomingEvent;
import com.cadence.dto.IngestResult;
import com.cadence.model.CrmEvent;
import com.cadence.model.EventType;
import com.cadence.service.EventIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST endpoint for submitting events directly (alternative to Kafka).
 *
 * POST /api/events
 * {
 *   "eventType": "email_replied",
 *   "entityId": "lead-42",
 *   "source": "mail-tracking",
 *   "dedupeKey": "msg-8f1c",
 *   "payload": {"to": "jane@example.com"}
 * }
 *
 * A new event answers 201, a duplicate 200 with status DUPLICATE.
 * The tenant comes from the X-Tenant-Id header unless the body names one.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventIngestionService ingestionService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody IncomingEvent event) {
        if (event.getTenantId() == null || event.getTenantId().isBlank()) {
            event.setTenantId(tenantId);
        }
        IngestResult result = ingestionService.ingest(event);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.getStatus());
        body.put("dedupeKey", result.getDedupeKey());
        body.put("eventId", result.getEventId());
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public ResponseEntity<Page<CrmEvent>> search(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Boolean processed,
            @RequestParam(required = false) List<String> types,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        List<EventType> eventTypes = types == null ? null
                : types.stream().map(EventType::fromWireName).collect(Collectors.toList());
        return ResponseEntity.ok(ingestionService.search(tenantId, source, processed, eventTypes, q, limit, offset));
    }
}
