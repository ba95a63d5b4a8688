package com.cadence.controller;

import com.cadence.dto.IncomingEvent;
import com.cadence.dto.LeadScoreResponse;
import com.cadence.dto.ScoreAdjustRequest;
import com.cadence.model.EventType;
import com.cadence.model.ScoreTier;
import com.cadence.service.EventIngestionService;
import com.cadence.service.LeadScoringService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/scores")
@RequiredArgsConstructor
public class ScoreController {

    private final LeadScoringService leadScoring;
    private final EventIngestionService ingestionService;

    @GetMapping
    public ResponseEntity<List<LeadScoreResponse>> list(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam(required = false) String tier) {
        ScoreTier filter = tier == null ? null : ScoreTier.valueOf(tier.trim().toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(leadScoring.listScores(tenantId, filter));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<ScoreTier, Long>> stats(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId) {
        return ResponseEntity.ok(leadScoring.tierDistribution(tenantId));
    }

    @GetMapping("/{entityId}")
    public ResponseEntity<LeadScoreResponse> get(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable String entityId) {
        return ResponseEntity.ok(leadScoring.getScoreDetail(tenantId, entityId));
    }

    /**
     * Manual adjustments go through the event log like any other score change,
     * so they are auditable and wake the lead's enrollments.
     */
    @PostMapping("/adjust")
    public ResponseEntity<LeadScoreResponse> adjust(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody ScoreAdjustRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("delta", request.getDelta());
        if (request.getReason() != null) {
            payload.put("reason", request.getReason());
        }
        ingestionService.ingest(IncomingEvent.builder()
                .eventType(EventType.SCORE_ADJUSTMENT)
                .entityId(request.getEntityId())
                .tenantId(tenantId)
                .source("manual")
                .payload(payload)
                .build());
        return ResponseEntity.ok(leadScoring.getScoreDetail(tenantId, request.getEntityId()));
    }
}
