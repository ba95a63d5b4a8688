package com.cadence.controller;

import com.cadence.dto.NurtureEnrollRequest;
import com.cadence.dto.NurtureEntryOptions;
import com.cadence.dto.ReEntryRequest;
import com.cadence.service.NurtureRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/nurture")
@RequiredArgsConstructor
public class NurtureController {

    private final NurtureRouter nurtureRouter;

    @PostMapping("/enrol")
    public ResponseEntity<Map<String, Object>> enrol(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody NurtureEnrollRequest request) {
        NurtureEntryOptions options = NurtureEntryOptions.builder()
                .hasDeal(request.isHasDeal())
                .explicitNegative(request.isExplicitNegative())
                .address(request.getAddress())
                .build();
        boolean enrolled = nurtureRouter.tryEnrolInNurture(
                tenantId, request.getEntityId(), request.getNurtureWorkflowId(), options);
        return ResponseEntity.ok(Map.of("entityId", request.getEntityId(), "enrolled", enrolled));
    }

    @PostMapping("/re-entry")
    public ResponseEntity<Map<String, Object>> reEntry(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody ReEntryRequest request) {
        boolean triggered = nurtureRouter.checkReEntryTriggers(
                tenantId, request.getEntityId(), request.getPrimaryWorkflowId(), request.getTriggerEvent());
        return ResponseEntity.ok(Map.of("entityId", request.getEntityId(), "reEntered", triggered));
    }

    @PostMapping("/archive")
    public ResponseEntity<Map<String, Object>> archive() {
        return ResponseEntity.ok(Map.of("archived", nurtureRouter.archiveInactiveNurtureLeads()));
    }
}
