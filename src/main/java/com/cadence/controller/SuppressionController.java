package com.cadence.controller;

import com.cadence.dto.BulkSuppressionRequest;
import com.cadence.dto.SuppressionCheck;
import com.cadence.dto.SuppressionRequest;
import com.cadence.model.SuppressionEntry;
import com.cadence.model.SuppressionReason;
import com.cadence.service.SuppressionLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/suppressions")
@RequiredArgsConstructor
public class SuppressionController {

    private final SuppressionLedger suppressionLedger;

    @GetMapping("/check")
    public ResponseEntity<SuppressionCheck> check(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam String address) {
        return ResponseEntity.ok(suppressionLedger.check(tenantId, address));
    }

    @GetMapping
    public ResponseEntity<List<SuppressionEntry>> list(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam(required = false) String reason) {
        SuppressionReason filter = reason == null ? null : SuppressionReason.fromWireName(reason);
        return ResponseEntity.ok(suppressionLedger.list(tenantId, filter));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> suppress(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody SuppressionRequest request) {
        suppressionLedger.suppress(tenantId, request.getAddress(), request.getReason(), request.getExpiresAt());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("address", request.getAddress(), "suppressed", true));
    }

    @PostMapping("/bulk")
    public ResponseEntity<Map<String, Object>> suppressBulk(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody BulkSuppressionRequest request) {
        int count = suppressionLedger.suppressAll(tenantId, request.getAddresses(), request.getReason());
        return ResponseEntity.ok(Map.of("suppressed", count));
    }

    @DeleteMapping
    public ResponseEntity<Void> unsuppress(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam String address) {
        suppressionLedger.unsuppress(tenantId, address);
        return ResponseEntity.noContent().build();
    }
}
