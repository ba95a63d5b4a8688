package com.cadence.controller;

import com.cadence.dto.BatchResult;
import com.cadence.dto.EnrollRequest;
import com.cadence.dto.EnrollmentResponse;
import com.cadence.model.EnrollmentStatus;
import com.cadence.service.EnrollmentService;
import com.cadence.service.WorkflowEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Enrollment control. pause/resume/stop take effect on the next advancement
 * attempt; an in-flight pass is not interrupted.
 */
@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private final WorkflowEngine workflowEngine;
    private final EnrollmentService enrollmentService;

    @PostMapping
    public ResponseEntity<EnrollmentResponse> enroll(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody EnrollRequest request) {
        return ResponseEntity.ok(EnrollmentResponse.from(workflowEngine.enrollLead(
                tenantId, request.getWorkflowId(), request.getEntityId(), request.getFields())));
    }

    @GetMapping
    public ResponseEntity<List<EnrollmentResponse>> list(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @RequestParam(required = false) EnrollmentStatus status) {
        return ResponseEntity.ok(enrollmentService.list(tenantId, status).stream()
                .map(EnrollmentResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{enrollmentId}")
    public ResponseEntity<EnrollmentResponse> get(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.get(tenantId, enrollmentId)));
    }

    @PostMapping("/{enrollmentId}/pause")
    public ResponseEntity<EnrollmentResponse> pause(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.pause(tenantId, enrollmentId)));
    }

    @PostMapping("/{enrollmentId}/resume")
    public ResponseEntity<EnrollmentResponse> resume(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.resume(tenantId, enrollmentId)));
    }

    @PostMapping("/{enrollmentId}/stop")
    public ResponseEntity<EnrollmentResponse> stop(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.stop(tenantId, enrollmentId)));
    }

    @PostMapping("/process-due")
    public ResponseEntity<BatchResult> processDue() {
        return ResponseEntity.ok(workflowEngine.processDueEnrollments());
    }
}
