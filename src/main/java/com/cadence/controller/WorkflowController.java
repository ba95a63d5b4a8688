package com.cadence.controller;

import com.cadence.dto.WorkflowRequest;
import com.cadence.dto.WorkflowResponse;
import com.cadence.dto.WorkflowStatusRequest;
import com.cadence.service.WorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService workflowService;

    @PostMapping
    public ResponseEntity<WorkflowResponse> create(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @Valid @RequestBody WorkflowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> listAll(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId) {
        return ResponseEntity.ok(workflowService.listAll(tenantId));
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> get(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.get(tenantId, workflowId));
    }

    @PutMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> update(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable String workflowId, @Valid @RequestBody WorkflowRequest request) {
        return ResponseEntity.ok(workflowService.update(tenantId, workflowId, request));
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable String workflowId) {
        workflowService.delete(tenantId, workflowId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{workflowId}/status")
    public ResponseEntity<WorkflowResponse> updateStatus(
            @RequestHeader(value = "X-Tenant-Id", defaultValue = "default") String tenantId,
            @PathVariable String workflowId, @Valid @RequestBody WorkflowStatusRequest request) {
        return ResponseEntity.ok(workflowService.updateStatus(tenantId, workflowId, request.getStatus()));
    }
}
