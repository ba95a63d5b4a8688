package com.cadence.service;

import com.cadence.dto.WorkflowRequest;
import com.cadence.dto.WorkflowResponse;
import com.cadence.exception.WorkflowNotFoundException;
import com.cadence.model.EnrollmentStatus;
import com.cadence.model.WorkflowDefinition;
import com.cadence.model.WorkflowGraph;
import com.cadence.model.WorkflowStatus;
import com.cadence.repository.EnrollmentRepository;
import com.cadence.repository.WorkflowDefinitionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowService {

    private final WorkflowDefinitionRepository definitionRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final WorkflowDefinitionValidator validator;
    private final ObjectMapper objectMapper;

    @Transactional
    public WorkflowResponse create(String tenantId, WorkflowRequest request) {
        validator.validate(request.getGraph());

        String workflowId = request.getWorkflowId() != null && !request.getWorkflowId().isBlank()
                ? request.getWorkflowId().trim()
                : UUID.randomUUID().toString();
        if (definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(tenantId, workflowId).isPresent()) {
            throw new IllegalStateException("Workflow already exists: " + workflowId);
        }

        WorkflowDefinition definition = WorkflowDefinition.builder()
                .workflowId(workflowId)
                .tenantId(tenantId)
                .name(request.getName())
                .version(1)
                .status(WorkflowStatus.DRAFT)
                .graph(request.getGraph())
                .build();

        WorkflowDefinition saved = definitionRepository.save(definition);
        log.info("Created workflow {} '{}' (tenant={})", workflowId, request.getName(), tenantId);
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<WorkflowResponse> listAll(String tenantId) {
        return definitionRepository.findLatestByTenantId(tenantId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public WorkflowResponse get(String tenantId, String workflowId) {
        return toResponse(latest(tenantId, workflowId));
    }

    /**
     * A changed graph is stored as a new version; enrollments already running
     * stay on the version they started on. A rename alone updates in place.
     */
    @Transactional
    public WorkflowResponse update(String tenantId, String workflowId, WorkflowRequest request) {
        validator.validate(request.getGraph());
        WorkflowDefinition current = latest(tenantId, workflowId);

        if (sameGraph(current.getGraph(), request.getGraph())) {
            current.setName(request.getName());
            return toResponse(definitionRepository.save(current));
        }

        WorkflowDefinition next = WorkflowDefinition.builder()
                .workflowId(workflowId)
                .tenantId(tenantId)
                .name(request.getName())
                .version(current.getVersion() + 1)
                .status(current.getStatus())
                .graph(request.getGraph())
                .build();
        WorkflowDefinition saved = definitionRepository.save(next);
        log.info("Workflow {} updated to v{} (tenant={})", workflowId, saved.getVersion(), tenantId);
        return toResponse(saved);
    }

    @Transactional
    public WorkflowResponse updateStatus(String tenantId, String workflowId, WorkflowStatus status) {
        WorkflowDefinition current = latest(tenantId, workflowId);
        current.setStatus(status);
        log.info("Workflow {} is now {} (tenant={})", workflowId, status, tenantId);
        return toResponse(definitionRepository.save(current));
    }

    /**
     * Removes every version. Refused while enrollments are live; archive the
     * workflow instead.
     */
    @Transactional
    public void delete(String tenantId, String workflowId) {
        List<WorkflowDefinition> versions = definitionRepository.findByTenantIdAndWorkflowId(tenantId, workflowId);
        if (versions.isEmpty()) {
            throw new WorkflowNotFoundException(tenantId, workflowId);
        }
        long live = enrollmentRepository.countByTenantIdAndWorkflowIdAndStatus(tenantId, workflowId, EnrollmentStatus.ACTIVE)
                + enrollmentRepository.countByTenantIdAndWorkflowIdAndStatus(tenantId, workflowId, EnrollmentStatus.PAUSED);
        if (live > 0) {
            throw new IllegalStateException("Workflow " + workflowId + " has " + live
                    + " live enrollments; archive it instead");
        }
        definitionRepository.deleteAll(versions);
        log.info("Deleted workflow {} ({} versions, tenant={})", workflowId, versions.size(), tenantId);
    }

    private WorkflowDefinition latest(String tenantId, String workflowId) {
        return definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(tenantId, workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(tenantId, workflowId));
    }

    private boolean sameGraph(WorkflowGraph a, WorkflowGraph b) {
        return objectMapper.valueToTree(a).equals(objectMapper.valueToTree(b));
    }

    // --- Mapping helpers ---

    private WorkflowResponse toResponse(WorkflowDefinition d) {
        return WorkflowResponse.builder()
                .workflowId(d.getWorkflowId())
                .name(d.getName())
                .version(d.getVersion())
                .status(d.getStatus())
                .graph(d.getGraph())
                .activeEnrollments(enrollmentRepository.countByTenantIdAndWorkflowIdAndStatus(
                        d.getTenantId(), d.getWorkflowId(), EnrollmentStatus.ACTIVE))
                .createdAt(d.getCreatedAt())
                .updatedAt(d.getUpdatedAt())
                .build();
    }
}
