package com.cadence.exception;

import jakarta.persistence.EntityNotFoundException;

public class WorkflowNotFoundException extends EntityNotFoundException {

    public WorkflowNotFoundException(String tenantId, String workflowId) {
        super("Workflow not found: " + workflowId + " (tenant " + tenantId + ")");
    }
}
