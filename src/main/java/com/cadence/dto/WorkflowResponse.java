package com.cadence.dto;

import com.cadence.model.WorkflowGraph;
import com.cadence.model.WorkflowStatus;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowResponse {
    private String workflowId;
    private String name;
    private int version;
    private WorkflowStatus status;
    private WorkflowGraph graph;
    private long activeEnrollments;
    private Instant createdAt;
    private Instant updatedAt;
}
