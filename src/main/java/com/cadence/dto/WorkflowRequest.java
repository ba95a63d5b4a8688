package com.cadence.dto;

import com.cadence.model.WorkflowGraph;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowRequest {

    // Optional on create: a random id is assigned when absent
    private String workflowId;

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "graph is required")
    private WorkflowGraph graph;
}
