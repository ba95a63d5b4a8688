package com.cadence.dto;

import com.cadence.model.WorkflowStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class WorkflowStatusRequest {

    @NotNull(message = "status is required")
    private WorkflowStatus status;
}
