package com.cadence.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NurtureEnrollRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotBlank(message = "nurtureWorkflowId is required")
    private String nurtureWorkflowId;

    private boolean hasDeal;
    private boolean explicitNegative;
    private String address;
}
