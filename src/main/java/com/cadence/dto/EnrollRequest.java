package com.cadence.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EnrollRequest {

    @NotBlank(message = "workflowId is required")
    private String workflowId;

    @NotBlank(message = "entityId is required")
    private String entityId;

    // Seeds the enrollment's state snapshot, e.g. {"email": "jane@example.com"}
    private Map<String, Object> fields;
}
