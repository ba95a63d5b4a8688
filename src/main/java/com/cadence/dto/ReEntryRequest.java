package com.cadence.dto;

import com.cadence.model.EventType;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ReEntryRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotBlank(message = "primaryWorkflowId is required")
    private String primaryWorkflowId;

    private EventType triggerEvent;
}
