package com.cadence.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScoreAdjustRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotNull(message = "delta is required")
    private Integer delta;

    private String reason;
}
