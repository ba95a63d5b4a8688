package com.cadence.dto;

import com.cadence.model.SuppressionReason;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BulkSuppressionRequest {

    @NotEmpty(message = "addresses are required")
    private List<String> addresses;

    @Builder.Default
    private SuppressionReason reason = SuppressionReason.MANUAL;
}
