package com.cadence.dto;

import com.cadence.model.SuppressionReason;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SuppressionRequest {

    @NotBlank(message = "address is required")
    @Email(message = "address must be an email address")
    private String address;

    @Builder.Default
    private SuppressionReason reason = SuppressionReason.MANUAL;

    // Null = permanent
    private Instant expiresAt;
}
