package com.cadence.dto;

import com.cadence.model.Enrollment;
import com.cadence.model.EnrollmentStatus;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EnrollmentResponse {
    private UUID enrollmentId;
    private String workflowId;
    private int workflowVersion;
    private String entityId;
    private String currentNodeId;
    private EnrollmentStatus status;
    private String outcome;
    private Instant enteredAt;
    private Instant lastTransitionAt;
    private Instant nextCheckAt;
    private Map<String, Object> stateSnapshot;

    public static EnrollmentResponse from(Enrollment e) {
        return EnrollmentResponse.builder()
                .enrollmentId(e.getEnrollmentId())
                .workflowId(e.getWorkflowId())
                .workflowVersion(e.getWorkflowVersion())
                .entityId(e.getEntityId())
                .currentNodeId(e.getCurrentNodeId())
                .status(e.getStatus())
                .outcome(e.getOutcome())
                .enteredAt(e.getEnteredAt())
                .lastTransitionAt(e.getLastTransitionAt())
                .nextCheckAt(e.getNextCheckAt())
                .stateSnapshot(e.getStateSnapshot())
                .build();
    }
}
