package com.cadence.dto;

import com.cadence.model.Enrollment;
import lombok.*;

/**
 * created is false when the lead already held an active enrollment in the
 * workflow and that enrollment was returned instead.
 */
@Getter @AllArgsConstructor
public class EnrollResult {
    private final Enrollment enrollment;
    private final boolean created;
}
