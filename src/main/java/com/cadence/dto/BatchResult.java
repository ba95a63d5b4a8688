package com.cadence.dto;

import lombok.*;

/**
 * Aggregate counts of a batch run. skipped counts items another worker
 * was already advancing.
 */
@Getter @AllArgsConstructor @ToString @EqualsAndHashCode
public class BatchResult {
    private final int processed;
    private final int errors;
    private final int skipped;
}
