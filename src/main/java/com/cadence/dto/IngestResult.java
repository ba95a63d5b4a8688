package com.cadence.dto;

import com.cadence.model.CrmEvent;
import lombok.*;

import java.util.UUID;

/**
 * Outcome of an ingestion. A duplicate is a normal result, not an error:
 * nothing was written and no side effects fired.
 */
@Getter @NoArgsConstructor @AllArgsConstructor
public class IngestResult {

    public enum Status { INGESTED, DUPLICATE }

    private Status status;
    private String dedupeKey;
    private CrmEvent event;

    public static IngestResult ingested(CrmEvent event) {
        return new IngestResult(Status.INGESTED, event.getDedupeKey(), event);
    }

    public static IngestResult duplicate(String dedupeKey) {
        return new IngestResult(Status.DUPLICATE, dedupeKey, null);
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }

    public UUID getEventId() {
        return event == null ? null : event.getEventId();
    }
}
