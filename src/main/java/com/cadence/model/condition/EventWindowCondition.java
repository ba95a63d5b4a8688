package com.cadence.model.condition;

import com.cadence.model.EventType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * True when at least minCount events of eventType occurred for the lead within
 * the trailing window.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventWindowCondition implements Condition {

    @JsonProperty("event_type")
    private EventType eventType;

    @JsonProperty("window_ms")
    private long windowMs;

    @JsonProperty("min_count")
    private Integer minCount;

    public int effectiveMinCount() {
        return minCount == null ? 1 : minCount;
    }
}
