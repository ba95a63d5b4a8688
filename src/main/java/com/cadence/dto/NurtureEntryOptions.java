package com.cadence.dto;

import lombok.*;

/**
 * Entry-gate inputs the nurture router cannot derive itself.
 * address falls back to the entity id when not given.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NurtureEntryOptions {
    private boolean hasDeal;
    private boolean explicitNegative;
    private String address;

    public static NurtureEntryOptions none() {
        return new NurtureEntryOptions();
    }
}
