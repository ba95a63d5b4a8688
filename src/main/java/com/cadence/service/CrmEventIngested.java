package com.cadence.service;

import com.cadence.model.CrmEvent;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Published in-process after an event is stored for the first time.
 * Duplicates never produce one.
 */
@Getter
@RequiredArgsConstructor
public class CrmEventIngested {

    private final CrmEvent event;
}
