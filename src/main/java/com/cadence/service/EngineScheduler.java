package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.cadence.dto.BatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Time-driven triggers. Both jobs are safe to re-run and safe to run on
 * several instances at once: per-enrollment locks serialize the sweep, and
 * archiving an already archived row is a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineScheduler {

    private final WorkflowEngine workflowEngine;
    private final NurtureRouter nurtureRouter;
    private final CadenceProperties properties;

    @Scheduled(fixedDelayString = "${cadence.engine.sweep-interval-ms:60000}")
    public void sweepDueEnrollments() {
        if (!properties.getEngine().isSchedulingEnabled()) {
            log.debug("Scheduling is disabled, skipping sweep");
            return;
        }
        try {
            BatchResult result = workflowEngine.processDueEnrollments();
            log.debug("Sweep finished: {}", result);
        } catch (Exception e) {
            log.error("Due-enrollment sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${cadence.nurture.archive-cron:0 0 3 * * *}")
    public void archiveInactiveNurtureLeads() {
        if (!properties.getEngine().isSchedulingEnabled()) {
            return;
        }
        try {
            nurtureRouter.archiveInactiveNurtureLeads();
        } catch (Exception e) {
            log.error("Nurture archival failed: {}", e.getMessage(), e);
        }
    }
}
