package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.cadence.dto.NurtureEntryOptions;
import com.cadence.dto.SuppressionCheck;
import com.cadence.model.CrmEvent;
import com.cadence.model.Enrollment;
import com.cadence.model.EventType;
import com.cadence.model.NurtureEnrollment;
import com.cadence.model.NurtureStatus;
import com.cadence.model.ScoreTier;
import com.cadence.repository.NurtureEnrollmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Policy layer over the workflow engine for leads that finished a primary
 * sequence without converting.
 *
 * ENTRY (all must hold):
 *   - address not suppressed (rate limits do not count)
 *   - no open deal, no explicit negative reply
 *   - no ACTIVE nurture row for the lead
 *
 * RE-ENTRY into the primary workflow when:
 *   - decayed score >= 60 and the tier is not cold, or
 *   - the trigger is a click, a page visit or a manual tag
 *
 * ARCHIVE: ACTIVE rows without activity for the archive period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NurtureRouter {

    static final int RE_ENTRY_SCORE = 60;
    static final Set<EventType> RE_ENTRY_TRIGGERS =
            EnumSet.of(EventType.EMAIL_CLICKED, EventType.PAGE_VISIT, EventType.MANUAL_TAG);
    static final Set<EventType> ENGAGEMENT_EVENTS = EnumSet.of(
            EventType.EMAIL_OPENED, EventType.EMAIL_CLICKED, EventType.EMAIL_REPLIED,
            EventType.PAGE_VISIT, EventType.FORM_SUBMITTED);

    private final NurtureEnrollmentRepository nurtureRepository;
    private final SuppressionLedger suppressionLedger;
    private final LeadScoringService leadScoring;
    private final WorkflowEngine workflowEngine;
    private final CadenceProperties properties;
    private final Clock clock;

    /**
     * Returns true when the lead was placed in the nurture track. The engine
     * enrollment is created first, so a failure there leaves no nurture row.
     */
    public boolean tryEnrolInNurture(String tenantId, String entityId, String nurtureWorkflowId,
                                     NurtureEntryOptions options) {
        NurtureEntryOptions opts = options != null ? options : NurtureEntryOptions.none();
        String address = opts.getAddress() != null && !opts.getAddress().isBlank()
                ? opts.getAddress()
                : entityId;

        SuppressionCheck check = suppressionLedger.check(tenantId, address);
        if (check.isSuppressed() && !check.getReason().isRateLimit()) {
            log.info("{} is suppressed ({}), skipping nurture enrolment", entityId, check.getReason().wireName());
            return false;
        }
        if (opts.isHasDeal()) {
            log.info("{} has an open deal, skipping nurture", entityId);
            return false;
        }
        if (opts.isExplicitNegative()) {
            log.info("{} replied negatively, skipping nurture", entityId);
            return false;
        }
        if (nurtureRepository.existsByTenantIdAndEntityIdAndStatus(tenantId, entityId, NurtureStatus.ACTIVE)) {
            log.debug("{} already in nurture", entityId);
            return false;
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        if (opts.getAddress() != null && !opts.getAddress().isBlank()) {
            fields.put("email", opts.getAddress());
        }
        Enrollment enrollment = workflowEngine.enrollLead(tenantId, nurtureWorkflowId, entityId, fields);

        Instant now = clock.instant();
        Instant nextSendAt = now.plus(randomCadence());
        nurtureRepository.save(NurtureEnrollment.builder()
                .tenantId(tenantId)
                .entityId(entityId)
                .nurtureWorkflowId(nurtureWorkflowId)
                .status(NurtureStatus.ACTIVE)
                .nextSendAt(nextSendAt)
                .contentIndex(0)
                .enrolledAt(now)
                .lastActivityAt(now)
                .build());

        log.info("Enrolled {} in nurture {} (enrollment={}), next send {}",
                entityId, nurtureWorkflowId, enrollment.getEnrollmentId(), nextSendAt);
        return true;
    }

    public boolean checkReEntryTriggers(String tenantId, String entityId, String primaryWorkflowId,
                                        EventType triggerEvent) {
        int score = leadScoring.getLeadScore(tenantId, entityId);
        boolean scoreTriggered = score >= RE_ENTRY_SCORE && ScoreTier.of(score) != ScoreTier.COLD;
        boolean eventTriggered = triggerEvent != null && RE_ENTRY_TRIGGERS.contains(triggerEvent);

        if (!scoreTriggered && !eventTriggered) {
            return false;
        }

        log.info("Re-entry triggered for {} into {} (score={}, event={})", entityId, primaryWorkflowId,
                score, triggerEvent != null ? triggerEvent.wireName() : null);
        workflowEngine.enrollLead(tenantId, primaryWorkflowId, entityId, Map.of());

        if (properties.getNurture().isExitOnReEntry()) {
            nurtureRepository.findFirstByTenantIdAndEntityIdAndStatus(tenantId, entityId, NurtureStatus.ACTIVE)
                    .ifPresent(row -> {
                        row.setStatus(NurtureStatus.EXITED);
                        nurtureRepository.save(row);
                        log.info("Nurture row for {} exited on re-entry", entityId);
                    });
        }
        return true;
    }

    @Transactional
    public int archiveInactiveNurtureLeads() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getNurture().getArchiveAfterDays()));
        int archived = 0;
        for (NurtureEnrollment row : nurtureRepository.findByStatus(NurtureStatus.ACTIVE)) {
            if (row.lastSeenAt().isBefore(cutoff)) {
                row.setStatus(NurtureStatus.ARCHIVED);
                nurtureRepository.save(row);
                archived++;
                log.info("Archived inactive nurture lead {} (tenant={})", row.getEntityId(), row.getTenantId());
            }
        }
        if (archived > 0) {
            log.info("Archived {} inactive nurture leads", archived);
        }
        return archived;
    }

    /**
     * Engagement with any touchpoint counts as nurture activity and holds off
     * archival.
     */
    @EventListener
    public void onEventIngested(CrmEventIngested ingested) {
        CrmEvent event = ingested.getEvent();
        if (!ENGAGEMENT_EVENTS.contains(event.getEventType())) {
            return;
        }
        Optional<NurtureEnrollment> row = nurtureRepository.findFirstByTenantIdAndEntityIdAndStatus(
                event.getTenantId(), event.getEntityId(), NurtureStatus.ACTIVE);
        row.ifPresent(r -> {
            if (r.getLastActivityAt() == null || event.getOccurredAt().isAfter(r.getLastActivityAt())) {
                r.setLastActivityAt(event.getOccurredAt());
                nurtureRepository.save(r);
                log.debug("Nurture activity for {} at {}", event.getEntityId(), event.getOccurredAt());
            }
        });
    }

    /**
     * Uniformly random, strictly between the configured minimum and maximum.
     */
    Duration randomCadence() {
        long min = Duration.ofDays(properties.getNurture().getCadenceMinDays()).toMillis();
        long max = Duration.ofDays(properties.getNurture().getCadenceMaxDays()).toMillis();
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min + 1, max));
    }
}
