package com.cadence.service;

import com.cadence.dto.LeadScoreResponse;
import com.cadence.dto.ScoreChange;
import com.cadence.model.EventType;
import com.cadence.model.LeadScore;
import com.cadence.model.ScoreTier;
import com.cadence.repository.LeadScoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule-based lead scoring with continuous time decay.
 *
 * Weights:
 *   email_opened        +5   (+10 for a repeat open of the same email)
 *   email_clicked       +20
 *   page_visit          0    (+30 when the page is "pricing")
 *   form_submitted      +60
 *   email_replied       +75
 *   email_unsubscribed  -50
 *   score_adjustment    payload.delta, verbatim
 *
 * Decay is applied on read, never by a batch job: the stored score is
 * multiplied by 0.9^(days since last activity / 30), i.e. -10% compounding per
 * 30 idle days. Every write first reads the decayed value, so the stored score
 * is always "as of lastActivityAt".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadScoringService {

    static final int PRICING_PAGE_WEIGHT = 30;
    static final int REPEAT_OPEN_WEIGHT = 10;
    static final double DECAY_RATE = 0.10;
    static final double DECAY_PERIOD_DAYS = 30.0;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final Map<EventType, Integer> WEIGHTS = new EnumMap<>(EventType.class);

    static {
        WEIGHTS.put(EventType.EMAIL_OPENED, 5);
        WEIGHTS.put(EventType.EMAIL_CLICKED, 20);
        WEIGHTS.put(EventType.FORM_SUBMITTED, 60);
        WEIGHTS.put(EventType.EMAIL_REPLIED, 75);
        WEIGHTS.put(EventType.EMAIL_UNSUBSCRIBED, -50);
    }

    private final LeadScoreRepository scoreRepository;
    private final Clock clock;

    /**
     * Applies the weight of one event. Returns empty, without touching storage,
     * when the event resolves to a zero delta.
     */
    @Transactional
    public Optional<ScoreChange> applyScoreEvent(String tenantId, String entityId,
                                                 EventType eventType, Map<String, Object> payload) {
        int delta = resolveDelta(eventType, payload);
        if (delta == 0) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Optional<LeadScore> existing = scoreRepository.findByTenantIdAndEntityId(tenantId, entityId);
        int current = existing.map(row -> decayedScore(row.getScore(), row.getLastActivityAt(), now)).orElse(0);

        LeadScore row = existing.orElseGet(() -> LeadScore.builder()
                .tenantId(tenantId)
                .entityId(entityId)
                .createdAt(now)
                .build());
        row.applyScore(current + delta, now);
        scoreRepository.saveAndFlush(row);

        log.info("Score {}:{} {} → {} ({}{}) tier={}", tenantId, entityId, current, row.getScore(),
                delta > 0 ? "+" : "", delta, row.getTier());
        return Optional.of(new ScoreChange(current, row.getScore(), row.getTier(), delta));
    }

    /**
     * {@link #applyScoreEvent} in a transaction of its own. A version or
     * unique-key conflict surfaces here, after which the caller may retry
     * against a fresh read.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ScoreChange> applyScoreEventInNewTransaction(String tenantId, String entityId,
                                                                 EventType eventType, Map<String, Object> payload) {
        return applyScoreEvent(tenantId, entityId, eventType, payload);
    }

    /**
     * Current decayed score, rounded. A lead without a row scores 0, and so does
     * any lead while storage is unreachable.
     */
    @Transactional(readOnly = true)
    public int getLeadScore(String tenantId, String entityId) {
        try {
            Instant now = clock.instant();
            return scoreRepository.findByTenantIdAndEntityId(tenantId, entityId)
                    .map(row -> decayedScore(row.getScore(), row.getLastActivityAt(), now))
                    .orElse(0);
        } catch (DataAccessException e) {
            log.warn("Score lookup failed for {}:{}: {}", tenantId, entityId, e.getMessage());
            return 0;
        }
    }

    @Transactional(readOnly = true)
    public LeadScoreResponse getScoreDetail(String tenantId, String entityId) {
        Instant now = clock.instant();
        return scoreRepository.findByTenantIdAndEntityId(tenantId, entityId)
                .map(row -> toResponse(row, now))
                .orElseGet(() -> LeadScoreResponse.builder()
                        .entityId(entityId)
                        .score(0)
                        .tier(ScoreTier.COLD)
                        .build());
    }

    /**
     * All scored leads of a tenant, decayed to now, optionally limited to one tier.
     */
    @Transactional(readOnly = true)
    public List<LeadScoreResponse> listScores(String tenantId, ScoreTier tier) {
        Instant now = clock.instant();
        return scoreRepository.findByTenantIdOrderByScoreDesc(tenantId).stream()
                .map(row -> toResponse(row, now))
                .filter(r -> tier == null || r.getTier() == tier)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Map<ScoreTier, Long> tierDistribution(String tenantId) {
        Map<ScoreTier, Long> counts = new EnumMap<>(ScoreTier.class);
        for (ScoreTier tier : ScoreTier.values()) {
            counts.put(tier, 0L);
        }
        listScores(tenantId, null).forEach(r -> counts.merge(r.getTier(), 1L, Long::sum));
        return Collections.unmodifiableMap(counts);
    }

    static int resolveDelta(EventType eventType, Map<String, Object> payload) {
        Map<String, Object> data = payload != null ? payload : Map.of();
        return switch (eventType) {
            case PAGE_VISIT -> "pricing".equals(data.get("page")) ? PRICING_PAGE_WEIGHT : 0;
            case EMAIL_OPENED -> Boolean.TRUE.equals(data.get("is_repeat_open"))
                    ? REPEAT_OPEN_WEIGHT
                    : WEIGHTS.get(EventType.EMAIL_OPENED);
            case SCORE_ADJUSTMENT -> data.get("delta") instanceof Number
                    ? (int) Math.round(((Number) data.get("delta")).doubleValue())
                    : 0;
            default -> WEIGHTS.getOrDefault(eventType, 0);
        };
    }

    static int decayedScore(int rawScore, Instant lastActivityAt, Instant now) {
        if (rawScore <= 0) {
            return 0;
        }
        Instant anchor = lastActivityAt != null ? lastActivityAt : now;
        double idleDays = Math.max(0L, Duration.between(anchor, now).toMillis()) / MILLIS_PER_DAY;
        double decayed = rawScore * Math.pow(1 - DECAY_RATE, idleDays / DECAY_PERIOD_DAYS);
        return (int) Math.max(0, Math.round(decayed));
    }

    private LeadScoreResponse toResponse(LeadScore row, Instant now) {
        int score = decayedScore(row.getScore(), row.getLastActivityAt(), now);
        return LeadScoreResponse.builder()
                .entityId(row.getEntityId())
                .score(score)
                .tier(ScoreTier.of(score))
                .rawScore(row.getScore())
                .lastActivityAt(row.getLastActivityAt())
                .build();
    }
}
