package com.cadence.service;

import com.cadence.dto.ScoreChange;
import com.cadence.model.EventType;
import com.cadence.model.LeadScore;
import com.cadence.model.ScoreTier;
import com.cadence.repository.LeadScoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeadScoringServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT = "acme";
    private static final String LEAD = "lead-1";

    @Mock private LeadScoreRepository scoreRepository;

    private LeadScoringService scoring;

    @BeforeEach
    void setUp() {
        scoring = new LeadScoringService(scoreRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private LeadScore storedRow(int score, Instant lastActivityAt) {
        return LeadScore.builder()
                .tenantId(TENANT)
                .entityId(LEAD)
                .score(score)
                .tier(ScoreTier.of(score))
                .lastActivityAt(lastActivityAt)
                .createdAt(lastActivityAt)
                .updatedAt(lastActivityAt)
                .build();
    }

    @Nested
    @DisplayName("Event weights")
    class WeightTests {

        @Test
        @DisplayName("Base weights per event type")
        void baseWeights() {
            assertEquals(5, LeadScoringService.resolveDelta(EventType.EMAIL_OPENED, Map.of()));
            assertEquals(20, LeadScoringService.resolveDelta(EventType.EMAIL_CLICKED, Map.of()));
            assertEquals(60, LeadScoringService.resolveDelta(EventType.FORM_SUBMITTED, Map.of()));
            assertEquals(75, LeadScoringService.resolveDelta(EventType.EMAIL_REPLIED, Map.of()));
            assertEquals(-50, LeadScoringService.resolveDelta(EventType.EMAIL_UNSUBSCRIBED, Map.of()));
            assertEquals(0, LeadScoringService.resolveDelta(EventType.EMAIL_DELIVERED, null));
        }

        @Test
        @DisplayName("Pricing page visit is worth 30, any other page 0")
        void pricingPage() {
            assertEquals(30, LeadScoringService.resolveDelta(EventType.PAGE_VISIT, Map.of("page", "pricing")));
            assertEquals(0, LeadScoringService.resolveDelta(EventType.PAGE_VISIT, Map.of("page", "blog")));
        }

        @Test
        @DisplayName("Repeat open overrides the base open weight")
        void repeatOpen() {
            assertEquals(10, LeadScoringService.resolveDelta(EventType.EMAIL_OPENED, Map.of("is_repeat_open", true)));
        }

        @Test
        @DisplayName("Score adjustment takes payload.delta, rounded")
        void scoreAdjustment() {
            assertEquals(-7, LeadScoringService.resolveDelta(EventType.SCORE_ADJUSTMENT, Map.of("delta", -7)));
            assertEquals(13, LeadScoringService.resolveDelta(EventType.SCORE_ADJUSTMENT, Map.of("delta", 12.6)));
            assertEquals(0, LeadScoringService.resolveDelta(EventType.SCORE_ADJUSTMENT, Map.of("delta", "lots")));
        }
    }

    @Nested
    @DisplayName("Decay on read")
    class DecayTests {

        @Test
        @DisplayName("100 points lose 10% per 30 idle days, compounding")
        void decaySchedule() {
            assertEquals(100, LeadScoringService.decayedScore(100, NOW, NOW));
            assertEquals(90, LeadScoringService.decayedScore(100, NOW.minus(Duration.ofDays(30)), NOW));
            assertEquals(81, LeadScoringService.decayedScore(100, NOW.minus(Duration.ofDays(60)), NOW));
        }

        @Test
        @DisplayName("getLeadScore returns the decayed value without writing")
        void getLeadScoreDecays() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD))
                    .thenReturn(Optional.of(storedRow(100, NOW.minus(Duration.ofDays(30)))));

            assertEquals(90, scoring.getLeadScore(TENANT, LEAD));
            verify(scoreRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Unknown lead scores 0")
        void unknownLead() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD)).thenReturn(Optional.empty());

            assertEquals(0, scoring.getLeadScore(TENANT, LEAD));
        }

        @Test
        @DisplayName("Storage failure reads as 0")
        void storageFailure() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD))
                    .thenThrow(new DataAccessResourceFailureException("db down"));

            assertEquals(0, scoring.getLeadScore(TENANT, LEAD));
        }
    }

    @Nested
    @DisplayName("Applying events")
    class ApplyTests {

        @Test
        @DisplayName("Zero-delta event touches no storage")
        void zeroDeltaIsNoOp() {
            Optional<ScoreChange> change = scoring.applyScoreEvent(TENANT, LEAD, EventType.EMAIL_DELIVERED, Map.of());

            assertTrue(change.isEmpty());
            verifyNoInteractions(scoreRepository);
        }

        @Test
        @DisplayName("First scored event creates the row")
        void createsRow() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD)).thenReturn(Optional.empty());

            ScoreChange change = scoring.applyScoreEvent(TENANT, LEAD, EventType.EMAIL_REPLIED, Map.of()).orElseThrow();

            ArgumentCaptor<LeadScore> saved = ArgumentCaptor.forClass(LeadScore.class);
            verify(scoreRepository).saveAndFlush(saved.capture());
            assertEquals(75, saved.getValue().getScore());
            assertEquals(ScoreTier.HOT, saved.getValue().getTier());
            assertEquals(NOW, saved.getValue().getLastActivityAt());
            assertEquals(0, change.getPrevious());
            assertEquals(75, change.getScore());
        }

        @Test
        @DisplayName("Delta is applied to the decayed score, not the stored one")
        void appliesToDecayedScore() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD))
                    .thenReturn(Optional.of(storedRow(100, NOW.minus(Duration.ofDays(30)))));

            ScoreChange change = scoring.applyScoreEvent(TENANT, LEAD, EventType.EMAIL_CLICKED, Map.of()).orElseThrow();

            assertEquals(90, change.getPrevious());
            assertEquals(110, change.getScore());
            assertEquals(ScoreTier.HOT, change.getTier());
        }

        @Test
        @DisplayName("Score is clamped at zero")
        void clampsAtZero() {
            when(scoreRepository.findByTenantIdAndEntityId(TENANT, LEAD))
                    .thenReturn(Optional.of(storedRow(10, NOW)));

            ScoreChange change = scoring.applyScoreEvent(TENANT, LEAD, EventType.EMAIL_UNSUBSCRIBED, Map.of()).orElseThrow();

            assertEquals(0, change.getScore());
            assertEquals(ScoreTier.COLD, change.getTier());
        }
    }
}
