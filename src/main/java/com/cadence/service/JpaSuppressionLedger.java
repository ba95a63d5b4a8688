package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.cadence.dto.SuppressionCheck;
import com.cadence.model.EventType;
import com.cadence.model.SuppressionEntry;
import com.cadence.model.SuppressionReason;
import com.cadence.repository.CrmEventRepository;
import com.cadence.repository.SuppressionEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Suppression ledger backed by the suppression_entries table and the event log.
 *
 * CHECK ORDER:
 *   1. Explicit entry (hard bounce, complaint, unsubscribe, manual)
 *        - expired → removed, fall through
 *        - otherwise → suppressed with the entry's reason
 *   2. Frequency cap: email_sent events to this address in the cap window
 *   3. Domain throttle: email_sent events to this address's domain in the throttle window
 *
 * Caps and throttles are derived from the event log on every check and never
 * stored as entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSuppressionLedger implements SuppressionLedger {

    private final SuppressionEntryRepository entryRepository;
    private final CrmEventRepository eventRepository;
    private final CadenceProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public SuppressionCheck check(String tenantId, String address) {
        String normalized = normalize(address);
        Instant now = clock.instant();

        Optional<SuppressionEntry> entry = entryRepository.findByTenantIdAndAddress(tenantId, normalized);
        if (entry.isPresent()) {
            SuppressionEntry existing = entry.get();
            if (!existing.isExpired(now)) {
                return SuppressionCheck.suppressed(existing.getReason(), existing.getExpiresAt());
            }
            entryRepository.delete(existing);
            log.info("Suppression for {} expired at {}, removed (tenant={})",
                    normalized, existing.getExpiresAt(), tenantId);
        }

        CadenceProperties.Suppression limits = properties.getSuppression();

        long recentToAddress = eventRepository.countByTenantIdAndEventTypeAndRecipientAndOccurredAtGreaterThanEqual(
                tenantId, EventType.EMAIL_SENT, normalized, now.minus(limits.getFrequencyCapWindow()));
        if (recentToAddress >= limits.getFrequencyCapMax()) {
            log.debug("Frequency cap reached for {} ({} sends)", normalized, recentToAddress);
            return SuppressionCheck.suppressed(SuppressionReason.FREQUENCY_CAP, null);
        }

        String domain = domainOf(normalized);
        if (domain != null) {
            long recentToDomain = eventRepository
                    .countByTenantIdAndEventTypeAndRecipientEndingWithAndOccurredAtGreaterThanEqual(
                            tenantId, EventType.EMAIL_SENT, "@" + domain,
                            now.minus(limits.getDomainThrottleWindow()));
            if (recentToDomain >= limits.getDomainThrottleMax()) {
                log.debug("Domain throttle reached for {} ({} sends)", domain, recentToDomain);
                return SuppressionCheck.suppressed(SuppressionReason.DOMAIN_THROTTLE, null);
            }
        }

        return SuppressionCheck.clear();
    }

    @Override
    @Transactional
    public void suppress(String tenantId, String address, SuppressionReason reason, Instant expiresAt) {
        String normalized = normalize(address);
        SuppressionReason effectiveReason = reason != null ? reason : SuppressionReason.MANUAL;
        Instant now = clock.instant();

        SuppressionEntry entry = entryRepository.findByTenantIdAndAddress(tenantId, normalized)
                .orElseGet(() -> SuppressionEntry.builder()
                        .tenantId(tenantId)
                        .address(normalized)
                        .createdAt(now)
                        .build());
        entry.setReason(effectiveReason);
        entry.setExpiresAt(expiresAt);
        entry.setUpdatedAt(now);
        entryRepository.save(entry);

        log.info("Suppressed {} ({}) {} (tenant={})", normalized, effectiveReason.wireName(),
                expiresAt != null ? "until " + expiresAt : "permanently", tenantId);
    }

    @Override
    @Transactional
    public void unsuppress(String tenantId, String address) {
        String normalized = normalize(address);
        long removed = entryRepository.deleteByTenantIdAndAddress(tenantId, normalized);
        log.info("Removed suppression for {} (tenant={}, rows={})", normalized, tenantId, removed);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SuppressionEntry> list(String tenantId, SuppressionReason reason) {
        return reason == null
                ? entryRepository.findTop500ByTenantIdOrderByCreatedAtDesc(tenantId)
                : entryRepository.findTop500ByTenantIdAndReasonOrderByCreatedAtDesc(tenantId, reason);
    }

    static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    static String domainOf(String address) {
        int at = address.lastIndexOf('@');
        return at >= 0 && at < address.length() - 1 ? address.substring(at + 1) : null;
    }
}
