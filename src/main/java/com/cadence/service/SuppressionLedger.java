package com.cadence.service;

import com.cadence.dto.SuppressionCheck;
import com.cadence.model.SuppressionEntry;
import com.cadence.model.SuppressionReason;

import java.time.Instant;
import java.util.List;

/**
 * Authoritative record of addresses that must not be contacted.
 *
 * Every send goes through {@link #check} first. Addresses are compared
 * case-insensitively and scoped to a tenant.
 */
public interface SuppressionLedger {

    SuppressionCheck check(String tenantId, String address);

    /**
     * Adds the address, or replaces reason and expiry when already present.
     * A null expiresAt suppresses permanently.
     */
    void suppress(String tenantId, String address, SuppressionReason reason, Instant expiresAt);

    default void suppress(String tenantId, String address, SuppressionReason reason) {
        suppress(tenantId, address, reason, null);
    }

    void unsuppress(String tenantId, String address);

    List<SuppressionEntry> list(String tenantId, SuppressionReason reason);

    default int suppressAll(String tenantId, List<String> addresses, SuppressionReason reason) {
        int count = 0;
        for (String address : addresses) {
            if (address != null && !address.isBlank()) {
                suppress(tenantId, address, reason, null);
                count++;
            }
        }
        return count;
    }
}
