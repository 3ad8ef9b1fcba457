package io.tongchi.model;

import java.time.Instant;

public record LeaseView(
        String leaseId,
        Instant expiresAt,
        Instant lastRenewedAt,
        long renewCount
) {
}
