package io.tongchi.event;

import java.time.Instant;

public record LeaseExpired(String leaseId, String reason, Instant at) implements CoreEvent {
}
