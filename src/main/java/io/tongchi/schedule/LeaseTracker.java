package io.tongchi.schedule;

import io.tongchi.concurrent.OperationContext;
import io.tongchi.error.ResourceNotFoundException;
import io.tongchi.error.TransportException;
import io.tongchi.event.EventBus;
import io.tongchi.event.LeaseExpired;
import io.tongchi.model.LeaseView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class LeaseTracker implements TaskBody {
    private static final Logger log = LoggerFactory.getLogger(LeaseTracker.class);

    private final LeaseRenewer renewer;
    private final Clock clock;
    private final EventBus events;
    private final Map<String, Lease> leases;
    private volatile Duration renewWindow;

    public LeaseTracker(LeaseRenewer renewer, Clock clock, Duration renewWindow, EventBus events) {
        if (renewer == null) {
            throw new IllegalArgumentException("lease renewer cannot be null");
        }
        this.renewer = renewer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.renewWindow = renewWindow == null ? Duration.ofMinutes(2) : renewWindow;
        this.events = events;
        this.leases = new LinkedHashMap<>();
    }

    public void track(String leaseId, Duration ttl) {
        if (leaseId == null || leaseId.isBlank()) {
            throw new IllegalArgumentException("lease id cannot be empty");
        }
        Duration safeTtl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        synchronized (leases) {
            leases.put(leaseId, new Lease(leaseId, clock.instant().plus(safeTtl)));
        }
    }

    public boolean untrack(String leaseId) {
        synchronized (leases) {
            return leases.remove(leaseId) != null;
        }
    }

    public int size() {
        synchronized (leases) {
            return leases.size();
        }
    }

    public void setRenewWindow(Duration window) {
        if (window != null && !window.isNegative()) {
            this.renewWindow = window;
        }
    }

    public List<LeaseView> views() {
        List<LeaseView> out = new ArrayList<>();
        synchronized (leases) {
            for (Lease lease : leases.values()) {
                out.add(lease.toView());
            }
        }
        out.sort(Comparator.comparing(LeaseView::expiresAt));
        return out;
    }

    @Override
    public void run(OperationContext context) throws Exception {
        RenewalReport report = renewDue(context);
        if (!report.failed().isEmpty()) {
            throw new TransportException("lease renewal failed for " + report.failed().size()
                    + " lease(s): " + String.join(", ", report.failed().keySet()));
        }
    }

    public RenewalReport renewDue(OperationContext context) {
        Instant now = clock.instant();
        List<String> due = new ArrayList<>();
        synchronized (leases) {
            for (Lease lease : leases.values()) {
                if (Duration.between(now, lease.expiresAt).compareTo(renewWindow) < 0) {
                    due.add(lease.leaseId);
                }
            }
        }
        List<String> renewed = new ArrayList<>();
        List<String> expired = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String leaseId : due) {
            if (context.isCancelled()) {
                break;
            }
            try {
                Duration next = renewer.renew(leaseId, context);
                if (next == null || next.isZero() || next.isNegative()) {
                    expire(leaseId, "lease duration exhausted");
                    expired.add(leaseId);
                } else {
                    synchronized (leases) {
                        Lease lease = leases.get(leaseId);
                        if (lease != null) {
                            Instant renewedAt = clock.instant();
                            lease.expiresAt = renewedAt.plus(next);
                            lease.lastRenewedAt = renewedAt;
                            lease.renewCount++;
                        }
                    }
                    renewed.add(leaseId);
                }
            } catch (ResourceNotFoundException e) {
                expire(leaseId, "lease not found");
                expired.add(leaseId);
            } catch (TransportException e) {
                if (e.statusCode() == 400) {
                    expire(leaseId, "lease rejected: " + e.getMessage());
                    expired.add(leaseId);
                } else {
                    failed.put(leaseId, e.getMessage());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.put(leaseId, "interrupted");
                break;
            } catch (Exception e) {
                failed.put(leaseId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
        }
        if (!renewed.isEmpty() || !expired.isEmpty() || !failed.isEmpty()) {
            log.info("Lease renewal: renewed={} expired={} failed={}", renewed.size(), expired.size(), failed.size());
        }
        return new RenewalReport(List.copyOf(renewed), List.copyOf(expired), Map.copyOf(failed));
    }

    private void expire(String leaseId, String reason) {
        untrack(leaseId);
        log.info("Lease {} dropped: {}", leaseId, reason);
        if (events != null) {
            events.publish(new LeaseExpired(leaseId, reason, clock.instant()));
        }
    }

    public record RenewalReport(List<String> renewed, List<String> expired, Map<String, String> failed) {
    }

    private static final class Lease {
        private final String leaseId;
        private Instant expiresAt;
        private Instant lastRenewedAt;
        private long renewCount;

        private Lease(String leaseId, Instant expiresAt) {
            this.leaseId = leaseId;
            this.expiresAt = expiresAt;
        }

        private LeaseView toView() {
            return new LeaseView(leaseId, expiresAt, lastRenewedAt, renewCount);
        }
    }
}
