package io.tongchi.alert;

import io.tongchi.model.Alert;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ChangeDetector {
    private final AlertPolicy policy;
    private final Clock clock;
    private Map<String, String> snapshot;

    public ChangeDetector(AlertPolicy policy, Clock clock) {
        this.policy = policy == null ? AlertPolicy.defaults(null, null) : policy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AlertPolicy policy() {
        return policy;
    }

    public synchronized List<Alert> observe(Map<String, String> current) {
        Map<String, String> next = copyOf(current);
        Map<String, String> previous = snapshot;
        List<Alert> alerts = new ArrayList<>();
        if (previous != null) {
            Instant now = clock.instant();
            for (Map.Entry<String, String> entry : next.entrySet()) {
                String before = previous.get(entry.getKey());
                String after = entry.getValue();
                if (before != null && !policy.isFailure(before) && policy.isFailure(after)) {
                    alerts.add(new Alert(
                            entry.getKey(),
                            Alert.Kind.FAILED,
                            policy.title(),
                            policy.resourceKind() + " " + entry.getKey() + " is now " + after + " (was " + before + ")",
                            before,
                            after,
                            now
                    ));
                }
            }
            if (policy.alertOnRemoval()) {
                for (Map.Entry<String, String> entry : previous.entrySet()) {
                    if (!next.containsKey(entry.getKey())) {
                        alerts.add(new Alert(
                                entry.getKey(),
                                Alert.Kind.REMOVED,
                                policy.title(),
                                policy.resourceKind() + " " + entry.getKey() + " is no longer reported (was " + entry.getValue() + ")",
                                entry.getValue(),
                                null,
                                now
                        ));
                    }
                }
            }
        }
        snapshot = next;
        return alerts;
    }

    public synchronized Map<String, String> snapshot() {
        return snapshot == null ? Map.of() : snapshot;
    }

    public synchronized boolean hasBaseline() {
        return snapshot != null;
    }

    public synchronized void reset() {
        snapshot = null;
    }

    private static Map<String, String> copyOf(Map<String, String> current) {
        if (current == null || current.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : current.entrySet()) {
            if (entry.getKey() != null) {
                copy.put(entry.getKey(), entry.getValue() == null ? "unknown" : entry.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
