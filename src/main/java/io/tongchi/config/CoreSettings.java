package io.tongchi.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.tongchi.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public record CoreSettings(
        int workerThreads,
        long listerTimeoutSeconds,
        long taskTimeoutSeconds,
        long processRetentionSeconds,
        long leaseRenewWindowSeconds,
        long stopGraceSeconds,
        long defaultTreeTtlSeconds,
        Map<String, Long> treeTtlSeconds,
        Map<String, TaskSettings> tasks,
        Set<String> failureStatuses,
        boolean alertOnRemoval
) {
    public CoreSettings {
        treeTtlSeconds = treeTtlSeconds == null ? Map.of() : Map.copyOf(treeTtlSeconds);
        tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
        failureStatuses = failureStatuses == null ? Set.of() : Set.copyOf(failureStatuses);
    }

    public static CoreSettings defaults() {
        Map<String, TaskSettings> tasks = new TreeMap<>();
        tasks.put(TongchiConfig.TASK_TOKEN_RENEWAL, new TaskSettings(TongchiConfig.DEFAULT_TOKEN_RENEWAL_SECONDS, true));
        tasks.put(TongchiConfig.TASK_LEASE_RENEWAL, new TaskSettings(TongchiConfig.DEFAULT_LEASE_RENEWAL_SECONDS, true));
        tasks.put(TongchiConfig.TASK_PROCESS_SWEEP, new TaskSettings(TongchiConfig.DEFAULT_SWEEP_INTERVAL_SECONDS, true));
        return new CoreSettings(
                TongchiConfig.DEFAULT_WORKER_THREADS,
                TongchiConfig.DEFAULT_LISTER_TIMEOUT_SECONDS,
                TongchiConfig.DEFAULT_TASK_TIMEOUT_SECONDS,
                TongchiConfig.DEFAULT_PROCESS_RETENTION_SECONDS,
                TongchiConfig.DEFAULT_LEASE_RENEW_WINDOW_SECONDS,
                TongchiConfig.DEFAULT_STOP_GRACE_SECONDS,
                TongchiConfig.DEFAULT_TREE_TTL_SECONDS,
                Map.of(),
                tasks,
                Set.of("dead", "failed"),
                true
        );
    }

    public static CoreSettings load(Path file, CoreSettings defaults) throws IOException {
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        return fromFile(raw, defaults);
    }

    static CoreSettings fromFile(SettingsFile file, CoreSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Map<String, Long> treeTtls = new TreeMap<>(defaults.treeTtlSeconds());
        if (file.treeTtlSeconds() != null) {
            file.treeTtlSeconds().forEach((tree, ttl) -> {
                if (tree != null && !tree.isBlank() && ttl != null) {
                    treeTtls.put(tree.trim(), Math.max(0L, ttl));
                }
            });
        }
        Map<String, TaskSettings> tasks = new TreeMap<>(defaults.tasks());
        if (file.tasks() != null) {
            file.tasks().forEach((id, task) -> {
                if (id == null || id.isBlank() || task == null) {
                    return;
                }
                TaskSettings base = tasks.getOrDefault(id.trim(),
                        new TaskSettings(defaultIntervalFor(id.trim()), true));
                tasks.put(id.trim(), new TaskSettings(
                        sanitizeLong(task.intervalSeconds(), base.intervalSeconds(), 1L),
                        sanitizeBoolean(task.enabled(), base.enabled())
                ));
            });
        }
        Set<String> failureStatuses = defaults.failureStatuses();
        if (file.failureStatuses() != null && !file.failureStatuses().isEmpty()) {
            Set<String> normalized = new TreeSet<>();
            for (String status : file.failureStatuses()) {
                if (status != null && !status.isBlank()) {
                    normalized.add(status.trim().toLowerCase(Locale.ROOT));
                }
            }
            if (!normalized.isEmpty()) {
                failureStatuses = normalized;
            }
        }
        return new CoreSettings(
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeLong(file.listerTimeoutSeconds(), defaults.listerTimeoutSeconds(), 1L),
                sanitizeLong(file.taskTimeoutSeconds(), defaults.taskTimeoutSeconds(), 1L),
                sanitizeLong(file.processRetentionSeconds(), defaults.processRetentionSeconds(), 0L),
                sanitizeLong(file.leaseRenewWindowSeconds(), defaults.leaseRenewWindowSeconds(), 1L),
                sanitizeLong(file.stopGraceSeconds(), defaults.stopGraceSeconds(), 0L),
                sanitizeLong(file.defaultTreeTtlSeconds(), defaults.defaultTreeTtlSeconds(), 0L),
                treeTtls,
                tasks,
                failureStatuses,
                sanitizeBoolean(file.alertOnRemoval(), defaults.alertOnRemoval())
        );
    }

    public TaskSettings task(String taskId) {
        TaskSettings configured = tasks.get(taskId);
        return configured != null ? configured : new TaskSettings(defaultIntervalFor(taskId), true);
    }

    public Duration treeTtl(String treeName) {
        Long seconds = treeTtlSeconds.get(treeName);
        return Duration.ofSeconds(seconds != null ? seconds : defaultTreeTtlSeconds);
    }

    public Duration listerTimeout() {
        return Duration.ofSeconds(listerTimeoutSeconds);
    }

    public Duration taskTimeout() {
        return Duration.ofSeconds(taskTimeoutSeconds);
    }

    public Duration processRetention() {
        return Duration.ofSeconds(processRetentionSeconds);
    }

    public Duration leaseRenewWindow() {
        return Duration.ofSeconds(leaseRenewWindowSeconds);
    }

    public Duration stopGrace() {
        return Duration.ofSeconds(stopGraceSeconds);
    }

    public static List<String> diffFields(CoreSettings before, CoreSettings after) {
        if (before == null || after == null) {
            return List.of();
        }
        List<String> changed = new ArrayList<>();
        if (before.workerThreads() != after.workerThreads()) changed.add("workerThreads");
        if (before.listerTimeoutSeconds() != after.listerTimeoutSeconds()) changed.add("listerTimeoutSeconds");
        if (before.taskTimeoutSeconds() != after.taskTimeoutSeconds()) changed.add("taskTimeoutSeconds");
        if (before.processRetentionSeconds() != after.processRetentionSeconds()) changed.add("processRetentionSeconds");
        if (before.leaseRenewWindowSeconds() != after.leaseRenewWindowSeconds()) changed.add("leaseRenewWindowSeconds");
        if (before.stopGraceSeconds() != after.stopGraceSeconds()) changed.add("stopGraceSeconds");
        if (before.defaultTreeTtlSeconds() != after.defaultTreeTtlSeconds()) changed.add("defaultTreeTtlSeconds");
        if (!before.treeTtlSeconds().equals(after.treeTtlSeconds())) changed.add("treeTtlSeconds");
        if (!before.tasks().equals(after.tasks())) changed.add("tasks");
        if (!before.failureStatuses().equals(after.failureStatuses())) changed.add("failureStatuses");
        if (before.alertOnRemoval() != after.alertOnRemoval()) changed.add("alertOnRemoval");
        return changed;
    }

    static long defaultIntervalFor(String taskId) {
        if (TongchiConfig.TASK_TOKEN_RENEWAL.equals(taskId)) {
            return TongchiConfig.DEFAULT_TOKEN_RENEWAL_SECONDS;
        }
        if (TongchiConfig.TASK_LEASE_RENEWAL.equals(taskId)) {
            return TongchiConfig.DEFAULT_LEASE_RENEWAL_SECONDS;
        }
        if (TongchiConfig.TASK_PROCESS_SWEEP.equals(taskId)) {
            return TongchiConfig.DEFAULT_SWEEP_INTERVAL_SECONDS;
        }
        if (taskId != null && taskId.startsWith(TongchiConfig.TASK_STATUS_POLL_PREFIX)) {
            return TongchiConfig.DEFAULT_STATUS_POLL_SECONDS;
        }
        return TongchiConfig.DEFAULT_TOKEN_RENEWAL_SECONDS;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    public record TaskSettings(long intervalSeconds, boolean enabled) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer workerThreads,
            Long listerTimeoutSeconds,
            Long taskTimeoutSeconds,
            Long processRetentionSeconds,
            Long leaseRenewWindowSeconds,
            Long stopGraceSeconds,
            Long defaultTreeTtlSeconds,
            Map<String, Long> treeTtlSeconds,
            Map<String, TaskSettingsFile> tasks,
            List<String> failureStatuses,
            Boolean alertOnRemoval
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskSettingsFile(Long intervalSeconds, Boolean enabled) {
    }
}
