package io.tongchi.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TongchiConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "tongchi-settings.json";
    public static final long DEFAULT_LISTER_TIMEOUT_SECONDS = 15L;
    public static final long DEFAULT_TASK_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_PROCESS_RETENTION_SECONDS = 3_600L;
    public static final long DEFAULT_SWEEP_INTERVAL_SECONDS = 60L;
    public static final long DEFAULT_LEASE_RENEW_WINDOW_SECONDS = 120L;
    public static final long DEFAULT_TOKEN_RENEWAL_SECONDS = 300L;
    public static final long DEFAULT_LEASE_RENEWAL_SECONDS = 600L;
    public static final long DEFAULT_STATUS_POLL_SECONDS = 10L;
    public static final long DEFAULT_STOP_GRACE_SECONDS = 5L;
    public static final long DEFAULT_TREE_TTL_SECONDS = 0L;
    public static final long DEFAULT_PUMP_TICK_MS = 1_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;

    public static final String TASK_TOKEN_RENEWAL = "token-renewal";
    public static final String TASK_LEASE_RENEWAL = "lease-renewal";
    public static final String TASK_PROCESS_SWEEP = "process-sweep";
    public static final String TASK_STATUS_POLL_PREFIX = "status-poll:";

    private final Path rootDir;

    public TongchiConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TongchiConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TongchiConfig(resolved.toAbsolutePath().normalize());
    }

    public static String statusPollTaskId(String pollerName) {
        return TASK_STATUS_POLL_PREFIX + pollerName;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path activityRoot() {
        return rootDir.resolve("activity");
    }

    public Path activityFile() {
        return activityRoot().resolve("activity.jsonl");
    }

    public Path workspacesRoot() {
        return rootDir.resolve("workspaces");
    }
}
