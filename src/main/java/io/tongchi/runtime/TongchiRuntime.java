package io.tongchi.runtime;

import io.tongchi.alert.AlertPolicy;
import io.tongchi.alert.ChangeDetector;
import io.tongchi.alert.StatusPoller;
import io.tongchi.client.ClientCache;
import io.tongchi.client.ClientFactory;
import io.tongchi.concurrent.NamedThreadFactory;
import io.tongchi.config.CoreSettings;
import io.tongchi.config.TongchiConfig;
import io.tongchi.event.AlertRaised;
import io.tongchi.event.EventBus;
import io.tongchi.event.LeaseExpired;
import io.tongchi.event.ProcessChanged;
import io.tongchi.event.TaskFinished;
import io.tongchi.model.Alert;
import io.tongchi.model.ExpandResult;
import io.tongchi.model.LeaseView;
import io.tongchi.model.NodeSnapshot;
import io.tongchi.model.NodeStatus;
import io.tongchi.model.ProcessStatus;
import io.tongchi.model.ProcessView;
import io.tongchi.model.ScheduledTaskView;
import io.tongchi.observability.ActivityLog;
import io.tongchi.observability.PrometheusFormatter;
import io.tongchi.process.LongOperation;
import io.tongchi.process.ProcessRegistry;
import io.tongchi.schedule.LeaseRenewer;
import io.tongchi.schedule.LeaseTracker;
import io.tongchi.schedule.ScheduledTask;
import io.tongchi.schedule.ScheduledTaskRunner;
import io.tongchi.schedule.TaskBody;
import io.tongchi.tree.ListerRegistry;
import io.tongchi.tree.ResourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public final class TongchiRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TongchiRuntime.class);

    private final TongchiConfig config;
    private final Clock clock;
    private final EventBus events;
    private final ActivityLog activityLog;
    private final ExecutorService listerPool;
    private final ExecutorService taskPool;
    private final ExecutorService processPool;
    private final ScheduledTaskRunner tasks;
    private final ProcessRegistry processes;
    private final Map<String, ResourceTree> trees;
    private final Map<String, ChangeDetector> detectors;
    private final Map<String, ClientCache<?>> clients;
    private final AtomicLong alertsRaised;
    private volatile CoreSettings settings;
    private volatile LeaseTracker leases;
    private volatile boolean running;
    private volatile boolean closed;

    public TongchiRuntime(TongchiConfig config) {
        this(config, Clock.systemUTC());
    }

    public TongchiRuntime(TongchiConfig config, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.settings = readSettings(config.settingsFile());
        this.events = new EventBus();
        this.activityLog = new ActivityLog(config.activityFile(), this.clock);
        int threads = settings.workerThreads();
        this.listerPool = Executors.newFixedThreadPool(threads, new NamedThreadFactory("tongchi-lister"));
        this.taskPool = Executors.newFixedThreadPool(threads, new NamedThreadFactory("tongchi-task"));
        this.processPool = Executors.newFixedThreadPool(threads, new NamedThreadFactory("tongchi-process"));
        this.tasks = new ScheduledTaskRunner(this.clock, taskPool, settings.taskTimeout(), events);
        this.processes = new ProcessRegistry(processPool, this.clock, settings.processRetention(), events);
        this.trees = new ConcurrentHashMap<>();
        this.detectors = new ConcurrentHashMap<>();
        this.clients = new ConcurrentHashMap<>();
        this.alertsRaised = new AtomicLong(0L);
        subscribeActivity();
        scheduleTask(TongchiConfig.TASK_PROCESS_SWEEP, context -> processes.sweep());
    }

    public TongchiConfig config() {
        return config;
    }

    public CoreSettings settings() {
        return settings;
    }

    public EventBus events() {
        return events;
    }

    public ActivityLog activityLog() {
        return activityLog;
    }

    public ScheduledTaskRunner taskRunner() {
        return tasks;
    }

    public ProcessRegistry processRegistry() {
        return processes;
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("runtime closed");
        }
        if (running) {
            return;
        }
        tasks.start(Duration.ofMillis(TongchiConfig.DEFAULT_PUMP_TICK_MS));
        running = true;
        log.info("Tongchi runtime started at {}", config.rootDir());
    }

    public boolean isRunning() {
        return running;
    }

    public List<String> runDueTasks() {
        return tasks.runDue();
    }

    // Resource trees

    public ResourceTree registerTree(String name, ListerRegistry listers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tree name cannot be empty");
        }
        ResourceTree tree = new ResourceTree(name, listers, listerPool, clock,
                settings.treeTtl(name), settings.listerTimeout(), events);
        if (trees.putIfAbsent(name, tree) != null) {
            tree.close();
            throw new IllegalArgumentException("Duplicate tree: " + name);
        }
        return tree;
    }

    public ResourceTree tree(String name) {
        ResourceTree tree = trees.get(name);
        if (tree == null) {
            throw new IllegalArgumentException("Unknown tree: " + name);
        }
        return tree;
    }

    public Set<String> treeNames() {
        return new TreeSet<>(trees.keySet());
    }

    public ExpandResult expand(String treeName, String path) {
        return tree(treeName).expand(path);
    }

    public ExpandResult expand(String treeName, String path, Duration maxWait) {
        return tree(treeName).expand(path, maxWait);
    }

    public CompletableFuture<ExpandResult> expandAsync(String treeName, String path) {
        return tree(treeName).expandAsync(path);
    }

    public NodeSnapshot peek(String treeName, String path) {
        return tree(treeName).peek(path);
    }

    public int invalidate(String treeName, String path, boolean recursive) {
        return tree(treeName).invalidate(path, recursive);
    }

    public ExpandResult refresh(String treeName, String path) {
        return tree(treeName).refresh(path);
    }

    public int prune(String treeName, String path) {
        return tree(treeName).prune(path);
    }

    // Scheduled tasks

    public void scheduleTask(String id, TaskBody body) {
        CoreSettings.TaskSettings task = settings.task(id);
        tasks.schedule(new ScheduledTask(id, task.intervalSeconds(), task.enabled()), body);
    }

    public void scheduleTokenRenewal(TaskBody renew) {
        CoreSettings.TaskSettings task = settings.task(TongchiConfig.TASK_TOKEN_RENEWAL);
        tasks.schedule(new ScheduledTask(TongchiConfig.TASK_TOKEN_RENEWAL, task.intervalSeconds(), task.enabled()),
                renew, Duration.ZERO);
    }

    public synchronized LeaseTracker enableLeaseRenewal(LeaseRenewer renewer) {
        if (leases != null) {
            throw new IllegalStateException("lease renewal already enabled");
        }
        LeaseTracker tracker = new LeaseTracker(renewer, clock, settings.leaseRenewWindow(), events);
        scheduleTask(TongchiConfig.TASK_LEASE_RENEWAL, tracker);
        leases = tracker;
        return tracker;
    }

    public void trackLease(String leaseId, Duration ttl) {
        requireLeases().track(leaseId, ttl);
    }

    public boolean untrackLease(String leaseId) {
        return requireLeases().untrack(leaseId);
    }

    public List<LeaseView> leases() {
        LeaseTracker tracker = leases;
        return tracker == null ? List.of() : tracker.views();
    }

    public ChangeDetector schedulePolling(String name, StatusPoller poller, AlertPolicy policy) {
        if (poller == null) {
            throw new IllegalArgumentException("status poller cannot be null: " + name);
        }
        AlertPolicy effective = policy != null
                ? policy
                : new AlertPolicy(name, null, settings.failureStatuses(), settings.alertOnRemoval());
        ChangeDetector detector = new ChangeDetector(effective, clock);
        if (detectors.putIfAbsent(name, detector) != null) {
            throw new IllegalArgumentException("Duplicate status poller: " + name);
        }
        scheduleTask(TongchiConfig.statusPollTaskId(name), context -> {
            Map<String, String> snapshot = poller.poll(context);
            context.throwIfCancelled();
            for (Alert alert : detector.observe(snapshot)) {
                alertsRaised.incrementAndGet();
                events.publish(new AlertRaised(alert, clock.instant()));
            }
        });
        return detector;
    }

    public boolean setTaskEnabled(String id, boolean enabled) {
        return tasks.setEnabled(id, enabled);
    }

    public boolean triggerTask(String id) {
        return tasks.trigger(id);
    }

    // Processes

    public <T> ProcessView submit(String name, String description, boolean cancellable, LongOperation<T> operation) {
        return processes.submit(name, description, cancellable, operation);
    }

    public boolean cancel(String processId) {
        return processes.cancel(processId);
    }

    public Optional<ProcessView> process(String processId) {
        return processes.get(processId);
    }

    public List<ProcessView> processes(ProcessStatus filter) {
        return processes.list(filter);
    }

    public List<ProcessView> recentProcesses(int limit) {
        return processes.recent(limit);
    }

    // Clients

    public <C> ClientCache<C> registerClient(String name, ClientFactory<C> factory) {
        ClientCache<C> cache = new ClientCache<>(name, factory);
        if (clients.putIfAbsent(name, cache) != null) {
            throw new IllegalArgumentException("Duplicate client: " + name);
        }
        return cache;
    }

    public int resetClients() {
        int reset = 0;
        for (ClientCache<?> cache : clients.values()) {
            if (cache.isCreated()) {
                reset++;
            }
            cache.reset();
        }
        return reset;
    }

    // Settings and status

    public SettingsReloadOutcome reloadSettings() {
        Path file = config.settingsFile();
        boolean exists = Files.exists(file);
        CoreSettings previous = settings;
        CoreSettings resolved = readSettings(file);
        settings = resolved;
        boolean changed = !resolved.equals(previous);
        List<String> changedFields = changed ? CoreSettings.diffFields(previous, resolved) : List.of();
        applySettings(resolved);
        int clientsReset = resetClients();
        String message = !exists ? "defaults" : changed ? "reloaded" : "unchanged_content";
        activityLog.record(ActivityLog.Entry.of(
                "settings.load",
                "runtime/settings",
                message,
                Map.of(
                        "config", file.toString(),
                        "changed", changed,
                        "changed_fields", changedFields,
                        "clients_reset", clientsReset
                )
        ));
        if (changed) {
            log.info("Settings reloaded from {}; changed fields: {}", file, changedFields);
        }
        return new SettingsReloadOutcome(changed, exists, file.toString(), resolved, message,
                clock.instant(), changedFields);
    }

    public StatsOutcome stats() {
        Map<String, Integer> nodesByStatus = new LinkedHashMap<>();
        for (NodeStatus status : NodeStatus.values()) {
            nodesByStatus.put(status.name().toLowerCase(Locale.ROOT), 0);
        }
        Map<String, Long> listerCallsByTree = new TreeMap<>();
        int staleNodes = 0;
        long listerCalls = 0L;
        long listerFailures = 0L;
        long cacheHits = 0L;
        long coalescedWaits = 0L;
        for (ResourceTree tree : trees.values()) {
            ResourceTree.TreeStats treeStats = tree.stats();
            treeStats.nodesByStatus().forEach((status, count) ->
                    nodesByStatus.merge(status.name().toLowerCase(Locale.ROOT), count, Integer::sum));
            staleNodes += treeStats.staleNodes();
            listerCalls += treeStats.listerCalls();
            listerFailures += treeStats.listerFailures();
            cacheHits += treeStats.cacheHits();
            coalescedWaits += treeStats.coalescedWaits();
            listerCallsByTree.put(treeStats.tree(), treeStats.listerCalls());
        }
        List<ScheduledTaskView> taskViews = tasks.views();
        int enabledTasks = 0;
        long taskRuns = 0L;
        long taskFailures = 0L;
        for (ScheduledTaskView view : taskViews) {
            if (view.enabled()) {
                enabledTasks++;
            }
            taskRuns += view.runCount();
            taskFailures += view.failureCount();
        }
        Map<String, Integer> processesByStatus = new LinkedHashMap<>();
        processes.countByStatus().forEach((status, count) ->
                processesByStatus.put(status.name().toLowerCase(Locale.ROOT), count));
        LeaseTracker tracker = leases;
        return new StatsOutcome(
                trees.size(),
                nodesByStatus,
                staleNodes,
                listerCalls,
                listerFailures,
                cacheHits,
                coalescedWaits,
                listerCallsByTree,
                taskViews.size(),
                enabledTasks,
                taskRuns,
                taskFailures,
                alertsRaised.get(),
                processesByStatus,
                tracker == null ? 0 : tracker.size()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public BackgroundStatus backgroundStatus() {
        LeaseTracker tracker = leases;
        return new BackgroundStatus(
                running,
                tasks.views(),
                tracker == null ? 0 : tracker.size(),
                processes.running().size(),
                clock.instant()
        );
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
        }
        tasks.stop(settings.stopGrace());
        processes.close();
        for (ResourceTree tree : trees.values()) {
            tree.close();
        }
        for (ClientCache<?> cache : clients.values()) {
            cache.reset();
        }
        shutdown(listerPool);
        shutdown(taskPool);
        shutdown(processPool);
        log.info("Tongchi runtime stopped");
    }

    private void applySettings(CoreSettings next) {
        for (ScheduledTaskView view : tasks.views()) {
            CoreSettings.TaskSettings task = next.task(view.id());
            tasks.reschedule(view.id(), task.intervalSeconds());
            tasks.setEnabled(view.id(), task.enabled());
        }
        for (ResourceTree tree : trees.values()) {
            tree.setTtl(next.treeTtl(tree.name()));
            tree.setListerTimeout(next.listerTimeout());
        }
        processes.setRetention(next.processRetention());
        LeaseTracker tracker = leases;
        if (tracker != null) {
            tracker.setRenewWindow(next.leaseRenewWindow());
        }
    }

    private void subscribeActivity() {
        events.subscribe(ProcessChanged.class, event -> {
            ProcessView view = event.process();
            if (!view.status().terminal()) {
                return;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("name", view.name());
            details.put("runtime", view.runtimeText(event.at()));
            if (view.error() != null) {
                details.put("error", view.error());
            }
            activityLog.record(ActivityLog.Entry.of("process.finish", "process/" + view.id(),
                    view.status().name().toLowerCase(Locale.ROOT), details));
        });
        events.subscribe(TaskFinished.class, event -> {
            if (!event.success()) {
                activityLog.record(ActivityLog.Entry.of("task.failure", "task/" + event.taskId(), "failed",
                        Map.of("error", String.valueOf(event.error()))));
            }
        });
        events.subscribe(AlertRaised.class, event -> {
            Alert alert = event.alert();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("title", alert.title());
            details.put("message", alert.message());
            details.put("previous", alert.previousStatus());
            details.put("current", alert.currentStatus());
            activityLog.record(ActivityLog.Entry.of("alert.raise", "resource/" + alert.resourceId(),
                    alert.kind().name().toLowerCase(Locale.ROOT), details));
        });
        events.subscribe(LeaseExpired.class, event -> activityLog.record(ActivityLog.Entry.of(
                "lease.expire", "lease/" + event.leaseId(), "expired", Map.of("reason", String.valueOf(event.reason())))));
    }

    private LeaseTracker requireLeases() {
        LeaseTracker tracker = leases;
        if (tracker == null) {
            throw new IllegalStateException("lease renewal not enabled");
        }
        return tracker;
    }

    private static CoreSettings readSettings(Path file) {
        try {
            return CoreSettings.load(file, CoreSettings.defaults());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load settings: " + file, e);
        }
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            CoreSettings settings,
            String message,
            Instant checkedAt,
            List<String> changedFields
    ) {
    }

    public record StatsOutcome(
            int trees,
            Map<String, Integer> nodesByStatus,
            int staleNodes,
            long listerCalls,
            long listerFailures,
            long cacheHits,
            long coalescedWaits,
            Map<String, Long> listerCallsByTree,
            int scheduledTasks,
            int enabledTasks,
            long taskRuns,
            long taskFailures,
            long alertsRaised,
            Map<String, Integer> processesByStatus,
            int trackedLeases
    ) {
    }

    public record BackgroundStatus(
            boolean running,
            List<ScheduledTaskView> tasks,
            int trackedLeases,
            int runningProcesses,
            Instant checkedAt
    ) {
    }
}
