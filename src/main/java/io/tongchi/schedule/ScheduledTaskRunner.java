package io.tongchi.schedule;

import io.tongchi.concurrent.NamedThreadFactory;
import io.tongchi.concurrent.OperationContext;
import io.tongchi.event.EventBus;
import io.tongchi.event.TaskFinished;
import io.tongchi.model.ScheduledTaskView;
import io.tongchi.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class ScheduledTaskRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledTaskRunner.class);

    private final Clock clock;
    private final Executor workers;
    private final Duration defaultTimeout;
    private final EventBus events;
    private final Object lock;
    private final Map<String, Entry> tasks;
    private ScheduledExecutorService pump;
    private boolean stopped;

    public ScheduledTaskRunner(Clock clock, Executor workers, Duration defaultTimeout, EventBus events) {
        if (workers == null) {
            throw new IllegalArgumentException("task runner executor cannot be null");
        }
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.workers = workers;
        this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
        this.events = events;
        this.lock = new Object();
        this.tasks = new LinkedHashMap<>();
    }

    public void schedule(ScheduledTask task, TaskBody body) {
        schedule(task, body, null);
    }

    public void schedule(ScheduledTask task, TaskBody body, Duration timeout) {
        if (task == null || body == null) {
            throw new IllegalArgumentException("task and body are required");
        }
        synchronized (lock) {
            if (stopped) {
                throw new IllegalStateException("task runner stopped");
            }
            if (tasks.containsKey(task.id())) {
                throw new IllegalArgumentException("Duplicate scheduled task id: " + task.id());
            }
            Entry entry = new Entry(task.id(), body, timeout == null ? defaultTimeout : timeout);
            entry.intervalSeconds = task.intervalSeconds();
            entry.enabled = task.enabled();
            entry.nextDueAt = task.enabled() ? clock.instant().plusSeconds(task.intervalSeconds()) : null;
            tasks.put(task.id(), entry);
        }
        log.info("Scheduled task {} every {}s (enabled={})", task.id(), task.intervalSeconds(), task.enabled());
    }

    public boolean unschedule(String id) {
        Entry removed;
        synchronized (lock) {
            removed = tasks.remove(id);
        }
        if (removed != null && removed.context != null) {
            removed.context.cancel("task unscheduled");
        }
        return removed != null;
    }

    public boolean contains(String id) {
        synchronized (lock) {
            return tasks.containsKey(id);
        }
    }

    public boolean setEnabled(String id, boolean enabled) {
        synchronized (lock) {
            Entry entry = require(id);
            if (entry.enabled == enabled) {
                return false;
            }
            entry.enabled = enabled;
            entry.nextDueAt = enabled && !stopped ? clock.instant().plusSeconds(entry.intervalSeconds) : null;
        }
        log.info("Task {} {}", id, enabled ? "enabled" : "disabled");
        return true;
    }

    public void reschedule(String id, long intervalSeconds) {
        if (intervalSeconds <= 0L) {
            throw new IllegalArgumentException("scheduled task interval must be positive: " + id);
        }
        synchronized (lock) {
            Entry entry = require(id);
            if (entry.intervalSeconds == intervalSeconds) {
                return;
            }
            entry.intervalSeconds = intervalSeconds;
            if (entry.enabled && !stopped) {
                entry.nextDueAt = clock.instant().plusSeconds(intervalSeconds);
            }
        }
    }

    public boolean trigger(String id) {
        Launch launch;
        synchronized (lock) {
            Entry entry = require(id);
            if (stopped || entry.running) {
                return false;
            }
            launch = prepareLocked(entry, clock.instant());
        }
        launch(launch);
        return true;
    }

    public List<String> runDue() {
        List<Launch> launches = new ArrayList<>();
        synchronized (lock) {
            if (stopped) {
                return List.of();
            }
            Instant now = clock.instant();
            for (Entry entry : tasks.values()) {
                if (entry.enabled && !entry.running && entry.nextDueAt != null && !now.isBefore(entry.nextDueAt)) {
                    launches.add(prepareLocked(entry, now));
                }
            }
        }
        List<String> ids = new ArrayList<>(launches.size());
        for (Launch launch : launches) {
            ids.add(launch.entry.id);
            launch(launch);
        }
        return ids;
    }

    public synchronized void start(Duration tick) {
        if (pump != null) {
            return;
        }
        long tickMs = Math.max(10L, tick == null ? 1_000L : tick.toMillis());
        pump = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("task-pump"));
        pump.scheduleWithFixedDelay(() -> {
            try {
                runDue();
            } catch (RuntimeException e) {
                log.error("Unexpected error in task pump", e);
            }
        }, tickMs, tickMs, TimeUnit.MILLISECONDS);
        log.info("Task runner started with {}ms tick", tickMs);
    }

    public Optional<ScheduledTaskView> view(String id) {
        synchronized (lock) {
            Entry entry = tasks.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.toView());
        }
    }

    public List<ScheduledTaskView> views() {
        synchronized (lock) {
            List<ScheduledTaskView> out = new ArrayList<>(tasks.size());
            for (Entry entry : tasks.values()) {
                out.add(entry.toView());
            }
            return out;
        }
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        List<CompletableFuture<Void>> running = new ArrayList<>();
        synchronized (lock) {
            for (Entry entry : tasks.values()) {
                if (entry.execution != null) {
                    running.add(entry.execution);
                }
            }
        }
        if (running.isEmpty()) {
            return true;
        }
        try {
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                    .get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    public void stop(Duration grace) {
        List<OperationContext> running = new ArrayList<>();
        ScheduledExecutorService currentPump;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            for (Entry entry : tasks.values()) {
                entry.nextDueAt = null;
                if (entry.context != null) {
                    running.add(entry.context);
                }
            }
        }
        synchronized (this) {
            currentPump = pump;
            pump = null;
        }
        if (currentPump != null) {
            currentPump.shutdownNow();
        }
        for (OperationContext context : running) {
            context.cancel("task runner stopped");
        }
        try {
            if (!awaitIdle(grace == null ? Duration.ZERO : grace)) {
                log.warn("Task runner stopped with executions still running after {}", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Task runner stopped");
    }

    public void stop() {
        stop(Duration.ofSeconds(5));
    }

    @Override
    public void close() {
        stop();
    }

    private Launch prepareLocked(Entry entry, Instant now) {
        entry.running = true;
        entry.lastRunAt = now;
        entry.runCount++;
        entry.nextDueAt = entry.enabled ? now.plusSeconds(entry.intervalSeconds) : null;
        OperationContext context = OperationContext.withTimeout("task " + entry.id, entry.timeout, clock);
        entry.context = context;
        CompletableFuture<Void> execution = new CompletableFuture<>();
        entry.execution = execution;
        return new Launch(entry, context, execution);
    }

    private void launch(Launch launch) {
        AtomicBoolean finished = new AtomicBoolean(false);
        Entry entry = launch.entry;
        try {
            workers.execute(() -> execute(launch, finished));
        } catch (RejectedExecutionException e) {
            finish(launch, finished, "rejected by worker pool: " + e.getMessage());
            return;
        }
        if (!entry.timeout.isZero() && !launch.execution.isDone()) {
            long timeoutMs = Math.max(1L, entry.timeout.toMillis());
            CompletableFuture.runAsync(() -> {
                if (!finished.get() && launch.context.cancel("timed out after " + entry.timeout)) {
                    log.warn("Task {} exceeded its {} timeout; cancellation requested", entry.id, entry.timeout);
                }
            }, CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS));
        }
    }

    private void execute(Launch launch, AtomicBoolean finished) {
        OperationContext context = launch.context;
        String error = null;
        context.attach(Thread.currentThread());
        try {
            context.throwIfCancelled();
            launch.entry.body.run(context);
        } catch (InterruptedException e) {
            error = "interrupted: " + context.cancelReason().orElse("worker interrupted");
        } catch (Exception e) {
            error = describe(e);
        } catch (Error e) {
            error = describe(e);
            finish(launch, finished, error);
            throw e;
        } finally {
            context.detach();
        }
        finish(launch, finished, error);
    }

    private void finish(Launch launch, AtomicBoolean finished, String error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        Entry entry = launch.entry;
        Instant now = clock.instant();
        synchronized (lock) {
            entry.running = false;
            if (entry.context == launch.context) {
                entry.context = null;
                entry.execution = null;
            }
            if (error == null) {
                entry.lastSuccessAt = now;
                entry.lastError = null;
            } else {
                entry.failureCount++;
                entry.lastError = error;
            }
        }
        if (error != null) {
            log.warn("Scheduled task {} failed: {}", entry.id, error);
        } else {
            log.debug("Scheduled task {} completed", entry.id);
        }
        if (events != null) {
            events.publish(new TaskFinished(entry.id, error == null, error, now));
        }
        launch.execution.complete(null);
    }

    private Entry require(String id) {
        Entry entry = tasks.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown scheduled task: " + id);
        }
        return entry;
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root instanceof CompletionException && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }

    private record Launch(Entry entry, OperationContext context, CompletableFuture<Void> execution) {
    }

    private static final class Entry {
        private final String id;
        private final TaskBody body;
        private final Duration timeout;
        private long intervalSeconds;
        private boolean enabled;
        private boolean running;
        private Instant lastRunAt;
        private Instant lastSuccessAt;
        private String lastError;
        private Instant nextDueAt;
        private long runCount;
        private long failureCount;
        private OperationContext context;
        private CompletableFuture<Void> execution;

        private Entry(String id, TaskBody body, Duration timeout) {
            this.id = id;
            this.body = body;
            this.timeout = timeout;
        }

        private ScheduledTaskView toView() {
            TaskState state = running ? TaskState.RUNNING : (enabled ? TaskState.IDLE : TaskState.DISABLED);
            return new ScheduledTaskView(
                    id,
                    intervalSeconds,
                    enabled,
                    state,
                    lastRunAt,
                    lastSuccessAt,
                    lastError,
                    nextDueAt,
                    runCount,
                    failureCount
            );
        }
    }
}
