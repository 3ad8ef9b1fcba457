package io.tongchi.process;

import io.tongchi.concurrent.OperationContext;
import io.tongchi.error.InvariantViolationException;
import io.tongchi.event.EventBus;
import io.tongchi.event.ProcessChanged;
import io.tongchi.model.ProcessStatus;
import io.tongchi.model.ProcessView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tracks long-running operations submitted by the user.
 *
 * <p>Every handle reaches exactly one terminal status. The worker running the operation is the
 * only writer of {@code COMPLETED}/{@code FAILED}; {@link #cancel(String)} writes
 * {@code CANCELLED} directly only for a handle that has not started yet, and otherwise just
 * signals the operation's context. A running operation that ends by observing the
 * cancellation is recorded as cancelled; one that ignores it keeps its natural outcome.
 */
public final class ProcessRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final Executor executor;
    private final Clock clock;
    private final EventBus events;
    private final Object lock;
    private final Map<String, Handle> handles;
    private volatile Duration retention;
    private volatile Duration operationTimeout;
    private volatile boolean closed;

    public ProcessRegistry(Executor executor, Clock clock, Duration retention, EventBus events) {
        if (executor == null) {
            throw new IllegalArgumentException("process executor cannot be null");
        }
        this.executor = executor;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.retention = retention == null || retention.isNegative() ? Duration.ofHours(1) : retention;
        this.operationTimeout = Duration.ZERO;
        this.events = events;
        this.lock = new Object();
        this.handles = new LinkedHashMap<>();
    }

    public Duration retention() {
        return retention;
    }

    public void setRetention(Duration value) {
        if (value != null && !value.isNegative()) {
            this.retention = value;
        }
    }

    public void setOperationTimeout(Duration value) {
        this.operationTimeout = value == null || value.isNegative() ? Duration.ZERO : value;
    }

    public <T> ProcessView submit(String name, String description, boolean cancellable, LongOperation<T> operation) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("process name cannot be empty");
        }
        if (operation == null) {
            throw new IllegalArgumentException("process operation cannot be null: " + name);
        }
        if (closed) {
            throw new IllegalStateException("process registry closed");
        }
        Instant now = clock.instant();
        Handle handle = new Handle("proc_" + UUID.randomUUID(), name, description == null ? "" : description,
                cancellable, now);
        handle.context = OperationContext.withTimeout("process " + name, operationTimeout, clock,
                percent -> onProgress(handle, percent));
        synchronized (lock) {
            handles.put(handle.id, handle);
        }
        ProcessView submitted = handle.view();
        log.info("Submitted process {} ({}) cancellable={}", handle.id, name, cancellable);
        publish(submitted);
        try {
            executor.execute(() -> run(handle, operation));
        } catch (RejectedExecutionException e) {
            ProcessView failed = handle.failIfPending("rejected by worker pool: " + e.getMessage(), clock.instant());
            if (failed == null) {
                // A cancel already settled the handle before the pool refused it.
                return handle.view();
            }
            log.warn("Process {} ({}) rejected by worker pool", handle.id, name);
            publish(failed);
            return failed;
        }
        return submitted;
    }

    public boolean cancel(String id) {
        Handle handle = find(id);
        if (handle == null) {
            log.info("Cancel ignored for unknown process {}", id);
            return false;
        }
        Handle.CancelOutcome outcome = handle.requestCancel(clock.instant());
        switch (outcome) {
            case NOT_CANCELLABLE:
                log.warn("Process {} ({}) is not cancellable; cancel request ignored", id, handle.name);
                return false;
            case ALREADY_TERMINAL:
                log.info("Cancel ignored for finished process {}", id);
                return false;
            case CANCELLED_BEFORE_START:
                log.info("Process {} cancelled before start", id);
                handle.context.cancel("cancelled by user");
                publish(handle.view());
                return true;
            case SIGNALLED:
            default:
                log.info("Cancellation requested for process {}", id);
                handle.context.cancel("cancelled by user");
                publish(handle.view());
                return true;
        }
    }

    public Optional<ProcessView> get(String id) {
        Handle handle = find(id);
        return handle == null ? Optional.empty() : Optional.of(handle.view());
    }

    public List<ProcessView> list(ProcessStatus filter) {
        List<ProcessView> out = new ArrayList<>();
        for (Handle handle : snapshotHandles()) {
            ProcessView view = handle.view();
            if (filter == null || view.status() == filter) {
                out.add(view);
            }
        }
        return out;
    }

    public List<ProcessView> running() {
        return list(ProcessStatus.RUNNING);
    }

    public List<ProcessView> recent(int limit) {
        List<ProcessView> all = list(null);
        all.sort(Comparator.comparing(ProcessView::submittedAt).reversed());
        return all.size() <= limit ? all : new ArrayList<>(all.subList(0, Math.max(0, limit)));
    }

    public Map<ProcessStatus, Integer> countByStatus() {
        Map<ProcessStatus, Integer> counts = new EnumMap<>(ProcessStatus.class);
        for (ProcessStatus status : ProcessStatus.values()) {
            counts.put(status, 0);
        }
        for (Handle handle : snapshotHandles()) {
            counts.merge(handle.view().status(), 1, Integer::sum);
        }
        return counts;
    }

    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        synchronized (lock) {
            Iterator<Handle> it = handles.values().iterator();
            while (it.hasNext()) {
                ProcessView view = it.next().view();
                if (view.status().terminal() && view.finishedAt() != null && view.finishedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Swept {} finished process(es) older than {}", removed, retention);
        }
        return removed;
    }

    public Optional<ProcessView> awaitTermination(String id, Duration timeout) throws InterruptedException {
        Handle handle = find(id);
        if (handle == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(handle.done.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.of(handle.view());
        } catch (ExecutionException e) {
            return Optional.of(handle.view());
        }
    }

    public int size() {
        synchronized (lock) {
            return handles.size();
        }
    }

    @Override
    public void close() {
        closed = true;
        for (Handle handle : snapshotHandles()) {
            if (handle.cancellable && !handle.view().status().terminal()) {
                handle.context.cancel("registry closed");
            }
        }
    }

    private <T> void run(Handle handle, LongOperation<T> operation) {
        OperationContext context = handle.context;
        ProcessView started = handle.markRunning(clock.instant());
        if (started == null) {
            return;
        }
        publish(started);
        ProcessStatus status;
        Object result = null;
        String error = null;
        context.attach(Thread.currentThread());
        try {
            result = operation.run(context);
            status = ProcessStatus.COMPLETED;
        } catch (CancellationException | InterruptedException e) {
            status = handle.cancelRequested() ? ProcessStatus.CANCELLED : ProcessStatus.FAILED;
            error = context.cancelReason().orElse(describe(e));
        } catch (Exception e) {
            status = handle.cancelRequested() && context.isCancelled() ? ProcessStatus.CANCELLED : ProcessStatus.FAILED;
            error = describe(e);
        } catch (Error e) {
            publish(handle.finishFromRunner(ProcessStatus.FAILED, null, describe(e), clock.instant()));
            throw e;
        } finally {
            context.detach();
        }
        ProcessView finished = handle.finishFromRunner(status, result, error, clock.instant());
        if (status == ProcessStatus.FAILED) {
            log.warn("Process {} ({}) failed: {}", handle.id, handle.name, error);
        } else {
            log.info("Process {} ({}) finished as {}", handle.id, handle.name, status);
        }
        publish(finished);
    }

    private void onProgress(Handle handle, int percent) {
        ProcessView updated = handle.updateProgress(percent);
        if (updated != null) {
            publish(updated);
        }
    }

    private Handle find(String id) {
        if (id == null) {
            return null;
        }
        synchronized (lock) {
            return handles.get(id);
        }
    }

    private List<Handle> snapshotHandles() {
        synchronized (lock) {
            return new ArrayList<>(handles.values());
        }
    }

    private void publish(ProcessView view) {
        if (events != null && view != null) {
            events.publish(new ProcessChanged(view, clock.instant()));
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static final class Handle {
        enum CancelOutcome {
            NOT_CANCELLABLE,
            ALREADY_TERMINAL,
            CANCELLED_BEFORE_START,
            SIGNALLED
        }

        private final String id;
        private final String name;
        private final String description;
        private final boolean cancellable;
        private final Instant submittedAt;
        private final CompletableFuture<ProcessView> done;
        private OperationContext context;
        private ProcessStatus status;
        private Instant startedAt;
        private Instant finishedAt;
        private boolean cancelRequested;
        private int progress;
        private Object result;
        private String error;

        private Handle(String id, String name, String description, boolean cancellable, Instant submittedAt) {
            this.id = id;
            this.name = name;
            this.description = description;
            this.cancellable = cancellable;
            this.submittedAt = submittedAt;
            this.done = new CompletableFuture<>();
            this.status = ProcessStatus.PENDING;
        }

        synchronized ProcessView view() {
            return new ProcessView(id, name, description, status, submittedAt, startedAt, finishedAt,
                    cancellable, cancelRequested, progress, result, error);
        }

        synchronized boolean cancelRequested() {
            return cancelRequested;
        }

        synchronized ProcessView markRunning(Instant now) {
            if (status != ProcessStatus.PENDING) {
                return null;
            }
            status = ProcessStatus.RUNNING;
            startedAt = now;
            return view();
        }

        synchronized CancelOutcome requestCancel(Instant now) {
            if (status.terminal()) {
                return CancelOutcome.ALREADY_TERMINAL;
            }
            if (!cancellable) {
                return CancelOutcome.NOT_CANCELLABLE;
            }
            cancelRequested = true;
            if (status == ProcessStatus.PENDING) {
                terminate(ProcessStatus.CANCELLED, null, "cancelled before start", now);
                return CancelOutcome.CANCELLED_BEFORE_START;
            }
            return CancelOutcome.SIGNALLED;
        }

        synchronized ProcessView finishFromRunner(ProcessStatus terminal, Object value, String message, Instant now) {
            if (status.terminal()) {
                throw new InvariantViolationException(
                        "process " + id + " already " + status + "; refusing transition to " + terminal);
            }
            terminate(terminal, value, message, now);
            return view();
        }

        synchronized ProcessView failIfPending(String message, Instant now) {
            if (status.terminal()) {
                return null;
            }
            terminate(ProcessStatus.FAILED, null, message, now);
            return view();
        }

        synchronized ProcessView updateProgress(int percent) {
            if (status.terminal() || percent == progress) {
                return null;
            }
            progress = percent;
            return view();
        }

        private void terminate(ProcessStatus terminal, Object value, String message, Instant now) {
            status = terminal;
            finishedAt = now;
            if (terminal == ProcessStatus.COMPLETED) {
                result = value;
                error = null;
                progress = 100;
            } else {
                result = null;
                error = message;
            }
            done.complete(view());
        }
    }
}
