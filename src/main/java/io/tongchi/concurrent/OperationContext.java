package io.tongchi.concurrent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

/**
 * Execution context handed to every lister call, scheduled task body and long operation.
 *
 * <p>Cancellation is cooperative: {@link #cancel(String)} records a reason, runs the
 * registered listeners and interrupts the attached worker thread, but the operation decides
 * when to stop by checking {@link #isCancelled()} or calling {@link #throwIfCancelled()}.
 * A passed deadline counts as a cancellation with reason {@code "deadline exceeded"}.
 */
public final class OperationContext {
    public static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final String name;
    private final Clock clock;
    private final Instant deadline;
    private final IntConsumer progressSink;
    private final AtomicReference<String> cancelReason;
    private final List<Runnable> cancelListeners;
    private Thread worker;

    private OperationContext(String name, Clock clock, Instant deadline, IntConsumer progressSink) {
        this.name = name == null ? "operation" : name;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.deadline = deadline;
        this.progressSink = progressSink;
        this.cancelReason = new AtomicReference<>();
        this.cancelListeners = new CopyOnWriteArrayList<>();
    }

    public static OperationContext withTimeout(String name, Duration timeout, Clock clock) {
        return withTimeout(name, timeout, clock, null);
    }

    public static OperationContext withTimeout(String name, Duration timeout, Clock clock, IntConsumer progressSink) {
        Clock effective = clock == null ? Clock.systemUTC() : clock;
        Instant deadline = timeout == null || timeout.isZero() || timeout.isNegative()
                ? null
                : effective.instant().plus(timeout);
        return new OperationContext(name, effective, deadline, progressSink);
    }

    public static OperationContext unbounded(String name) {
        return new OperationContext(name, Clock.systemUTC(), null, null);
    }

    public String name() {
        return name;
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isCancelled() {
        if (cancelReason.get() != null) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public Optional<String> cancelReason() {
        String reason = cancelReason.get();
        if (reason != null) {
            return Optional.of(reason);
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return Optional.of(DEADLINE_EXCEEDED);
        }
        return Optional.empty();
    }

    public void throwIfCancelled() {
        Optional<String> reason = cancelReason();
        if (reason.isPresent()) {
            throw new CancellationException(name + " cancelled: " + reason.get());
        }
    }

    public boolean cancel(String reason) {
        String effective = reason == null || reason.isBlank() ? "cancelled" : reason;
        if (!cancelReason.compareAndSet(null, effective)) {
            return false;
        }
        synchronized (this) {
            if (worker != null) {
                worker.interrupt();
            }
        }
        for (Runnable listener : cancelListeners) {
            listener.run();
        }
        return true;
    }

    public void onCancel(Runnable listener) {
        if (listener == null) {
            return;
        }
        AtomicBoolean fired = new AtomicBoolean(false);
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) {
                listener.run();
            }
        };
        cancelListeners.add(once);
        if (cancelReason.get() != null) {
            once.run();
        }
    }

    public void reportProgress(int percent) {
        if (progressSink != null) {
            progressSink.accept(Math.max(0, Math.min(100, percent)));
        }
    }

    public synchronized void attach(Thread thread) {
        this.worker = thread;
        if (thread != null && cancelReason.get() != null) {
            thread.interrupt();
        }
    }

    public void detach() {
        synchronized (this) {
            if (worker == Thread.currentThread()) {
                worker = null;
                Thread.interrupted();
            } else {
                worker = null;
            }
        }
    }
}
