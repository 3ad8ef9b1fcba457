package io.tongchi.tree;

import io.tongchi.concurrent.OperationContext;
import io.tongchi.error.ResourceNotFoundException;
import io.tongchi.error.TransportException;
import io.tongchi.event.EventBus;
import io.tongchi.event.NodeUpdated;
import io.tongchi.model.ChildDescriptor;
import io.tongchi.model.ExpandResult;
import io.tongchi.model.NodeSnapshot;
import io.tongchi.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lazily populated forest of listing nodes for one logical namespace.
 *
 * <p>Nodes are created on first expand and loaded through the lister bound to their path.
 * Concurrent expands of the same path share one load, and lister calls for a path are
 * chained so that at most one runs at a time, even when a load is invalidated, refreshed or
 * pruned mid-flight.
 * Loads never complete exceptionally: failures come back as {@link NodeStatus#ERROR} results
 * that keep the children of the last successful load.
 */
public final class ResourceTree implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceTree.class);

    private final String name;
    private final ListerRegistry listers;
    private final Executor executor;
    private final Clock clock;
    private final EventBus events;
    private final Object lock;
    private final Map<String, Node> nodes;
    private final Map<String, CompletableFuture<Void>> callTails;
    private final AtomicLong listerCalls;
    private final AtomicLong listerFailures;
    private final AtomicLong cacheHits;
    private final AtomicLong coalescedWaits;
    private long generations;
    private volatile Duration ttl;
    private volatile Duration listerTimeout;
    private volatile boolean closed;

    public ResourceTree(String name, ListerRegistry listers, Executor executor, Clock clock,
                        Duration ttl, Duration listerTimeout, EventBus events) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tree name cannot be empty");
        }
        if (executor == null) {
            throw new IllegalArgumentException("tree executor cannot be null: " + name);
        }
        this.name = name;
        this.listers = listers == null ? new ListerRegistry() : listers;
        this.executor = executor;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.ttl = sanitizeTtl(ttl);
        this.listerTimeout = listerTimeout == null ? Duration.ZERO : listerTimeout;
        this.events = events;
        this.lock = new Object();
        this.nodes = new HashMap<>();
        this.callTails = new HashMap<>();
        this.listerCalls = new AtomicLong(0L);
        this.listerFailures = new AtomicLong(0L);
        this.cacheHits = new AtomicLong(0L);
        this.coalescedWaits = new AtomicLong(0L);
    }

    public String name() {
        return name;
    }

    public ListerRegistry listers() {
        return listers;
    }

    public Duration ttl() {
        return ttl;
    }

    public void setTtl(Duration newTtl) {
        this.ttl = sanitizeTtl(newTtl);
    }

    public Duration listerTimeout() {
        return listerTimeout;
    }

    public void setListerTimeout(Duration value) {
        this.listerTimeout = value == null || value.isNegative() ? Duration.ZERO : value;
    }

    public void setNodeTtl(String path, Duration nodeTtl) {
        synchronized (lock) {
            Node node = nodes.computeIfAbsent(path, this::newNodeLocked);
            node.ttlOverride = nodeTtl == null ? null : sanitizeTtl(nodeTtl);
        }
    }

    public static String childPath(String parentPath, ChildDescriptor child) {
        return (parentPath == null ? "" : parentPath) + child.path();
    }

    public ExpandResult expand(String path) {
        return await(path, expandAsync(path), null);
    }

    // An abandoned wait leaves the load running; its result is still cached.
    public ExpandResult expand(String path, Duration maxWait) {
        return await(path, expandAsync(path), maxWait);
    }

    // Each caller gets its own copy, so cancelling it abandons only that wait.
    public CompletableFuture<ExpandResult> expandAsync(String path) {
        requirePath(path);
        List<NodeUpdated> pending = new ArrayList<>();
        List<Runnable> completions = new ArrayList<>();
        CompletableFuture<ExpandResult> shared;
        synchronized (lock) {
            if (closed) {
                return closedResult(path);
            }
            Node node = nodes.computeIfAbsent(path, this::newNodeLocked);
            Instant now = clock.instant();
            if (node.status == NodeStatus.LOADED && !isStale(node, now)) {
                cacheHits.incrementAndGet();
                return CompletableFuture.completedFuture(new ExpandResult(
                        path, NodeStatus.LOADED, node.children, null, node.loadedAt, true, false, false));
            }
            if (node.inFlight != null && node.inFlightGeneration == node.generation) {
                coalescedWaits.incrementAndGet();
                shared = node.inFlight;
            } else {
                shared = startLoadLocked(node, pending, completions);
            }
        }
        publish(pending);
        completions.forEach(Runnable::run);
        return shared.copy();
    }

    public NodeSnapshot peek(String path) {
        synchronized (lock) {
            Node node = path == null ? null : nodes.get(path);
            if (node == null) {
                return NodeSnapshot.unknown(path);
            }
            return snapshotLocked(node, clock.instant());
        }
    }

    // A load already running for an invalidated node still answers its waiters but is not cached.
    public int invalidate(String path, boolean recursive) {
        List<NodeUpdated> pending = new ArrayList<>();
        int count;
        synchronized (lock) {
            Set<String> targets = collectLocked(path, recursive);
            Instant now = clock.instant();
            for (String target : targets) {
                Node node = nodes.get(target);
                node.generation = ++generations;
                node.status = NodeStatus.NOT_LOADED;
                node.children = null;
                node.loadedAt = null;
                node.lastError = null;
                pending.add(new NodeUpdated(name, target, NodeStatus.NOT_LOADED, now));
            }
            count = targets.size();
        }
        publish(pending);
        return count;
    }

    public int prune(String path) {
        synchronized (lock) {
            Set<String> targets = collectLocked(path, true);
            for (String target : targets) {
                nodes.remove(target);
            }
            if (!targets.isEmpty()) {
                log.debug("Pruned {} node(s) under {} in tree {}", targets.size(), path, name);
            }
            return targets.size();
        }
    }

    public ExpandResult refresh(String path) {
        return await(path, refreshAsync(path), null);
    }

    // Unlike invalidate, the last good children stay visible while reloading and survive a failure.
    public CompletableFuture<ExpandResult> refreshAsync(String path) {
        requirePath(path);
        List<NodeUpdated> pending = new ArrayList<>();
        List<Runnable> completions = new ArrayList<>();
        CompletableFuture<ExpandResult> shared;
        synchronized (lock) {
            if (closed) {
                return closedResult(path);
            }
            Node node = nodes.computeIfAbsent(path, this::newNodeLocked);
            node.generation = ++generations;
            shared = startLoadLocked(node, pending, completions);
        }
        publish(pending);
        completions.forEach(Runnable::run);
        return shared.copy();
    }

    public TreeStats stats() {
        Map<NodeStatus, Integer> byStatus = new EnumMap<>(NodeStatus.class);
        for (NodeStatus status : NodeStatus.values()) {
            byStatus.put(status, 0);
        }
        int staleNodes = 0;
        synchronized (lock) {
            Instant now = clock.instant();
            for (Node node : nodes.values()) {
                byStatus.merge(node.status, 1, Integer::sum);
                if (isStale(node, now)) {
                    staleNodes++;
                }
            }
        }
        return new TreeStats(
                name,
                Map.copyOf(byStatus),
                staleNodes,
                listerCalls.get(),
                listerFailures.get(),
                cacheHits.get(),
                coalescedWaits.get()
        );
    }

    @Override
    public void close() {
        List<OperationContext> running = new ArrayList<>();
        synchronized (lock) {
            closed = true;
            for (Node node : nodes.values()) {
                if (node.inFlightContext != null) {
                    running.add(node.inFlightContext);
                }
            }
            nodes.clear();
        }
        for (OperationContext context : running) {
            context.cancel("tree closed");
        }
    }

    private CompletableFuture<ExpandResult> startLoadLocked(Node node, List<NodeUpdated> pending,
                                                           List<Runnable> completions) {
        long generation = node.generation;
        String path = node.path;
        CompletableFuture<ExpandResult> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean(false);
        Duration timeout = listerTimeout;
        OperationContext context = OperationContext.withTimeout("list " + name + ":" + path, timeout, clock);

        node.status = NodeStatus.LOADING;
        node.inFlight = result;
        node.inFlightGeneration = generation;
        node.inFlightContext = context;
        pending.add(new NodeUpdated(name, path, NodeStatus.LOADING, clock.instant()));

        Optional<Lister> lister = listers.resolve(path);
        if (lister.isEmpty()) {
            ExpandResult outcome = settleLocked(path, generation, result, settled, null,
                    "no lister bound for path: " + path, pending);
            completions.add(() -> result.complete(outcome));
            return result;
        }

        // Tails are keyed by path, not node, so a pruned and re-created node still waits its turn.
        // The call is gated until the caller has published LOADING, so LOADED never overtakes it.
        CompletableFuture<Void> published = new CompletableFuture<>();
        completions.add(() -> published.complete(null));
        CompletableFuture<Void> previous = callTails.getOrDefault(path, CompletableFuture.completedFuture(null));
        CompletableFuture<Void> call = previous.thenCombine(published, (left, right) -> (Void) null)
                .thenRunAsync(() -> runLister(path, generation, lister.get(), context, result, settled), executor);
        CompletableFuture<Void> tail = call.handle((ignored, error) -> null);
        callTails.put(path, tail);
        tail.whenComplete((ignored, error) -> {
            synchronized (lock) {
                callTails.remove(path, tail);
            }
        });
        call.whenComplete((ignored, error) -> {
            if (error != null) {
                settle(path, generation, result, settled, null, describe(error));
            }
        });

        if (!timeout.isZero()) {
            long timeoutMs = Math.max(1L, timeout.toMillis());
            CompletableFuture.runAsync(() -> {
                if (!settled.get() && context.cancel("timed out after " + timeout)
                        && settle(path, generation, result, settled, null, "lister timed out after " + timeout)) {
                    log.warn("Lister for {}:{} timed out after {}", name, path, timeout);
                }
            }, CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS));
        }
        return result;
    }

    private void runLister(String path, long generation, Lister lister, OperationContext context,
                           CompletableFuture<ExpandResult> result, AtomicBoolean settled) {
        if (settled.get()) {
            return;
        }
        listerCalls.incrementAndGet();
        context.attach(Thread.currentThread());
        List<ChildDescriptor> children = null;
        String error = null;
        try {
            context.throwIfCancelled();
            List<ChildDescriptor> listed = lister.list(path, context);
            children = listed == null ? List.of() : List.copyOf(listed);
        } catch (ResourceNotFoundException e) {
            children = List.of();
        } catch (TransportException e) {
            error = describe(e);
        } catch (CancellationException e) {
            error = describe(e);
        } catch (InterruptedException e) {
            error = "interrupted: " + context.cancelReason().orElse("worker interrupted");
        } catch (Exception e) {
            error = describe(e);
        } finally {
            context.detach();
        }
        if (error != null) {
            log.debug("Lister failed for {}:{}: {}", name, path, error);
        }
        settle(path, generation, result, settled, children, error);
    }

    // Counters and events are updated before waiters see the outcome.
    private boolean settle(String path, long generation, CompletableFuture<ExpandResult> result, AtomicBoolean settled,
                           List<ChildDescriptor> children, String error) {
        List<NodeUpdated> pending = new ArrayList<>();
        ExpandResult outcome;
        synchronized (lock) {
            outcome = settleLocked(path, generation, result, settled, children, error, pending);
        }
        if (outcome == null) {
            return false;
        }
        if (error != null) {
            listerFailures.incrementAndGet();
        }
        publish(pending);
        result.complete(outcome);
        return true;
    }

    private ExpandResult settleLocked(String path, long generation, CompletableFuture<ExpandResult> result,
                                      AtomicBoolean settled, List<ChildDescriptor> children, String error,
                                      List<NodeUpdated> pending) {
        if (!settled.compareAndSet(false, true)) {
            return null;
        }
        Instant now = clock.instant();
        Node node = nodes.get(path);
        ExpandResult outcome;
        if (node != null && node.generation == generation) {
            if (error == null) {
                node.status = NodeStatus.LOADED;
                node.children = children;
                node.loadedAt = now;
                node.lastError = null;
                node.linkedChildren = linkChildren(path, children);
            } else {
                node.status = NodeStatus.ERROR;
                node.lastError = error;
            }
            outcome = new ExpandResult(path, node.status, node.children, node.lastError, node.loadedAt, false, false, false);
            pending.add(new NodeUpdated(name, path, node.status, now));
        } else {
            // Node was invalidated or pruned while the call ran; answer waiters without caching.
            outcome = error == null
                    ? new ExpandResult(path, NodeStatus.LOADED, children, null, now, false, false, false)
                    : new ExpandResult(path, NodeStatus.ERROR, List.of(), error, null, false, false, false);
        }
        if (node != null && node.inFlight == result) {
            node.inFlight = null;
            node.inFlightContext = null;
        }
        return outcome;
    }

    private Set<String> linkChildren(String path, List<ChildDescriptor> children) {
        Set<String> linked = new LinkedHashSet<>();
        for (ChildDescriptor child : children) {
            String childPath = childPath(path, child);
            if (!childPath.equals(path)) {
                linked.add(childPath);
            }
        }
        return linked;
    }

    private Set<String> collectLocked(String path, boolean recursive) {
        Set<String> out = new LinkedHashSet<>();
        if (path == null || !nodes.containsKey(path)) {
            return out;
        }
        List<String> queue = new ArrayList<>();
        queue.add(path);
        while (!queue.isEmpty()) {
            String current = queue.remove(queue.size() - 1);
            Node node = nodes.get(current);
            if (node == null || !out.add(current)) {
                continue;
            }
            if (recursive) {
                queue.addAll(node.linkedChildren);
            }
        }
        return out;
    }

    private NodeSnapshot snapshotLocked(Node node, Instant now) {
        return new NodeSnapshot(
                node.path,
                node.status,
                node.children,
                node.loadedAt,
                node.lastError,
                isStale(node, now),
                node.inFlight != null
        );
    }

    private boolean isStale(Node node, Instant now) {
        if (node.status != NodeStatus.LOADED || node.loadedAt == null) {
            return false;
        }
        Duration effective = node.ttlOverride != null ? node.ttlOverride : ttl;
        if (effective.isZero()) {
            return false;
        }
        return !now.isBefore(node.loadedAt.plus(effective));
    }

    private ExpandResult await(String path, CompletableFuture<ExpandResult> future, Duration maxWait) {
        try {
            if (maxWait == null) {
                return future.get();
            }
            return future.get(Math.max(0L, maxWait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            return ExpandResult.fromSnapshot(peek(path), false, true, "interrupted while waiting");
        } catch (TimeoutException e) {
            future.cancel(false);
            return ExpandResult.fromSnapshot(peek(path), false, true, "wait abandoned after " + maxWait);
        } catch (CancellationException e) {
            return ExpandResult.fromSnapshot(peek(path), false, true, "wait cancelled");
        } catch (ExecutionException e) {
            return new ExpandResult(path, NodeStatus.ERROR, List.of(), describe(e.getCause()), null, false, false, false);
        }
    }

    private void publish(List<NodeUpdated> pending) {
        if (events == null) {
            return;
        }
        for (NodeUpdated event : pending) {
            events.publish(event);
        }
    }

    // Generations are unique across the tree so a load started before a prune never matches the re-created node.
    private Node newNodeLocked(String path) {
        return new Node(path, ++generations);
    }

    private CompletableFuture<ExpandResult> closedResult(String path) {
        return CompletableFuture.completedFuture(
                new ExpandResult(path, NodeStatus.ERROR, List.of(), "tree closed: " + name, null, false, false, false));
    }

    private static void requirePath(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
    }

    private static Duration sanitizeTtl(Duration value) {
        return value == null || value.isNegative() ? Duration.ZERO : value;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        Throwable root = error;
        while ((root instanceof ExecutionException || root instanceof CompletionException)
                && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }

    public record TreeStats(
            String tree,
            Map<NodeStatus, Integer> nodesByStatus,
            int staleNodes,
            long listerCalls,
            long listerFailures,
            long cacheHits,
            long coalescedWaits
    ) {
    }

    private static final class Node {
        private final String path;
        private NodeStatus status;
        private List<ChildDescriptor> children;
        private Instant loadedAt;
        private String lastError;
        private Duration ttlOverride;
        private Set<String> linkedChildren;
        private long generation;
        private CompletableFuture<ExpandResult> inFlight;
        private OperationContext inFlightContext;
        private long inFlightGeneration;

        private Node(String path, long generation) {
            this.path = path;
            this.status = NodeStatus.NOT_LOADED;
            this.linkedChildren = Set.of();
            this.generation = generation;
        }
    }
}
