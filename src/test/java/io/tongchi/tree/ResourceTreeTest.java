package io.tongchi.tree;

import io.tongchi.error.ResourceNotFoundException;
import io.tongchi.error.TransportException;
import io.tongchi.event.EventBus;
import io.tongchi.event.NodeUpdated;
import io.tongchi.model.ChildDescriptor;
import io.tongchi.model.ExpandResult;
import io.tongchi.model.NodeSnapshot;
import io.tongchi.model.NodeStatus;
import io.tongchi.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class ResourceTreeTest {
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentExpandsShareOneListerCall() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("jobs/", (path, context) -> {
            calls.incrementAndGet();
            Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(ChildDescriptor.leaf("api"), ChildDescriptor.leaf("worker"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        List<CompletableFuture<ExpandResult>> waits = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            waits.add(tree.expandAsync("jobs/"));
        }
        Assertions.assertEquals(NodeStatus.LOADING, tree.peek("jobs/").status());
        Assertions.assertTrue(tree.peek("jobs/").loadInFlight());
        release.countDown();

        for (CompletableFuture<ExpandResult> wait : waits) {
            ExpandResult result = wait.get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(NodeStatus.LOADED, result.status());
            Assertions.assertEquals(List.of("api", "worker"), paths(result.children()));
        }
        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals(4L, tree.stats().coalescedWaits());
    }

    @Test
    void blockingExpandsFromManyThreadsShareOneListerCall() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            calls.incrementAndGet();
            entered.countDown();
            Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(ChildDescriptor.container("kv/"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Future<ExpandResult>> results = new ArrayList<>();
            results.add(callers.submit(() -> tree.expand("")));
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
            results.add(callers.submit(() -> tree.expand("")));
            results.add(callers.submit(() -> tree.expand("")));
            release.countDown();
            for (Future<ExpandResult> result : results) {
                Assertions.assertEquals(List.of("kv/"), paths(result.get(5, TimeUnit.SECONDS).children()));
            }
        } finally {
            callers.shutdownNow();
        }
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void invalidateForcesExactlyOneNewCall() {
        AtomicInteger calls = new AtomicInteger();
        ListerRegistry listers = new ListerRegistry();
        listers.bind("services/", (path, context) -> {
            calls.incrementAndGet();
            return List.of(ChildDescriptor.leaf("consul"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        Assertions.assertTrue(tree.expand("services/").ok());
        ExpandResult cached = tree.expand("services/");
        Assertions.assertTrue(cached.fromCache());
        Assertions.assertEquals(1, calls.get());

        Assertions.assertEquals(1, tree.invalidate("services/", false));
        Assertions.assertEquals(NodeStatus.NOT_LOADED, tree.peek("services/").status());
        Assertions.assertNull(tree.peek("services/").children());

        Assertions.assertTrue(tree.expand("services/").ok());
        Assertions.assertTrue(tree.expand("services/").fromCache());
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void secretMountExampleUsesLongestPrefixAndNonRecursiveInvalidate() {
        AtomicInteger mountCalls = new AtomicInteger();
        AtomicInteger appCalls = new AtomicInteger();
        ListerRegistry listers = new ListerRegistry();
        listers.bind("secret/", (path, context) -> {
            mountCalls.incrementAndGet();
            return List.of(ChildDescriptor.container("app1/"), ChildDescriptor.leaf("app1/db"));
        });
        listers.bind("secret/app1/", (path, context) -> {
            appCalls.incrementAndGet();
            return List.of(ChildDescriptor.leaf("user"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        ExpandResult mount = tree.expand("secret/");
        Assertions.assertEquals(NodeStatus.LOADED, mount.status());
        Assertions.assertEquals(List.of("app1/", "app1/db"), paths(mount.children()));
        Assertions.assertTrue(mount.children().get(0).container());
        Assertions.assertFalse(mount.children().get(1).container());

        String appPath = ResourceTree.childPath("secret/", mount.children().get(0));
        Assertions.assertEquals("secret/app1/", appPath);
        ExpandResult app = tree.expand(appPath);
        Assertions.assertEquals(List.of("user"), paths(app.children()));

        Assertions.assertEquals(1, tree.invalidate("secret/", false));
        Assertions.assertEquals(NodeStatus.LOADED, tree.peek("secret/app1/").status());
        tree.expand("secret/");
        Assertions.assertEquals(2, mountCalls.get());
        Assertions.assertEquals(1, appCalls.get());
    }

    @Test
    void recursiveInvalidateReachesLoadedDescendants() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("secret/", (path, context) -> path.equals("secret/")
                ? List.of(ChildDescriptor.container("app1/"))
                : List.of(ChildDescriptor.leaf("user")));
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        tree.expand("secret/");
        tree.expand("secret/app1/");

        Assertions.assertEquals(2, tree.invalidate("secret/", true));
        Assertions.assertEquals(NodeStatus.NOT_LOADED, tree.peek("secret/app1/").status());
    }

    @Test
    void failedRefreshKeepsPreviousChildren() {
        AtomicBoolean failing = new AtomicBoolean(false);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("nomad/", (path, context) -> {
            if (failing.get()) {
                throw new TransportException("connection refused", 503, null);
            }
            return List.of(ChildDescriptor.leaf("web").withStatus("running"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        Assertions.assertTrue(tree.expand("nomad/").ok());

        failing.set(true);
        ExpandResult failed = tree.refresh("nomad/");
        Assertions.assertEquals(NodeStatus.ERROR, failed.status());
        Assertions.assertEquals("connection refused", failed.error());
        Assertions.assertEquals(List.of("web"), paths(failed.children()));
        NodeSnapshot snapshot = tree.peek("nomad/");
        Assertions.assertEquals(NodeStatus.ERROR, snapshot.status());
        Assertions.assertEquals("connection refused", snapshot.lastError());

        failing.set(false);
        ExpandResult recovered = tree.expand("nomad/");
        Assertions.assertTrue(recovered.ok());
        Assertions.assertNull(tree.peek("nomad/").lastError());
        Assertions.assertEquals(1L, tree.stats().listerFailures());
    }

    @Test
    void errorWithoutPriorListingHasNoChildren() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            throw new TransportException("permission denied", 403, null);
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        ExpandResult result = tree.expand("sys/");
        Assertions.assertEquals(NodeStatus.ERROR, result.status());
        Assertions.assertTrue(result.children().isEmpty());
        Assertions.assertNull(tree.peek("sys/").children());
    }

    @Test
    void notFoundIsAnEmptyListing() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("secret/", (path, context) -> {
            throw new ResourceNotFoundException(path);
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        ExpandResult result = tree.expand("secret/empty/");
        Assertions.assertTrue(result.ok());
        Assertions.assertTrue(result.children().isEmpty());
        Assertions.assertEquals(0L, tree.stats().listerFailures());
    }

    @Test
    void unboundPathIsAnError() {
        ResourceTree tree = tree(new ListerRegistry(), Clock.systemUTC(), Duration.ZERO);
        ExpandResult result = tree.expand("consul/");
        Assertions.assertEquals(NodeStatus.ERROR, result.status());
        Assertions.assertTrue(result.error().contains("no lister bound"));
    }

    @Test
    void loadedNodeGoesStaleAfterTtl() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        AtomicInteger calls = new AtomicInteger();
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            calls.incrementAndGet();
            return List.of(ChildDescriptor.leaf("a"));
        });
        ResourceTree tree = tree(listers, clock, Duration.ofSeconds(60));
        tree.expand("jobs/");
        Assertions.assertTrue(tree.peek("jobs/").trusted());

        clock.advanceSeconds(59);
        Assertions.assertTrue(tree.expand("jobs/").fromCache());

        clock.advanceSeconds(2);
        NodeSnapshot stale = tree.peek("jobs/");
        Assertions.assertEquals(NodeStatus.LOADED, stale.status());
        Assertions.assertTrue(stale.stale());
        Assertions.assertFalse(stale.trusted());
        Assertions.assertEquals(1, tree.stats().staleNodes());

        ExpandResult reloaded = tree.expand("jobs/");
        Assertions.assertFalse(reloaded.fromCache());
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void nodeTtlOverridesTreeDefault() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> List.of(ChildDescriptor.leaf("a")));
        ResourceTree tree = tree(listers, clock, Duration.ZERO);
        tree.setNodeTtl("runs/", Duration.ofSeconds(5));
        tree.expand("runs/");
        tree.expand("orgs/");

        clock.advanceSeconds(10);
        Assertions.assertTrue(tree.peek("runs/").stale());
        Assertions.assertFalse(tree.peek("orgs/").stale());
    }

    @Test
    void abandonedWaitLeavesLoadRunningAndCachesItsResult() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            calls.incrementAndGet();
            Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(ChildDescriptor.leaf("slow"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        ExpandResult abandoned = tree.expand("hcp/", Duration.ofMillis(50));
        Assertions.assertTrue(abandoned.abandoned());
        Assertions.assertEquals(NodeStatus.LOADING, abandoned.status());

        release.countDown();
        ExpandResult loaded = tree.expand("hcp/");
        Assertions.assertTrue(loaded.ok());
        Assertions.assertEquals(List.of("slow"), paths(loaded.children()));
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void loadInvalidatedMidFlightAnswersWaitersWithoutCaching() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            if (calls.incrementAndGet() == 1) {
                Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
                return List.of(ChildDescriptor.leaf("old"));
            }
            return List.of(ChildDescriptor.leaf("new"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        CompletableFuture<ExpandResult> first = tree.expandAsync("kv/");
        tree.invalidate("kv/", false);
        release.countDown();

        ExpandResult answered = first.get(5, TimeUnit.SECONDS);
        Assertions.assertEquals(List.of("old"), paths(answered.children()));
        Assertions.assertEquals(NodeStatus.NOT_LOADED, tree.peek("kv/").status());

        ExpandResult fresh = tree.expand("kv/");
        Assertions.assertEquals(List.of("new"), paths(fresh.children()));
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void slowListerTimesOutAsError() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> {
            while (!context.isCancelled()) {
                Thread.sleep(10);
            }
            return List.of(ChildDescriptor.leaf("late"));
        });
        ResourceTree tree = new ResourceTree("vault", listers, executor, Clock.systemUTC(),
                Duration.ZERO, Duration.ofMillis(100), null);

        ExpandResult result = tree.expand("secret/");
        Assertions.assertEquals(NodeStatus.ERROR, result.status());
        Assertions.assertTrue(result.error().contains("timed out"));
        Assertions.assertEquals(1L, tree.stats().listerFailures());
    }

    @Test
    void pruneDropsNodeAndKnownSubtree() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("secret/", (path, context) -> path.equals("secret/")
                ? List.of(ChildDescriptor.container("app1/"))
                : List.of());
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        tree.expand("secret/");
        tree.expand("secret/app1/");

        Assertions.assertEquals(2, tree.prune("secret/"));
        Assertions.assertEquals(NodeSnapshot.unknown("secret/app1/"), tree.peek("secret/app1/"));
        Assertions.assertEquals(0, tree.prune("secret/"));
    }

    @Test
    void pruneDuringLoadNeverOverlapsListerCalls() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("kv/", (path, context) -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                if (calls.incrementAndGet() == 1) {
                    entered.countDown();
                    Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
                }
                return List.of(ChildDescriptor.leaf("config"));
            } finally {
                active.decrementAndGet();
            }
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);

        CompletableFuture<ExpandResult> first = tree.expandAsync("kv/");
        Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
        Assertions.assertEquals(1, tree.prune("kv/"));
        CompletableFuture<ExpandResult> second = tree.expandAsync("kv/");
        Thread.sleep(100);
        Assertions.assertEquals(1, calls.get());

        release.countDown();
        Assertions.assertTrue(first.get(5, TimeUnit.SECONDS).ok());
        Assertions.assertTrue(second.get(5, TimeUnit.SECONDS).ok());
        Assertions.assertEquals(2, calls.get());
        Assertions.assertEquals(1, maxActive.get());
        Assertions.assertEquals(NodeStatus.LOADED, tree.peek("kv/").status());
    }

    @Test
    void refreshKeepsChildrenVisibleWhileReloading() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ListerRegistry listers = new ListerRegistry();
        listers.bind("consul/", (path, context) -> {
            if (calls.incrementAndGet() == 1) {
                return List.of(ChildDescriptor.leaf("api"));
            }
            Assertions.assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(ChildDescriptor.leaf("api"), ChildDescriptor.leaf("db"));
        });
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        tree.expand("consul/");

        CompletableFuture<ExpandResult> refreshing = tree.refreshAsync("consul/");
        NodeSnapshot during = tree.peek("consul/");
        Assertions.assertEquals(NodeStatus.LOADING, during.status());
        Assertions.assertEquals(List.of("api"), paths(during.children()));

        release.countDown();
        Assertions.assertEquals(List.of("api", "db"), paths(refreshing.get(5, TimeUnit.SECONDS).children()));
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void loadsPublishNodeUpdates() {
        EventBus events = new EventBus();
        List<NodeStatus> seen = new CopyOnWriteArrayList<>();
        events.subscribe(NodeUpdated.class, event -> seen.add(event.status()));
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> List.of());
        ResourceTree tree = new ResourceTree("consul", listers, executor, Clock.systemUTC(),
                Duration.ZERO, Duration.ZERO, events);

        tree.expand("services/");
        Assertions.assertEquals(List.of(NodeStatus.LOADING, NodeStatus.LOADED), seen);
    }

    @Test
    void closedTreeRefusesExpands() {
        ListerRegistry listers = new ListerRegistry();
        listers.bind("", (path, context) -> List.of());
        ResourceTree tree = tree(listers, Clock.systemUTC(), Duration.ZERO);
        tree.close();

        ExpandResult result = tree.expand("kv/");
        Assertions.assertEquals(NodeStatus.ERROR, result.status());
        Assertions.assertTrue(result.error().startsWith("tree closed"));
    }

    private ResourceTree tree(ListerRegistry listers, Clock clock, Duration ttl) {
        return new ResourceTree("vault", listers, executor, clock, ttl, Duration.ofSeconds(5), null);
    }

    private static List<String> paths(List<ChildDescriptor> children) {
        List<String> out = new ArrayList<>();
        for (ChildDescriptor child : children) {
            out.add(child.path());
        }
        return out;
    }
}
