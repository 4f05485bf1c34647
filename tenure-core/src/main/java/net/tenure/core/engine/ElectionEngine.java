package net.tenure.core.engine;

import net.tenure.core.event.ElectionEvent;
import net.tenure.core.event.ElectionEvent.ElectionReset;
import net.tenure.core.event.ElectionEvent.ElectionStarted;
import net.tenure.core.event.ElectionEvent.LeaderElected;
import net.tenure.core.event.ElectionEvent.LeaderLost;
import net.tenure.core.event.ElectionEvent.NodeCrashed;
import net.tenure.core.event.ElectionEvent.NodeUpdate;
import net.tenure.core.model.BackendKind;
import net.tenure.core.model.LeaseRecord;
import net.tenure.core.model.Node;
import net.tenure.core.model.NodeSnapshot;
import net.tenure.core.model.NodeStatus;
import net.tenure.core.registry.NodeRegistry;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.EventSink;
import net.tenure.core.spi.StorageBackend;
import net.tenure.core.spi.StorageBackendFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Drives the simulated nodes through the lease election:
 *
 * <pre>
 * Idle --start--> Competing --win--> Leader --renew ok--> Leader
 *                     |                  `--renew failed--> Follower --> Competing (at once)
 *                     `--lose--> Follower --backoff--> Competing
 * any but Crashed --crash--> Crashed --reset--> Idle
 * </pre>
 *
 * All timers, all registry mutations and all event emission happen on one loop thread.
 * Backend calls run on an I/O pool and post their results back to the loop, so several nodes'
 * acquisitions can be in flight at once; the backend's atomicity decides the race.
 * A result is dropped when the node's generation or the run id changed while it was in flight.
 * <p>
 * A command issued from the loop thread itself, for example by an event listener, is queued behind
 * the transition that is emitting and does not wait for completion.
 */
public final class ElectionEngine {
    private static final Logger log = LoggerFactory.getLogger(ElectionEngine.class);

    private final NodeRegistry registry;
    private final StorageBackendFactory backends;
    private final EventSink sink;
    private final ElectionTimings timings;
    private final Clock clock;
    private final Random random;

    private final ScheduledExecutorService loop;
    private final ExecutorService io;
    private volatile Thread loopThread;

    // written on the loop thread only; volatile for the inspection getters
    private volatile boolean running;
    private volatile StorageBackend backend;
    private long runId;
    private boolean settled;          // a reset already left every node IDLE and nothing happened since
    private CompletableFuture<Void> releasing = CompletableFuture.completedFuture(null);

    public ElectionEngine(NodeRegistry registry,
                          StorageBackendFactory backends,
                          EventSink sink,
                          ElectionTimings timings,
                          Clock clock) {
        this(registry, backends, sink, timings, clock, new Random());
    }

    public ElectionEngine(NodeRegistry registry,
                          StorageBackendFactory backends,
                          EventSink sink,
                          ElectionTimings timings,
                          Clock clock,
                          Random random) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backends = Objects.requireNonNull(backends, "backends");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.timings = Objects.requireNonNull(timings, "timings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");

        this.loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tenure-election-loop");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        AtomicInteger ioThreads = new AtomicInteger();
        this.io = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tenure-backend-io-" + ioThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ==================== commands ====================

    /** Stops a running election first, then opens and clears the chosen backend and sets every live node competing. */
    public void startElection(BackendKind kind) {
        Objects.requireNonNull(kind, "kind");
        onLoop(() -> doStart(kind));
    }

    /** @param backend "A"/"B" or any name accepted by {@link BackendKind#from(String)} */
    public void startElection(String backend) {
        startElection(BackendKind.from(backend));
    }

    /** Cancels every timer and closes the backend. Node statuses are kept. */
    public void stopElection() {
        onLoop(this::doStop);
    }

    /** Stops, then puts every node back to IDLE. */
    public void resetElection() {
        onLoop(this::doReset);
    }

    /** Unknown or already crashed nodes are ignored. A crashed leader releases the lease at once. */
    public void crashNode(String nodeId) {
        onLoop(() -> doCrash(nodeId));
    }

    /** Stops the election and terminates the engine threads. Safe to call more than once. */
    public void shutdown() {
        if (loop.isShutdown()) return;
        boolean onLoopThread = Thread.currentThread() == loopThread;
        try {
            if (onLoopThread) doStop();
            else stopElection();
        } catch (ElectionException e) {
            log.warn("Stopping the election during shutdown failed: {}", e.getMessage());
        }
        loop.shutdownNow();
        io.shutdownNow();
        if (onLoopThread) {
            log.info("Election engine shut down");
            return;
        }
        try {
            if (!loop.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Election loop did not terminate within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Election engine shut down");
    }

    // ==================== inspection ====================

    public boolean isRunning() {
        return running;
    }

    public Optional<BackendKind> activeBackend() {
        StorageBackend b = backend;
        return b == null ? Optional.empty() : Optional.of(b.kind());
    }

    public List<NodeSnapshot> nodes() {
        return registry.snapshot();
    }

    /** The node that is LEADER with an unexpired lease right now, if any. */
    public Optional<NodeSnapshot> currentLeader() {
        Instant now = clock.now();
        return registry.snapshot().stream().filter(n -> n.leaderAt(now)).findFirst();
    }

    /** The lease record as the active backend sees it; empty when nothing is running. */
    public Optional<LeaseRecord> currentLease() {
        StorageBackend b = backend;
        if (b == null) return Optional.empty();
        try {
            return b.current();
        } catch (Exception e) {
            throw new ElectionException("Could not read the lease from the " + b.kind().label() + " backend", e);
        }
    }

    public ElectionTimings timings() {
        return timings;
    }

    // ==================== command bodies (loop thread) ====================

    private void doStart(BackendKind kind) {
        if (running) {
            log.info("Election already running on {}; stopping it first", backend.kind().label());
            doStop();
        }

        StorageBackend opened = null;
        try {
            opened = backends.open(kind);
            opened.reset();
        } catch (Exception e) {
            if (opened != null) opened.close();
            throw new ElectionException("Could not initialize the " + kind.label() + " backend", e);
        }

        backend = opened;
        running = true;
        runId++;
        settled = false;
        log.info("Election started on the {} backend with {} node(s)", kind.label(), registry.size());
        emit(new ElectionStarted(kind));

        for (Node node : registry.list()) {
            if (node.status() != NodeStatus.CRASHED) {
                enterCompeting(node);
            }
        }
    }

    private void doStop() {
        running = false;
        runId++;
        int pending = 0;
        for (Node node : registry.list()) {
            if (node.hasPendingTimers()) pending++;
            node.cancelTimers();
        }
        log.debug("Cancelled the timers of {} node(s)", pending);

        StorageBackend active = backend;
        backend = null;
        if (active != null) {
            try {
                active.close();
            } catch (RuntimeException e) {
                log.warn("Closing the {} backend failed: {}", active.kind().label(), e.getMessage());
            }
            log.info("Election stopped");
        }
    }

    private void doReset() {
        if (settled) {
            log.debug("Reset ignored: nothing changed since the last reset");
            return;
        }
        doStop();
        registry.reset();
        settled = true;
        log.info("Election reset; all {} node(s) idle", registry.size());
        emit(new ElectionReset());
    }

    private void doCrash(String nodeId) {
        Optional<Node> found = registry.get(nodeId);
        if (found.isEmpty()) {
            log.warn("Crash ignored: unknown node {}", nodeId);
            return;
        }
        Node node = found.get();
        if (node.status() == NodeStatus.CRASHED) return;

        boolean wasLeader = node.status() == NodeStatus.LEADER;
        node.cancelTimers();
        registry.markCrashed(nodeId);
        settled = false;
        log.info("{} crashed{}", nodeId, wasLeader ? " while holding the lease" : "");
        emit(new NodeCrashed(nodeId));

        if (wasLeader) {
            // watchdog releases the lock instead of waiting for expiry
            StorageBackend active = backend;
            if (active != null) releaseAsync(active);
            emit(new LeaderLost(nodeId));
        }
    }

    /** Later backend calls are chained behind the release, so it cannot delete a newer lease. */
    private void releaseAsync(StorageBackend active) {
        try {
            releasing = CompletableFuture.runAsync(active::release, io)
                    .exceptionally(e -> {
                        log.error("Lease release on the {} backend failed: {}", active.kind().label(), e.getMessage(), e);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.debug("Lease release rejected: engine is shutting down");
        }
    }

    // ==================== per-node protocol (loop thread) ====================

    private void enterCompeting(Node node) {
        if (!running || node.status() == NodeStatus.CRASHED) return;

        long generation = node.cancelTimers();
        long run = runId;
        node.moveTo(NodeStatus.COMPETING);
        emitUpdate(node);

        long delay = jitterMillis();
        node.competeAfter(loop.schedule(guarded(() -> attemptAcquire(node, generation, run)),
                delay, TimeUnit.MILLISECONDS));
    }

    private void attemptAcquire(Node node, long generation, long run) {
        if (stale(node, generation, run)) return;

        StorageBackend active = backend;
        Instant now = clock.now();
        log.debug("{} trying to acquire the lease", node.id());
        callBackend(node, generation, run,
                () -> active.tryAcquire(node.id(), now),
                acquired -> onAcquireResult(node, generation, run, now, acquired));
    }

    private void onAcquireResult(Node node, long generation, long run, Instant now, boolean acquired) {
        if (acquired) {
            node.becomeLeader(now.plus(timings.leaseDuration()));
            log.info("{} elected leader, lease until {}", node.id(), node.leaseExpiry());
            emitUpdate(node);
            emit(new LeaderElected(node.id()));
            scheduleHeartbeat(node, generation, run);
            return;
        }

        node.moveTo(NodeStatus.FOLLOWER);
        log.debug("{} lost the race; retrying in {} ms", node.id(), timings.followerBackoff().toMillis());
        emitUpdate(node);
        node.competeAfter(loop.schedule(guarded(() -> {
            if (!stale(node, generation, run)) enterCompeting(node);
        }), timings.followerBackoff().toMillis(), TimeUnit.MILLISECONDS));
    }

    /** Ticks at a fixed rate from the election; a tick that finds a renewal still in flight is skipped. */
    private void scheduleHeartbeat(Node node, long generation, long run) {
        long interval = timings.heartbeatInterval().toMillis();
        node.heartbeatAfter(loop.scheduleAtFixedRate(guarded(() -> heartbeat(node, generation, run)),
                interval, interval, TimeUnit.MILLISECONDS));
    }

    private void heartbeat(Node node, long generation, long run) {
        if (stale(node, generation, run) || node.status() != NodeStatus.LEADER) return;
        if (node.renewing()) {
            log.debug("{} skipped a heartbeat: previous renewal still in flight", node.id());
            return;
        }

        StorageBackend active = backend;
        Instant now = clock.now();
        node.renewing(true);
        callBackend(node, generation, run,
                () -> active.renew(node.id(), now),
                renewed -> onRenewResult(node, now, renewed));
    }

    private void onRenewResult(Node node, Instant now, boolean renewed) {
        node.renewing(false);
        if (node.status() != NodeStatus.LEADER) return;

        if (renewed) {
            node.extendLease(now.plus(timings.leaseDuration()));
            emitUpdate(node);
            return;
        }

        log.warn("{} could not renew its lease; stepping down", node.id());
        node.cancelTimers();
        node.moveTo(NodeStatus.FOLLOWER);
        emit(new LeaderLost(node.id()));
        emitUpdate(node);
        // no backoff after losing leadership
        enterCompeting(node);
    }

    // ==================== plumbing ====================

    private void callBackend(Node node, long generation, long run,
                             BooleanSupplier call, Consumer<Boolean> continuation) {
        if (io.isShutdown()) {
            log.debug("Backend call for {} skipped: engine is shutting down", node.id());
            return;
        }
        CompletableFuture<Boolean> pending;
        try {
            pending = releasing.thenApplyAsync(ignored -> call.getAsBoolean(), io);
        } catch (RejectedExecutionException e) {
            log.debug("Backend call for {} rejected: engine is shutting down", node.id());
            return;
        }
        pending.exceptionally(e -> {
                    log.error("Backend call for {} failed: {}", node.id(), e.getMessage(), e);
                    return false;
                })
                .thenAcceptAsync(result -> {
                    if (stale(node, generation, run)) {
                        log.debug("Dropping stale backend result for {}", node.id());
                        return;
                    }
                    guarded(() -> continuation.accept(result)).run();
                }, loop);
    }

    private boolean stale(Node node, long generation, long run) {
        return !running
                || run != runId
                || node.generation() != generation
                || node.status() == NodeStatus.CRASHED;
    }

    private long jitterMillis() {
        long bound = timings.competitionJitter().toMillis();
        return bound <= 0 ? 0 : random.nextLong(bound);
    }

    private void onLoop(Runnable command) {
        if (Thread.currentThread() == loopThread) {
            try {
                loop.execute(guarded(command));
            } catch (RejectedExecutionException e) {
                throw new ElectionException("Election engine is shut down", e);
            }
            return;
        }
        Future<?> done;
        try {
            done = loop.submit(command);
        } catch (RejectedExecutionException e) {
            throw new ElectionException("Election engine is shut down", e);
        }
        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ElectionException("Interrupted while waiting for an election command", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ElectionException("Election command failed", cause);
        }
    }

    private Runnable guarded(Runnable step) {
        return () -> {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("Election step failed: {}", e.getMessage(), e);
            }
        };
    }

    private void emit(ElectionEvent event) {
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed on {}: {}", event.type(), e.getMessage());
        }
    }

    private void emitUpdate(Node node) {
        NodeSnapshot s = node.snapshot();
        emit(new NodeUpdate(s.id(), s.status(), s.leaseExpiry()));
    }
}
