package net.tenure.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * One simulated participant.
 * State is published through a single volatile snapshot so readers never see a status/lease mismatch.
 * Timers and the generation counter belong to the engine loop thread.
 */
public final class Node {
    private final String id;
    private volatile NodeSnapshot state;

    private ScheduledFuture<?> competitionTimer;   // jitter or follower backoff
    private ScheduledFuture<?> heartbeatTimer;
    private long generation;                       // bumped whenever pending work is invalidated
    private boolean renewing;

    public Node(String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.state = new NodeSnapshot(id, NodeStatus.IDLE, null);
    }

    public String id() { return id; }

    public NodeStatus status() { return state.status(); }

    public Instant leaseExpiry() { return state.leaseExpiry(); }

    public NodeSnapshot snapshot() { return state; }

    /** Any status except LEADER. Clears the lease. CRASHED may only go back to IDLE. */
    public void moveTo(NodeStatus next) {
        if (next == NodeStatus.LEADER) {
            throw new IllegalArgumentException("use becomeLeader(leaseExpiry)");
        }
        guardCrashed(next);
        state = new NodeSnapshot(id, next, null);
    }

    public void becomeLeader(Instant leaseExpiry) {
        guardCrashed(NodeStatus.LEADER);
        state = new NodeSnapshot(id, NodeStatus.LEADER, Objects.requireNonNull(leaseExpiry, "leaseExpiry"));
    }

    public void extendLease(Instant leaseExpiry) {
        if (status() != NodeStatus.LEADER) {
            throw new IllegalStateException(id + " is not LEADER but " + status());
        }
        state = new NodeSnapshot(id, NodeStatus.LEADER, Objects.requireNonNull(leaseExpiry, "leaseExpiry"));
    }

    private void guardCrashed(NodeStatus next) {
        if (status() == NodeStatus.CRASHED && next != NodeStatus.IDLE && next != NodeStatus.CRASHED) {
            throw new IllegalStateException(id + " is CRASHED; only a reset may revive it");
        }
    }

    // === scheduling handles (loop thread only) ===

    public long generation() { return generation; }

    /** Cancels pending timers and invalidates in-flight backend results. Returns the new generation. */
    public long cancelTimers() {
        if (competitionTimer != null) {
            competitionTimer.cancel(false);
            competitionTimer = null;
        }
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
            heartbeatTimer = null;
        }
        renewing = false;
        return ++generation;
    }

    public void competeAfter(ScheduledFuture<?> timer) {
        if (competitionTimer != null) competitionTimer.cancel(false);
        competitionTimer = timer;
    }

    public void heartbeatAfter(ScheduledFuture<?> timer) {
        if (heartbeatTimer != null) heartbeatTimer.cancel(false);
        heartbeatTimer = timer;
    }

    /** A renewal was sent and its result has not come back yet. */
    public boolean renewing() { return renewing; }

    public void renewing(boolean inFlight) { renewing = inFlight; }

    public boolean hasPendingTimers() {
        return (competitionTimer != null && !competitionTimer.isDone())
                || (heartbeatTimer != null && !heartbeatTimer.isDone());
    }

    @Override
    public String toString() {
        return "Node{" + id + ", " + state.status() + (state.leaseExpiry() == null ? "" : ", lease=" + state.leaseExpiry()) + '}';
    }
}
