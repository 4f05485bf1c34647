package net.tenure.core.model;

import java.time.Instant;
import java.util.Objects;

/** Immutable view of a node. A lease is present if and only if the node is LEADER. */
public record NodeSnapshot(
        String id,
        NodeStatus status,
        Instant leaseExpiry      // null unless LEADER
) {
    public NodeSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        if ((status == NodeStatus.LEADER) != (leaseExpiry != null)) {
            throw new IllegalArgumentException("lease must be set iff LEADER: " + status + "/" + leaseExpiry);
        }
    }

    public boolean leaderAt(Instant t) {
        return status == NodeStatus.LEADER && leaseExpiry.isAfter(t);
    }
}
