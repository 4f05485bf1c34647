package net.tenure.core.event;

import net.tenure.core.model.BackendKind;
import net.tenure.core.model.NodeStatus;

import java.time.Instant;

/** Every state transition the engine reports. {@link #type()} is the wire name. */
public sealed interface ElectionEvent
        permits ElectionEvent.ElectionStarted, ElectionEvent.ElectionReset, ElectionEvent.NodeCrashed,
                ElectionEvent.NodeUpdate, ElectionEvent.LeaderElected, ElectionEvent.LeaderLost {

    String type();

    record ElectionStarted(BackendKind backend) implements ElectionEvent {
        @Override public String type() { return "election-started"; }
    }

    record ElectionReset() implements ElectionEvent {
        @Override public String type() { return "election-reset"; }
    }

    record NodeCrashed(String nodeId) implements ElectionEvent {
        @Override public String type() { return "node-crashed"; }
    }

    record NodeUpdate(String nodeId, NodeStatus status, Instant lease) implements ElectionEvent {
        @Override public String type() { return "node-update"; }
    }

    record LeaderElected(String nodeId) implements ElectionEvent {
        @Override public String type() { return "leader-elected"; }
    }

    record LeaderLost(String nodeId) implements ElectionEvent {
        @Override public String type() { return "leader-lost"; }
    }
}
