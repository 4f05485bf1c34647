package net.tenure.core.registry;

import net.tenure.core.model.Node;
import net.tenure.core.model.NodeSnapshot;
import net.tenure.core.model.NodeStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed node set of a simulation. Created once; nodes are never added or removed.
 * Mutated only by the engine loop thread, so no locking here.
 */
public final class NodeRegistry {
    private final Map<String, Node> nodes;

    public NodeRegistry(List<String> ids) {
        if (ids == null || ids.isEmpty()) throw new IllegalArgumentException("at least one node id is required");
        Map<String, Node> m = new LinkedHashMap<>();
        for (String id : ids) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("blank node id");
            if (m.putIfAbsent(id, new Node(id)) != null) throw new IllegalArgumentException("duplicate node id: " + id);
        }
        this.nodes = Collections.unmodifiableMap(m);
    }

    /** prefix1 .. prefixN, e.g. node-1 .. node-5 */
    public static NodeRegistry ofSize(int count, String idPrefix) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1: " + count);
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) ids.add(idPrefix + i);
        return new NodeRegistry(ids);
    }

    public List<Node> list() {
        return List.copyOf(nodes.values());
    }

    public Optional<Node> get(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    /** Every node back to IDLE with no lease, crashed ones included. */
    public void reset() {
        for (Node n : nodes.values()) n.moveTo(NodeStatus.IDLE);
    }

    /** @return false when the id is unknown or the node was already crashed */
    public boolean markCrashed(String id) {
        Node n = nodes.get(id);
        if (n == null || n.status() == NodeStatus.CRASHED) return false;
        n.moveTo(NodeStatus.CRASHED);
        return true;
    }

    public List<NodeSnapshot> snapshot() {
        return nodes.values().stream().map(Node::snapshot).toList();
    }
}
