package com.deepansh.research.core.graph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable node graph: sequential edges plus conditional fan-out edges
 * whose branches all join at one node.
 *
 * Invariants checked by {@link Builder#build()}:
 * - entry and exit are registered, every edge endpoint is registered
 * - a node has at most one outgoing edge (plain or conditional)
 * - every branch of a conditional edge has a plain edge to the same join node
 * - walking from the entry reaches the exit without revisiting a node
 */
public final class WorkflowGraph {

    private final NodeId entry;
    private final NodeId exit;
    private final Map<NodeId, WorkflowNode> nodes;
    private final Map<NodeId, NodeId> edges;
    private final Map<NodeId, ConditionalEdge> conditionalEdges;
    private final Set<NodeId> criticalNodes;

    private WorkflowGraph(Builder builder) {
        this.entry = builder.entry;
        this.exit = builder.exit;
        this.nodes = Collections.unmodifiableMap(new EnumMap<>(builder.nodes));
        this.edges = Collections.unmodifiableMap(new EnumMap<>(builder.edges));
        this.conditionalEdges = Collections.unmodifiableMap(new EnumMap<>(builder.conditionalEdges));
        this.criticalNodes = Collections.unmodifiableSet(builder.criticalNodes.isEmpty()
                ? EnumSet.noneOf(NodeId.class) : EnumSet.copyOf(builder.criticalNodes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public NodeId entry() {
        return entry;
    }

    public NodeId exit() {
        return exit;
    }

    public WorkflowNode node(NodeId id) {
        WorkflowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Node not registered in graph: " + id);
        }
        return node;
    }

    public Optional<NodeId> next(NodeId from) {
        return Optional.ofNullable(edges.get(from));
    }

    public Optional<ConditionalEdge> conditionalEdge(NodeId from) {
        return Optional.ofNullable(conditionalEdges.get(from));
    }

    public boolean isCritical(NodeId id) {
        return criticalNodes.contains(id);
    }

    public Set<NodeId> nodeIds() {
        return nodes.keySet();
    }

    /**
     * Fan-out edge: the router picks a subset of {@code branches}; all of them
     * run against the same snapshot and converge on {@code join}.
     */
    public record ConditionalEdge(DispatchRouter router, Set<NodeId> branches, NodeId join) {
    }

    public static final class Builder {

        private NodeId entry;
        private NodeId exit;
        private final Map<NodeId, WorkflowNode> nodes = new EnumMap<>(NodeId.class);
        private final Map<NodeId, NodeId> edges = new EnumMap<>(NodeId.class);
        private final Map<NodeId, ConditionalEdge> conditionalEdges = new EnumMap<>(NodeId.class);
        private final Set<NodeId> criticalNodes = new HashSet<>();

        private Builder() {
        }

        public Builder node(WorkflowNode node) {
            Objects.requireNonNull(node, "node");
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalStateException("Node registered twice: " + node.id());
            }
            return this;
        }

        public Builder entry(NodeId id) {
            this.entry = id;
            return this;
        }

        public Builder exit(NodeId id) {
            this.exit = id;
            return this;
        }

        public Builder edge(NodeId from, NodeId to) {
            requireNoOutgoing(from);
            edges.put(from, to);
            return this;
        }

        public Builder conditionalEdges(NodeId from, DispatchRouter router, Set<NodeId> branches, NodeId join) {
            requireNoOutgoing(from);
            if (branches.isEmpty()) {
                throw new IllegalStateException("Conditional edge from " + from + " declares no branches");
            }
            conditionalEdges.put(from, new ConditionalEdge(router,
                    Collections.unmodifiableSet(EnumSet.copyOf(branches)), join));
            return this;
        }

        public Builder critical(NodeId... ids) {
            Collections.addAll(criticalNodes, ids);
            return this;
        }

        public WorkflowGraph build() {
            if (entry == null || exit == null) {
                throw new IllegalStateException("Graph needs both an entry and an exit node");
            }
            requireRegistered(entry);
            requireRegistered(exit);
            edges.forEach((from, to) -> {
                requireRegistered(from);
                requireRegistered(to);
            });
            conditionalEdges.forEach(this::validateConditional);
            criticalNodes.forEach(this::requireRegistered);
            validateWalk();
            return new WorkflowGraph(this);
        }

        private void validateConditional(NodeId from, ConditionalEdge edge) {
            requireRegistered(from);
            requireRegistered(edge.join());
            for (NodeId branch : edge.branches()) {
                requireRegistered(branch);
                if (!edge.join().equals(edges.get(branch))) {
                    throw new IllegalStateException(
                            "Branch " + branch + " of " + from + " must lead to join node " + edge.join());
                }
                if (conditionalEdges.containsKey(branch)) {
                    throw new IllegalStateException("Nested fan-out from branch " + branch + " is not supported");
                }
            }
        }

        private void validateWalk() {
            Set<NodeId> visited = EnumSet.noneOf(NodeId.class);
            NodeId current = entry;
            while (current != null) {
                if (!visited.add(current)) {
                    throw new IllegalStateException("Cycle detected at node " + current);
                }
                if (current == exit) {
                    if (edges.containsKey(exit) || conditionalEdges.containsKey(exit)) {
                        throw new IllegalStateException("Exit node " + exit + " must not have outgoing edges");
                    }
                    return;
                }
                ConditionalEdge conditional = conditionalEdges.get(current);
                current = conditional != null ? conditional.join() : edges.get(current);
            }
            throw new IllegalStateException("Exit node " + exit + " is not reachable from " + entry);
        }

        private void requireRegistered(NodeId id) {
            if (!nodes.containsKey(id)) {
                throw new IllegalStateException("Node " + id + " is referenced but not registered");
            }
        }

        private void requireNoOutgoing(NodeId from) {
            if (edges.containsKey(from) || conditionalEdges.containsKey(from)) {
                throw new IllegalStateException("Node " + from + " already has an outgoing edge");
            }
        }
    }
}
