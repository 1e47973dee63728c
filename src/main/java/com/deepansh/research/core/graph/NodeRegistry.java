package com.deepansh.research.core.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table of every {@link WorkflowNode} bean, keyed by {@link NodeId}.
 *
 * Spring injects all node implementations; the table is built once at
 * startup and never changes.
 */
@Component
@Slf4j
public class NodeRegistry {

    private final Map<NodeId, WorkflowNode> nodes;

    public NodeRegistry(List<WorkflowNode> nodeBeans) {
        Map<NodeId, WorkflowNode> table = new EnumMap<>(NodeId.class);
        nodeBeans.forEach(node -> {
            WorkflowNode previous = table.putIfAbsent(node.id(), node);
            if (previous != null) {
                throw new IllegalStateException("Two beans claim node " + node.id() + ": "
                        + previous.getClass().getSimpleName() + " and " + node.getClass().getSimpleName());
            }
            log.info("Registered node: [{}] -> {}", node.name(), node.getClass().getSimpleName());
        });
        log.info("Total nodes registered: {}", table.size());
        this.nodes = Collections.unmodifiableMap(table);
    }

    public WorkflowNode get(NodeId id) {
        WorkflowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalStateException("No node registered for " + id + ". Available: " + nodes.keySet());
        }
        return node;
    }

    public boolean has(NodeId id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }
}
