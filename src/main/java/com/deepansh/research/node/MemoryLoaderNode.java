package com.deepansh.research.node;

import com.deepansh.research.config.WorkflowProperties;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.memory.ConversationMemory;
import com.deepansh.research.model.ConversationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class MemoryLoaderNode implements WorkflowNode {

    private final ConversationMemory conversationMemory;
    private final WorkflowProperties properties;

    @Override
    public NodeId id() {
        return NodeId.MEMORY_LOADER;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        List<ConversationMessage> history;
        try {
            history = conversationMemory.load(state.sessionId(), properties.getHistoryLimit());
        } catch (RuntimeException e) {
            log.warn("Could not load history for session={}: {}", state.sessionId(), e.getMessage());
            trace.step("History unavailable: " + e.getMessage());
            history = List.of();
        }

        trace.step("Loaded " + history.size() + " previous messages");
        return StateUpdate.builder().conversationHistory(history).build();
    }
}
