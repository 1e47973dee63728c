package com.deepansh.research.node;

import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.memory.ConversationMemory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Appends the user's query and the report to the session history. */
@Component
@Slf4j
@RequiredArgsConstructor
public class MemorySaverNode implements WorkflowNode {

    private final ConversationMemory conversationMemory;

    @Override
    public NodeId id() {
        return NodeId.MEMORY_SAVER;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        conversationMemory.save(state.sessionId(), "user", state.userQuery());
        trace.step("Saved user message");

        if (state.report() != null && !state.report().isBlank()) {
            conversationMemory.save(state.sessionId(), "assistant", state.report());
            trace.step("Saved assistant report");
        }

        log.debug("Conversation saved [session={}, runId={}]", state.sessionId(), state.runId());
        return StateUpdate.empty();
    }
}
