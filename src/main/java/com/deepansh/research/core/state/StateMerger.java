package com.deepansh.research.core.state;

import java.util.EnumMap;
import java.util.List;

/**
 * Applies partial updates to a {@link WorkflowState} using each field's {@link MergePolicy}.
 * Fields absent from the update are left untouched.
 */
public final class StateMerger {

    private StateMerger() {
    }

    public static WorkflowState merge(WorkflowState current, StateUpdate update) {
        if (update.isEmpty()) return current;

        EnumMap<StateField, Object> next = current.copyValues();
        for (StateField field : update.fields()) {
            next.put(field, field.policy().combine(field, next.get(field), update.get(field)));
        }
        return new WorkflowState(next);
    }

    /** Merges updates left to right. */
    public static WorkflowState mergeAll(WorkflowState current, List<StateUpdate> updates) {
        WorkflowState state = current;
        for (StateUpdate update : updates) {
            state = merge(state, update);
        }
        return state;
    }
}
