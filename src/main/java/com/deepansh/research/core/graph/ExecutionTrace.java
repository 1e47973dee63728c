package com.deepansh.research.core.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered reasoning steps for one node attempt. A fresh trace is handed to
 * every attempt, so concurrent nodes never share one.
 */
@Slf4j
public class ExecutionTrace {

    private final String nodeName;
    private final List<String> steps = new ArrayList<>();

    public ExecutionTrace(String nodeName) {
        this.nodeName = nodeName;
    }

    public void step(String description) {
        steps.add(description);
        log.debug("[{}] {}", nodeName, description);
    }

    public List<String> steps() {
        return List.copyOf(steps);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
