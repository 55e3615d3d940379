package com.taskgraph.decyclify.io;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.engine.TaskGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Coerces loosely typed inputs (values read from configuration, command
 * line arguments, etc.) into a {@link TaskGraph}.
 */
public final class GraphInputs {
    static final String EXPECTED = "a TaskGraph or an iterable of 'source target' strings";

    private GraphInputs() {
        // Utility class
    }

    /**
     * Accepts a {@link TaskGraph} (returned as is) or an iterable of edge
     * tokens.
     *
     * @throws InvalidArgumentTypeException for anything else, including null.
     */
    public static TaskGraph toGraph(Object input) {
        if (input instanceof TaskGraph graph)
            return graph;
        if (input instanceof Iterable<?> iterable) {
            // Single pass: the iterable may be one-shot
            List<String> tokens = new ArrayList<>();
            for (Object token : iterable) {
                if (token != null && !(token instanceof String))
                    throw new InvalidArgumentTypeException("graph", EXPECTED, input);
                tokens.add((String) token);
            }
            return TaskGraph.fromEdgeList(tokens);
        }
        throw new InvalidArgumentTypeException("graph", EXPECTED, input);
    }
}
