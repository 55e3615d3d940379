package com.taskgraph.decyclify;

import com.taskgraph.decyclify.engine.*;
import com.taskgraph.decyclify.io.GraphInputs;

/**
 * Decyclify -- decomposition of repeating task schedules.
 *
 * <h2>Model</h2>
 * <p>
 * A schedule that repeats every cycle is a directed graph that may contain
 * cycles. Decyclifying it yields:
 * <ul>
 * <li>an acyclic graph of the dependencies resolved <b>within</b> a cycle
 * (intra-iteration matrix), and</li>
 * <li>the removed back edges, resolved <b>across</b> consecutive cycles
 * (inter-iteration matrix).</li>
 * </ul>
 * The iterators replay the decomposition over several cycles:
 * {@link CycleIterator} one cycle after the other, {@link TasksIterator} with
 * cycles overlapping.
 */
public final class Decyclify {

    private Decyclify() {
        // Prevent instantiation of utility class
    }

    /**
     * Decyclifies a graph or an edge list from its first node.
     *
     * @param input a {@link TaskGraph} or an iterable of {@code "source target"}
     *              strings.
     * @throws com.taskgraph.decyclify.api.InvalidArgumentTypeException for any
     *                                                                  other
     *                                                                  input.
     */
    public static Decomposition decyclify(Object input) {
        return new Decyclifier().decyclify(GraphInputs.toGraph(input));
    }

    /** Decyclifies from a given start node. */
    public static Decomposition decyclify(Object input, String startNode) {
        return new Decyclifier().decyclify(GraphInputs.toGraph(input), startNode);
    }

    /** Replays a graph one cycle at a time. */
    public static CycleIterator cycles(Object input, int cycles) {
        return new CycleIterator(GraphInputs.toGraph(input), cycles);
    }

    /** Replays a decomposition with overlapping cycles. */
    public static TasksIterator tasks(Decomposition decomposition, int cycles) {
        return new TasksIterator(decomposition, cycles);
    }
}
