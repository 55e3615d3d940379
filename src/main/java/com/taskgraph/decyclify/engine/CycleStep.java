package com.taskgraph.decyclify.engine;

import java.util.List;

/**
 * Outcome of advancing one replay cycle by one step.
 *
 * @param status what happened.
 * @param nodes  node indices released; empty unless {@code RELEASED}.
 */
record CycleStep(Status status, List<Integer> nodes) {

    enum Status {
        /** Some nodes were released. */
        RELEASED,
        /** Nothing could be released this step; try again later. */
        WAITING,
        /** The cycle has no batches left. */
        EXHAUSTED
    }

    private static final CycleStep WAITING = new CycleStep(Status.WAITING, List.of());
    private static final CycleStep EXHAUSTED = new CycleStep(Status.EXHAUSTED, List.of());

    static CycleStep released(List<Integer> nodes) {
        return new CycleStep(Status.RELEASED, List.copyOf(nodes));
    }

    static CycleStep waiting() {
        return WAITING;
    }

    static CycleStep exhausted() {
        return EXHAUSTED;
    }
}
