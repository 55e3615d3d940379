package com.taskgraph.decyclify.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * State of one replay cycle inside a {@link TasksIterator}.
 *
 * Tracks which nodes are still unreleased and when the cycle released
 * nodes, so the cycle after it can gate on it.
 */
@Log4j2
final class Cycle {
    private static final int NEVER = -1;

    private final int number;
    private final ColumnScan scan;
    private final BitSet released;
    private final BitSet unreleased;

    private int firstReleaseStep = NEVER;
    private int lastReleaseStep = NEVER;
    private int lastReleaseCount;

    Cycle(int number, DependencyMatrix intra) {
        this.number = number;
        this.scan = new ColumnScan(intra);
        this.released = new BitSet(intra.size());
        this.unreleased = new BitSet(intra.size());
        this.unreleased.set(0, intra.size());
    }

    int number() {
        return number;
    }

    /**
     * Leading cycle: releases its next batch unconditionally.
     */
    CycleStep pop(int step) {
        List<Integer> batch = scan.peek();
        if (batch == null)
            return CycleStep.exhausted();
        scan.consume();
        record(step, batch);
        return CycleStep.released(batch);
    }

    /**
     * Trailing cycle: releases from its next batch what {@code previous}
     * allows.
     *
     * <ul>
     * <li>Nothing happens until {@code previous} has released in an earlier
     * step.</li>
     * <li>A candidate passes once {@code previous} has released all of its
     * inter-iteration triggers (row of {@code inter}).</li>
     * <li>At most as many nodes are released as {@code previous} released in
     * this same step, so a cycle never runs ahead of the one before it.</li>
     * </ul>
     *
     * When something is released the batch is consumed and leftover candidates
     * are skipped for this cycle; otherwise the batch is retried next step.
     */
    CycleStep offer(int step, Cycle previous, DependencyMatrix inter) {
        if (previous.firstReleaseStep == NEVER || previous.firstReleaseStep >= step)
            return CycleStep.waiting();
        List<Integer> batch = scan.peek();
        if (batch == null)
            return CycleStep.exhausted();

        int budget = previous.releasedIn(step);
        List<Integer> out = new ArrayList<>(Math.min(budget, batch.size()));
        for (int node : batch) {
            if (out.size() == budget)
                break;
            if (previous.hasReleasedAll(triggers(inter, node)))
                out.add(node);
        }
        if (out.isEmpty())
            return CycleStep.waiting();

        scan.consume();
        if (out.size() < batch.size())
            log.debug("Cycle {} skipped {} of batch {} at step {}", number, batch.size() - out.size(), batch, step);
        record(step, out);
        return CycleStep.released(out);
    }

    /** Node indices never released; only meaningful once exhausted. */
    List<Integer> unreleased() {
        return unreleased.stream().boxed().toList();
    }

    int releasedIn(int step) {
        return lastReleaseStep == step ? lastReleaseCount : 0;
    }

    private boolean hasReleasedAll(List<Integer> nodes) {
        for (int node : nodes)
            if (!released.get(node))
                return false;
        return true;
    }

    private static List<Integer> triggers(DependencyMatrix inter, int node) {
        return inter.isEmpty() ? List.of() : inter.row(node);
    }

    private void record(int step, List<Integer> nodes) {
        for (int node : nodes) {
            released.set(node);
            unreleased.clear(node);
        }
        if (firstReleaseStep == NEVER)
            firstReleaseStep = step;
        lastReleaseStep = step;
        lastReleaseCount = nodes.size();
    }
}
