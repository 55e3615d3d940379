package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import lombok.extern.log4j.Log4j2;

/**
 * Iterates over the nodes of several cycles at once, starting a cycle before
 * the previous one has finished.
 *
 * If {@code c -> b} was removed as a back edge, {@code b.1} may run as soon as
 * {@code c.0} has run, even while cycle 0 is still in progress. Each element is
 * the union of everything released in one step across all active cycles,
 * labelled {@code node.cycle}.
 *
 * Cycles are index-addressed; the active ones are kept in an ordered list of
 * indices. In a step the first active cycle pops its next batch
 * ({@link Cycle#pop}), every later one is gated on the cycle just before it
 * ({@link Cycle#offer}). A cycle with nothing left is dropped from the active
 * list within the same step. Iteration ends with the first step that releases
 * nothing.
 *
 * <p>
 * A trailing cycle never releases more nodes in a step than the cycle before
 * it released in that step, and once it releases part of a batch the rest of
 * that batch is skipped for good. Later cycles can therefore miss nodes, even
 * on an acyclic graph: with {@code a -> b, a -> c, b -> d} and two cycles the
 * batches are {@code [a.0], [b.0, c.0, a.1], [d.0, b.1], [d.1]} and
 * {@code c.1} is never released. Skipped nodes are logged at debug when their
 * cycle is exhausted.
 */
@Log4j2
public final class TasksIterator implements Iterator<List<String>> {
    private final List<String> nodes;
    private final DependencyMatrix intra;
    private final DependencyMatrix inter;
    private final Cycle[] cycles;
    private final List<Integer> active;
    private int step;
    private boolean done;

    private List<String> next;

    /**
     * Decyclifies {@code graph} from its first node and replays the result.
     *
     * @throws InvalidArgumentTypeException  if {@code graph} is null.
     * @throws InvalidArgumentValueException if {@code cycles} is below 1.
     */
    public TasksIterator(TaskGraph graph, int cycles) {
        this(decompose(graph, cycles), cycles);
    }

    /** Replays an existing decomposition, keeping its removed edges. */
    public TasksIterator(Decomposition decomposition, int cycles) {
        if (decomposition == null)
            throw new InvalidArgumentTypeException("graph", "a non-null TaskGraph or Decomposition", null);
        CycleIterator.validateCycles(cycles);
        this.nodes = decomposition.nodes();
        this.intra = decomposition.intraIterationMatrix();
        this.inter = decomposition.interIterationMatrix();
        this.cycles = new Cycle[cycles];
        this.active = new ArrayList<>(cycles);
        for (int i = 0; i < cycles; i++) {
            this.cycles[i] = new Cycle(i, intra);
            this.active.add(i);
        }
    }

    private static Decomposition decompose(TaskGraph graph, int cycles) {
        if (graph == null)
            throw new InvalidArgumentTypeException("graph", "a non-null TaskGraph or Decomposition", null);
        CycleIterator.validateCycles(cycles);
        return new Decyclifier().decyclify(graph);
    }

    public DependencyMatrix intraIterationMatrix() {
        return intra;
    }

    public DependencyMatrix interIterationMatrix() {
        return inter;
    }

    /** Number of cycles still active. */
    public int activeCycles() {
        return active.size();
    }

    @Override
    public boolean hasNext() {
        if (next == null && !done) {
            next = step();
            if (next.isEmpty()) {
                next = null;
                done = true;
            }
        }
        return next != null;
    }

    @Override
    public List<String> next() {
        if (!hasNext())
            throw new NoSuchElementException("All cycles exhausted after " + step + " steps");
        List<String> batch = next;
        next = null;
        return batch;
    }

    private List<String> step() {
        step++;
        List<String> batch = new ArrayList<>();
        Cycle previous = null;
        Iterator<Integer> it = active.iterator();
        while (it.hasNext()) {
            Cycle cycle = cycles[it.next()];
            CycleStep result = previous == null ? cycle.pop(step) : cycle.offer(step, previous, inter);
            switch (result.status()) {
                case EXHAUSTED -> {
                    it.remove();
                    logExhausted(cycle);
                    continue;
                }
                case RELEASED -> {
                    for (int node : result.nodes())
                        batch.add(CycleIterator.label(nodes.get(node), cycle.number()));
                }
                case WAITING -> {
                    // gated on the previous cycle
                }
            }
            previous = cycle;
        }
        if (batch.isEmpty() && !active.isEmpty())
            log.debug("Step {} released nothing with {} cycles still active", step, active.size());
        return batch;
    }

    private void logExhausted(Cycle cycle) {
        List<Integer> left = cycle.unreleased();
        if (left.isEmpty()) {
            log.debug("Cycle {} exhausted at step {}", cycle.number(), step);
        } else {
            List<String> names = new ArrayList<>(left.size());
            for (int node : left)
                names.add(nodes.get(node));
            log.debug("Cycle {} exhausted at step {} without releasing {}", cycle.number(), step, names);
        }
    }
}
