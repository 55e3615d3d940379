package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates over all the nodes of a cycle before moving to the next cycle.
 *
 * Each element is a ready batch of labels {@code node.cycle}, produced by
 * scanning the intra-iteration matrix of the graph (see {@link ColumnScan}).
 * With a cycle bound the sequence is finite; {@link #unbounded(TaskGraph)}
 * replays forever.
 */
public final class CycleIterator implements Iterator<List<String>> {
    private final List<String> nodes;
    private final DependencyMatrix matrix;
    private final ColumnScan scan;
    private final int cycles;
    private final boolean bounded;
    private int currentCycle;

    private List<String> next;

    /**
     * @param graph  graph to replay, normally the acyclic result of
     *               {@link Decyclifier}.
     * @param cycles number of cycles, at least 1.
     * @throws InvalidArgumentTypeException  if {@code graph} is null.
     * @throws InvalidArgumentValueException if {@code cycles} is below 1.
     */
    public CycleIterator(TaskGraph graph, int cycles) {
        this(graph, validateCycles(cycles), true);
    }

    /** Replays the graph with no cycle bound. */
    public static CycleIterator unbounded(TaskGraph graph) {
        return new CycleIterator(graph, 0, false);
    }

    private CycleIterator(TaskGraph graph, int cycles, boolean bounded) {
        if (graph == null)
            throw new InvalidArgumentTypeException("graph", "a non-null TaskGraph", null);
        this.nodes = graph.nodes();
        this.matrix = MatrixBuilder.intraIteration(graph);
        this.scan = new ColumnScan(matrix);
        this.cycles = cycles;
        this.bounded = bounded;
    }

    static int validateCycles(int cycles) {
        if (cycles < 1)
            throw new InvalidArgumentValueException("cycles", "must be at least '1'", cycles);
        return cycles;
    }

    public int currentCycle() {
        return currentCycle;
    }

    public DependencyMatrix intraIterationMatrix() {
        return matrix;
    }

    @Override
    public boolean hasNext() {
        if (next == null)
            next = advance();
        return next != null;
    }

    @Override
    public List<String> next() {
        if (!hasNext())
            throw new NoSuchElementException("All " + cycles + " cycles replayed");
        List<String> batch = next;
        next = null;
        return batch;
    }

    private List<String> advance() {
        if (nodes.isEmpty())
            return null;
        while (!bounded || currentCycle < cycles) {
            List<Integer> rows = scan.peek();
            if (rows == null) {
                currentCycle++;
                scan.reset();
                continue;
            }
            scan.consume();
            List<String> batch = new ArrayList<>(rows.size());
            for (int row : rows)
                batch.add(label(nodes.get(row), currentCycle));
            return batch;
        }
        return null;
    }

    static String label(String node, int cycle) {
        return node + "." + cycle;
    }
}
