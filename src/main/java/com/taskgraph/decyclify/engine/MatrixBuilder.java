package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the two dependency matrices of a decomposed schedule.
 *
 * <ul>
 * <li>Intra-iteration: dependencies retained in the acyclic graph, resolved
 * within the same cycle.</li>
 * <li>Inter-iteration: removed back edges, where the target in cycle N waits
 * for the source in cycle N-1.</li>
 * </ul>
 */
public final class MatrixBuilder {

    private MatrixBuilder() {
        // Utility class
    }

    /**
     * Cell {@code (i, j)} is set when node {@code i} is a successor of node
     * {@code j}. O(n²) pair scan.
     *
     * @throws InvalidArgumentTypeException if {@code graph} is null.
     */
    public static DependencyMatrix intraIteration(TaskGraph graph) {
        if (graph == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        List<String> nodes = graph.nodes();
        int n = nodes.size();
        if (n == 0)
            return DependencyMatrix.empty();
        boolean[][] cells = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j && graph.hasEdge(nodes.get(j), nodes.get(i)))
                    cells[i][j] = true;
            }
        }
        return DependencyMatrix.of(cells);
    }

    /** Edge-list overload of {@link #intraIteration(TaskGraph)}. */
    public static DependencyMatrix intraIteration(Iterable<String> edgeList) {
        if (edgeList == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        return intraIteration(TaskGraph.fromEdgeList(edgeList));
    }

    /**
     * Cell {@code (indexOf(target), indexOf(source))} is set for each removed
     * edge. Returns an empty matrix when either list is empty.
     *
     * @throws InvalidArgumentTypeException  if either argument is null.
     * @throws InvalidArgumentValueException if an edge names a node not in
     *                                       {@code nodes}.
     */
    public static DependencyMatrix interIteration(List<String> nodes, List<Edge> removedEdges) {
        if (nodes == null)
            throw new InvalidArgumentTypeException("nodes", "a list of node labels", null);
        if (removedEdges == null)
            throw new InvalidArgumentTypeException("removedEdges", "a list of edges", null);
        if (nodes.isEmpty() || removedEdges.isEmpty())
            return DependencyMatrix.empty();

        int n = nodes.size();
        Map<String, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            index.putIfAbsent(nodes.get(i), i);

        boolean[][] cells = new boolean[n][n];
        for (Edge edge : removedEdges) {
            cells[requireIndex(index, edge.target(), edge)][requireIndex(index, edge.source(), edge)] = true;
        }
        return DependencyMatrix.of(cells);
    }

    private static int requireIndex(Map<String, Integer> index, String node, Edge edge) {
        Integer i = index.get(node);
        if (i == null)
            throw new InvalidArgumentValueException("removedEdges", "must only name known nodes (" + edge + ")", node);
        return i;
    }
}
