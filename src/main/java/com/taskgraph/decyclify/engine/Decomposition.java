package com.taskgraph.decyclify.engine;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of decyclifying a graph: the acyclic copy plus the edges taken out
 * of it.
 *
 * @param graph        acyclic copy of the input graph; the input is untouched.
 * @param removedEdges back edges in discovery order. These become
 *                     inter-iteration dependencies.
 * @param droppedEdges edges deleted by the post-pass (unreached source,
 *                     finished target). They appear in neither matrix.
 * @param colors       final traversal colour per node, for verification.
 */
public record Decomposition(TaskGraph graph, List<Edge> removedEdges, List<Edge> droppedEdges,
        Map<String, NodeColor> colors) {

    public Decomposition {
        removedEdges = List.copyOf(removedEdges);
        droppedEdges = List.copyOf(droppedEdges);
        colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
    }

    static Decomposition empty() {
        return new Decomposition(new TaskGraph(), List.of(), List.of(), Map.of());
    }

    /** Nodes in stable order. */
    public List<String> nodes() {
        return graph.nodes();
    }

    public boolean hasRemovedEdges() {
        return !removedEdges.isEmpty();
    }

    /**
     * Checks the result graph with Kahn's algorithm: every node must reach
     * in-degree zero once its predecessors are processed.
     */
    public boolean isAcyclic() {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String node : graph.nodes()) {
            int degree = graph.predecessors(node).size();
            inDegree.put(node, degree);
            if (degree == 0)
                ready.add(node);
        }
        int processed = 0;
        while (!ready.isEmpty()) {
            String node = ready.poll();
            processed++;
            for (String next : graph.successors(node))
                if (inDegree.merge(next, -1, Integer::sum) == 0)
                    ready.add(next);
        }
        return processed == graph.nodeCount();
    }

    public DependencyMatrix intraIterationMatrix() {
        return MatrixBuilder.intraIteration(graph);
    }

    public DependencyMatrix interIterationMatrix() {
        return MatrixBuilder.interIteration(graph.nodes(), removedEdges);
    }
}
