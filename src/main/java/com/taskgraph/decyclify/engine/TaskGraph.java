package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.EdgeNotFoundException;
import com.taskgraph.decyclify.io.EdgeListParser;

import java.util.*;

/**
 * Minimal directed graph of task dependencies.
 *
 * Node labels are plain strings. The order in which a node is first seen
 * (as an explicit node or as either end of an edge) is its stable index, and
 * every matrix built from the graph uses that order. Successor and
 * predecessor sets keep insertion order too, so traversals are
 * deterministic.
 *
 * Duplicate edges are ignored; self edges are allowed.
 */
public final class TaskGraph {
    // Insertion-ordered adjacency in both directions
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private int edgeCount;

    public TaskGraph() {
    }

    /** Builds a graph from {@code "source target"} tokens. */
    public static TaskGraph fromEdgeList(Iterable<String> edgeList) {
        TaskGraph graph = new TaskGraph();
        for (Edge edge : EdgeListParser.parse(edgeList))
            graph.addEdge(edge.source(), edge.target());
        return graph;
    }

    /** Builds a graph from explicit edges. */
    public static TaskGraph of(Edge... edges) {
        TaskGraph graph = new TaskGraph();
        for (Edge edge : edges)
            graph.addEdge(edge.source(), edge.target());
        return graph;
    }

    /**
     * Adds a node if absent.
     *
     * @return true if the node was not yet present.
     */
    public boolean addNode(String node) {
        Objects.requireNonNull(node, "node");
        if (successors.containsKey(node))
            return false;
        successors.put(node, new LinkedHashSet<>());
        predecessors.put(node, new LinkedHashSet<>());
        return true;
    }

    /**
     * Adds the edge {@code source -> target}, creating both nodes if needed.
     *
     * @return true if the edge was not yet present.
     */
    public boolean addEdge(String source, String target) {
        addNode(source);
        addNode(target);
        if (!successors.get(source).add(target))
            return false;
        predecessors.get(target).add(source);
        edgeCount++;
        return true;
    }

    /**
     * Removes the edge {@code source -> target}.
     *
     * @throws EdgeNotFoundException if the graph has no such edge.
     */
    public void removeEdge(String source, String target) {
        Set<String> out = successors.get(source);
        if (out == null || !out.remove(target))
            throw new EdgeNotFoundException(source, target);
        predecessors.get(target).remove(source);
        edgeCount--;
    }

    public boolean hasEdge(String source, String target) {
        Set<String> out = successors.get(source);
        return out != null && out.contains(target);
    }

    public boolean containsNode(String node) {
        return successors.containsKey(node);
    }

    /** Nodes in stable (first appearance) order. */
    public List<String> nodes() {
        return List.copyOf(successors.keySet());
    }

    /** All edges, grouped by source in node order. */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (var entry : successors.entrySet())
            for (String target : entry.getValue())
                edges.add(new Edge(entry.getKey(), target));
        return edges;
    }

    /** Direct successors in insertion order; read-only view. */
    public Set<String> successors(String node) {
        return Collections.unmodifiableSet(require(successors, node));
    }

    /** Nodes with an edge into {@code node}; read-only view. */
    public Set<String> predecessors(String node) {
        return Collections.unmodifiableSet(require(predecessors, node));
    }

    /**
     * Stable index of a node.
     *
     * @throws IllegalArgumentException if the node is unknown.
     */
    public int indexOf(String node) {
        int i = 0;
        for (String n : successors.keySet()) {
            if (n.equals(node))
                return i;
            i++;
        }
        throw new IllegalArgumentException("Unknown node: " + node);
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    /** Independent copy with identical node order and edges. */
    public TaskGraph copy() {
        TaskGraph copy = new TaskGraph();
        for (String node : successors.keySet())
            copy.addNode(node);
        for (var entry : successors.entrySet())
            for (String target : entry.getValue())
                copy.addEdge(entry.getKey(), target);
        return copy;
    }

    private static Set<String> require(Map<String, Set<String>> adjacency, String node) {
        Set<String> set = adjacency.get(node);
        if (set == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return set;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskGraph other))
            return false;
        return nodes().equals(other.nodes()) && edges().equals(other.edges());
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes(), edges());
    }

    @Override
    public String toString() {
        return "TaskGraph" + nodes() + edges();
    }
}
