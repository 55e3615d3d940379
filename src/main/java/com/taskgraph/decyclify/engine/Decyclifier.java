package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.DecyclifyListener;
import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a cyclic task graph into a DAG by removing back edges.
 *
 * Algorithm:
 * 1. Depth-first traversal from the start node, classifying every edge with a
 * per-call colour map. An edge into an IN_PROGRESS node closes a cycle: it is
 * recorded and removed from the working copy.
 * 2. Post-pass: edges from nodes the first traversal never reached into DONE
 * nodes are deleted (reported as dropped, not removed).
 * 3. Remaining UNVISITED nodes are traversed in stable order, adding their
 * back edges to the same list.
 *
 * The traversal uses an explicit stack of frames, each holding a snapshot of
 * the node's successors and a cursor into it, so discovery order matches the
 * recursive formulation without recursing.
 *
 * The input graph is never mutated.
 */
@Log4j2
public final class Decyclifier {
    private DecyclifyListener listener;

    public void setListener(DecyclifyListener listener) {
        this.listener = listener;
    }

    /** Decyclifies starting from the first node in stable order. */
    public Decomposition decyclify(TaskGraph graph) {
        if (graph == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        return decyclify(graph, graph.isEmpty() ? null : graph.nodes().get(0));
    }

    /** Edge-list overload; tokens are {@code "source target"}. */
    public Decomposition decyclify(Iterable<String> edgeList) {
        if (edgeList == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        return decyclify(TaskGraph.fromEdgeList(edgeList));
    }

    /** Edge-list overload of {@link #decyclify(TaskGraph, String)}. */
    public Decomposition decyclify(Iterable<String> edgeList, String startNode) {
        if (edgeList == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        return decyclify(TaskGraph.fromEdgeList(edgeList), startNode);
    }

    /**
     * Decyclifies starting from {@code startNode}.
     *
     * @throws InvalidArgumentTypeException  if {@code graph} is null.
     * @throws InvalidArgumentValueException if {@code startNode} is not in a
     *                                       non-empty graph.
     */
    public Decomposition decyclify(TaskGraph graph, String startNode) {
        if (graph == null)
            throw new InvalidArgumentTypeException("graph", "a TaskGraph or an edge list", null);
        if (graph.isEmpty())
            return Decomposition.empty();
        if (startNode == null || !graph.containsNode(startNode))
            throw new InvalidArgumentValueException("startNode", "must be a node of the graph", startNode);

        TaskGraph working = graph.copy();
        List<String> nodes = working.nodes();
        Map<String, NodeColor> colors = new LinkedHashMap<>(nodes.size() * 2);
        for (String node : nodes)
            colors.put(node, NodeColor.UNVISITED);
        List<Edge> removed = new ArrayList<>();
        List<Edge> dropped = new ArrayList<>();

        visit(working, startNode, colors, removed);

        for (Edge edge : working.edges()) {
            if (colors.get(edge.source()) == NodeColor.UNVISITED && colors.get(edge.target()) == NodeColor.DONE) {
                working.removeEdge(edge.source(), edge.target());
                dropped.add(edge);
                log.warn("Dropped edge {} -> {}: source not reachable from '{}'", edge.source(), edge.target(),
                        startNode);
                if (listener != null)
                    listener.onEdgeDropped(edge.source(), edge.target());
            }
        }

        for (String node : nodes) {
            if (colors.get(node) == NodeColor.UNVISITED)
                visit(working, node, colors, removed);
        }

        log.debug("Decyclified {} nodes from '{}': {} back edges removed, {} edges dropped", nodes.size(),
                startNode, removed.size(), dropped.size());
        if (listener != null)
            listener.onDecyclified(nodes.size(), removed.size(), dropped.size());
        return new Decomposition(working, removed, dropped, colors);
    }

    private void visit(TaskGraph working, String root, Map<String, NodeColor> colors, List<Edge> removed) {
        Deque<Frame> stack = new ArrayDeque<>();
        colors.put(root, NodeColor.IN_PROGRESS);
        stack.push(new Frame(root, working.successors(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.cursor == frame.successors.length) {
                colors.put(frame.node, NodeColor.DONE);
                stack.pop();
                continue;
            }
            String next = frame.successors[frame.cursor++];
            switch (colors.get(next)) {
                case UNVISITED -> {
                    colors.put(next, NodeColor.IN_PROGRESS);
                    stack.push(new Frame(next, working.successors(next)));
                }
                case IN_PROGRESS -> {
                    working.removeEdge(frame.node, next);
                    removed.add(new Edge(frame.node, next));
                    log.debug("Back edge {} -> {} removed", frame.node, next);
                    if (listener != null)
                        listener.onBackEdgeRemoved(frame.node, next, removed.size() - 1);
                }
                case DONE -> {
                    // forward or cross edge, kept
                }
            }
        }
    }

    /** One level of the depth-first path. */
    private static final class Frame {
        final String node;
        // Snapshot taken before any edge of this node is removed
        final String[] successors;
        int cursor;

        Frame(String node, Set<String> successors) {
            this.node = node;
            this.successors = successors.toArray(new String[0]);
        }
    }
}
