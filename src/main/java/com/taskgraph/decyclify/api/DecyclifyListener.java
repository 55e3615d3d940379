package com.taskgraph.decyclify.api;

/**
 * Observability interface for the cycle-removal traversal.
 *
 * Implementations are registered on the Decyclifier and receive callbacks
 * while the depth-first pass classifies edges. Callbacks run inline with the
 * traversal, so they should stay cheap.
 */
public interface DecyclifyListener {

    /**
     * Called when a back edge is found and removed from the working graph.
     *
     * @param source the node currently being expanded (on the traversal path).
     * @param target the in-progress node the edge points back to.
     * @param order  zero-based discovery order among removed edges.
     */
    void onBackEdgeRemoved(String source, String target, int order);

    /**
     * Called when the post-pass deletes an edge running from an unreached node
     * into the finished part of the traversal.
     */
    void onEdgeDropped(String source, String target);

    /**
     * Called once the traversal has coloured every node.
     *
     * @param nodeCount    number of nodes in the graph.
     * @param removedCount number of back edges removed.
     * @param droppedCount number of edges deleted by the post-pass.
     */
    void onDecyclified(int nodeCount, int removedCount, int droppedCount);
}
