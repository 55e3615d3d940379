package com.taskgraph.decyclify.engine;

/**
 * Traversal state of a node during a single decyclify pass.
 * Kept in a map owned by the pass, never stored on the graph.
 */
public enum NodeColor {
    /** Not reached yet. */
    UNVISITED,
    /** On the current depth-first path. */
    IN_PROGRESS,
    /** All successors explored. */
    DONE
}
