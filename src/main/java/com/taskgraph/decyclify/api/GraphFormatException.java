package com.taskgraph.decyclify.api;

/**
 * Thrown when an edge-list token cannot be parsed into a
 * {@code source target} pair.
 */
public class GraphFormatException extends IllegalArgumentException {
    private final int position;

    public GraphFormatException(String token, int position) {
        super("Malformed edge at position " + position + ": expected 'source target', but '" + token + "' given");
        this.position = position;
    }

    /** Zero-based index of the offending token in its input. */
    public int position() {
        return position;
    }
}
