package com.taskgraph.decyclify.api;

import java.util.NoSuchElementException;

/** Thrown when removing an edge the graph does not contain. */
public class EdgeNotFoundException extends NoSuchElementException {

    public EdgeNotFoundException(String source, String target) {
        super("Edge not found: " + source + " -> " + target);
    }
}
