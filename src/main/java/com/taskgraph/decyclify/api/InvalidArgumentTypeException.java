package com.taskgraph.decyclify.api;

/**
 * Thrown when an argument has the wrong shape, e.g. a graph input that is
 * neither a {@code TaskGraph} nor an edge list.
 */
public class InvalidArgumentTypeException extends IllegalArgumentException {

    public InvalidArgumentTypeException(String argument, String expected, Object received) {
        super("'" + argument + "' must be " + expected + ", but "
                + (received == null ? "null" : "'" + received.getClass().getName() + "'") + " given");
    }
}
