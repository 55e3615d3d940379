package com.taskgraph.decyclify.api;

/**
 * Thrown when an argument has the right type but violates a value
 * constraint, such as a cycle count below one.
 */
public class InvalidArgumentValueException extends IllegalArgumentException {

    public InvalidArgumentValueException(String argument, String constraint, Object received) {
        super("'" + argument + "' " + constraint + ", but '" + received + "' given");
    }
}
