package com.taskgraph.decyclify.engine;

/** A directed dependency {@code source -> target}. */
public record Edge(String source, String target) {

    @Override
    public String toString() {
        return "(" + source + ", " + target + ")";
    }
}
