package com.taskgraph.decyclify.io;

import com.taskgraph.decyclify.api.GraphFormatException;
import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.engine.Edge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for the plain edge-list format: one {@code "source target"} pair per
 * token, separated by whitespace.
 */
public final class EdgeListParser {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private EdgeListParser() {
        // Utility class
    }

    /**
     * Parses a sequence of edge tokens. Every token must hold exactly two
     * labels.
     *
     * @throws GraphFormatException on the first malformed token.
     */
    public static List<Edge> parse(Iterable<String> tokens) {
        if (tokens == null)
            throw new InvalidArgumentTypeException("edgeList", "an iterable of 'source target' strings", null);
        List<Edge> edges = new ArrayList<>();
        int position = 0;
        for (String token : tokens) {
            edges.add(parseToken(token, position++));
        }
        return edges;
    }

    /**
     * Parses multi-line text. Blank lines and lines starting with {@code #}
     * are skipped; positions in errors are zero-based line numbers.
     */
    public static List<Edge> parseText(String text) {
        List<Edge> edges = new ArrayList<>();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#"))
                continue;
            edges.add(parseToken(line, i));
        }
        return edges;
    }

    /** Reads and parses an edge-list file. */
    public static List<Edge> parseFile(Path path) throws IOException {
        return parseText(Files.readString(path));
    }

    static Edge parseToken(String token, int position) {
        if (token == null)
            throw new GraphFormatException("null", position);
        String trimmed = token.strip();
        if (trimmed.isEmpty())
            throw new GraphFormatException(token, position);
        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length != 2)
            throw new GraphFormatException(token, position);
        return new Edge(parts[0], parts[1]);
    }
}
