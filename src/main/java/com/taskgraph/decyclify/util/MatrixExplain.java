package com.taskgraph.decyclify.util;

import com.taskgraph.decyclify.engine.Decomposition;
import com.taskgraph.decyclify.engine.DependencyMatrix;
import com.taskgraph.decyclify.engine.Edge;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for rendering dependency matrices and decompositions.
 *
 * <p>
 * Intended for debugging sessions, logging and the demo; it allocates
 * strings freely.
 */
public final class MatrixExplain {

    private MatrixExplain() {
        // Utility class
    }

    /**
     * Renders one {@code [0 1 0]} line per row.
     */
    public static String format(DependencyMatrix matrix) {
        StringBuilder sb = new StringBuilder(matrix.size() * (matrix.size() * 2 + 3));
        for (int[] row : matrix.toIntArray()) {
            sb.append('[');
            for (int j = 0; j < row.length; j++) {
                if (j > 0)
                    sb.append(' ');
                sb.append(row[j]);
            }
            sb.append("]\n");
        }
        return sb.toString();
    }

    /**
     * Renders the matrix as a table with node labels as row and column
     * headers. Rows are downstream nodes, columns upstream nodes.
     *
     * @throws IllegalArgumentException if the label count does not match the
     *                                  matrix size.
     */
    public static String tabulate(DependencyMatrix matrix, List<String> labels) {
        if (labels.size() != matrix.size())
            throw new IllegalArgumentException(
                    "Expected " + matrix.size() + " labels, but " + labels.size() + " given");
        int width = 1;
        for (String label : labels)
            width = Math.max(width, label.length());

        StringBuilder sb = new StringBuilder(256);
        pad(sb, "", width);
        for (String label : labels) {
            sb.append("  ");
            pad(sb, label, width);
        }
        sb.append('\n');
        int[][] cells = matrix.toIntArray();
        for (int i = 0; i < cells.length; i++) {
            pad(sb, labels.get(i), width);
            for (int cell : cells[i]) {
                sb.append("  ");
                pad(sb, Integer.toString(cell), width);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps a decomposition in text form: nodes, retained edges, removed back
     * edges and dropped edges.
     */
    public static String dump(Decomposition decomposition) {
        StringBuilder sb = new StringBuilder(512);
        List<String> nodes = decomposition.nodes();
        sb.append("Decomposition (").append(nodes.size()).append(" nodes):\n");
        for (int i = 0; i < nodes.size(); i++) {
            String node = nodes.get(i);
            sb.append("  [").append(i).append("] ").append(node);
            var successors = decomposition.graph().successors(node);
            if (!successors.isEmpty())
                sb.append(" -> ").append(String.join(", ", successors));
            sb.append('\n');
        }
        sb.append("  Removed: ").append(decomposition.removedEdges()).append('\n');
        if (!decomposition.droppedEdges().isEmpty())
            sb.append("  Dropped: ").append(decomposition.droppedEdges()).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS diagram. Retained edges are solid, removed back
     * edges dotted. Node ids are {@code n<index>} so distinct labels never
     * collide; the label itself is the node text.
     */
    public static String toMermaid(Decomposition decomposition) {
        List<String> nodes = decomposition.nodes();
        Map<String, String> ids = new HashMap<>(nodes.size() * 2);
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (int i = 0; i < nodes.size(); i++) {
            String node = nodes.get(i);
            ids.put(node, "n" + i);
            sb.append("  n").append(i).append("[\"").append(escape(node)).append("\"];\n");
        }
        for (Edge edge : decomposition.graph().edges())
            sb.append("  ").append(ids.get(edge.source())).append(" --> ").append(ids.get(edge.target()))
                    .append(";\n");
        for (Edge edge : decomposition.removedEdges())
            sb.append("  ").append(ids.get(edge.source())).append(" -.-> ").append(ids.get(edge.target()))
                    .append(";\n");
        return sb.toString();
    }

    private static void pad(StringBuilder sb, String value, int width) {
        sb.append(value);
        for (int i = value.length(); i < width; i++)
            sb.append(' ');
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }
}
