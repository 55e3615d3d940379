package com.taskgraph.decyclify.engine;

import java.util.List;

/**
 * Cursor replaying one cycle of an intra-iteration matrix as ready batches.
 *
 * The first batch is always the node at index 0. After that, columns are
 * scanned left to right: a column with set cells yields its row indices
 * (the nodes released once the column's node has fired), an empty column is
 * skipped. The cursor is exhausted once the last column has been scanned.
 */
final class ColumnScan {
    private static final int ENTRY = -1;

    private final DependencyMatrix matrix;
    // Next column to scan, or ENTRY before the first batch
    private int column = ENTRY;

    // Lookahead computed by peek()
    private List<Integer> peeked;
    private int peekedNext;

    ColumnScan(DependencyMatrix matrix) {
        this.matrix = matrix;
    }

    /** Next batch without consuming it, or null when the cycle is complete. */
    List<Integer> peek() {
        if (peeked == null && column <= matrix.size())
            scan();
        return peeked;
    }

    /** Consumes the batch returned by {@link #peek()}. */
    void consume() {
        if (peek() == null)
            throw new IllegalStateException("Cycle already complete");
        column = peekedNext;
        peeked = null;
    }

    /** Rewinds to the entry node for the next cycle. */
    void reset() {
        column = ENTRY;
        peeked = null;
    }

    private void scan() {
        int n = matrix.size();
        if (n == 0) {
            column = n + 1;
            return;
        }
        if (column == ENTRY) {
            peeked = List.of(0);
            peekedNext = 0;
            return;
        }
        for (int c = column; c < n; c++) {
            List<Integer> rows = matrix.column(c);
            if (!rows.isEmpty()) {
                peeked = rows;
                peekedNext = c + 1;
                return;
            }
        }
        column = n + 1;
    }
}
