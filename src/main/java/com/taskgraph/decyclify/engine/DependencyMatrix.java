package com.taskgraph.decyclify.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Square boolean dependency matrix indexed by stable node index.
 *
 * Convention: columns are upstream, rows are downstream. A set cell
 * {@code (row, col)} means the node at {@code row} depends on the node at
 * {@code col}. Instances are immutable.
 */
public final class DependencyMatrix {
    private static final DependencyMatrix EMPTY = new DependencyMatrix(new boolean[0][0]);

    private final boolean[][] cells;

    private DependencyMatrix(boolean[][] cells) {
        this.cells = cells;
    }

    public static DependencyMatrix empty() {
        return EMPTY;
    }

    /** Wraps a copy of the given cells; rows must all have the matrix size. */
    public static DependencyMatrix of(boolean[][] cells) {
        int n = cells.length;
        boolean[][] copy = new boolean[n][];
        for (int i = 0; i < n; i++) {
            if (cells[i].length != n)
                throw new IllegalArgumentException("Matrix must be square: row " + i + " has "
                        + cells[i].length + " columns, expected " + n);
            copy[i] = cells[i].clone();
        }
        return new DependencyMatrix(copy);
    }

    /** Builds a matrix from nested 0/1 values. */
    public static DependencyMatrix fromInts(int[][] values) {
        boolean[][] cells = new boolean[values.length][];
        for (int i = 0; i < values.length; i++) {
            cells[i] = new boolean[values[i].length];
            for (int j = 0; j < values[i].length; j++)
                cells[i][j] = values[i][j] != 0;
        }
        return of(cells);
    }

    public int size() {
        return cells.length;
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    public boolean get(int row, int col) {
        return cells[row][col];
    }

    /** Row indices set in {@code col}: the nodes that depend on node {@code col}. */
    public List<Integer> column(int col) {
        List<Integer> rows = new ArrayList<>();
        for (int row = 0; row < cells.length; row++)
            if (cells[row][col])
                rows.add(row);
        return rows;
    }

    /** Column indices set in {@code row}: the nodes {@code row} depends on. */
    public List<Integer> row(int row) {
        List<Integer> cols = new ArrayList<>();
        for (int col = 0; col < cells.length; col++)
            if (cells[row][col])
                cols.add(col);
        return cols;
    }

    /** Number of set cells. */
    public int count() {
        int count = 0;
        for (boolean[] row : cells)
            for (boolean cell : row)
                if (cell)
                    count++;
        return count;
    }

    /** Interchange form: nested 0/1 ints. */
    public int[][] toIntArray() {
        int[][] out = new int[cells.length][cells.length];
        for (int i = 0; i < cells.length; i++)
            for (int j = 0; j < cells.length; j++)
                out[i][j] = cells[i][j] ? 1 : 0;
        return out;
    }

    /** Interchange form: nested lists of 0/1. */
    public List<List<Integer>> toList() {
        List<List<Integer>> out = new ArrayList<>(cells.length);
        for (int[] row : toIntArray())
            out.add(Arrays.stream(row).boxed().toList());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof DependencyMatrix other && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(toIntArray());
    }
}
