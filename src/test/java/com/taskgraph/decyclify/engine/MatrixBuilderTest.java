package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class MatrixBuilderTest {

    private static Decomposition scenario() {
        return new Decyclifier().decyclify(DecyclifierTest.graph("a b", "b c", "c b", "c d"), "a");
    }

    // --- intra-iteration

    @Test(expected = InvalidArgumentTypeException.class)
    public void testIntraNullGraph() {
        MatrixBuilder.intraIteration((TaskGraph) null);
    }

    @Test(expected = InvalidArgumentTypeException.class)
    public void testIntraNullEdgeList() {
        MatrixBuilder.intraIteration((Iterable<String>) null);
    }

    @Test
    public void testIntraEmpty() {
        assertEquals(0, MatrixBuilder.intraIteration(List.of()).size());
        assertTrue(MatrixBuilder.intraIteration(new TaskGraph()).isEmpty());
    }

    @Test
    public void testIntraDimensions() {
        assertEquals(2, MatrixBuilder.intraIteration(List.of("a b")).size());
        assertEquals(3, MatrixBuilder.intraIteration(List.of("a b", "b c")).size());
        assertEquals(4, MatrixBuilder.intraIteration(List.of("a b", "b c", "c d")).size());

        DependencyMatrix ten = MatrixBuilder.intraIteration(
                List.of("a b", "b c", "c d", "d e", "e f", "f g", "g h", "h i", "i j"));
        assertEquals(10, ten.size());
        assertEquals(10, ten.toIntArray()[0].length);
        assertEquals(10, ten.toIntArray()[1].length);
    }

    @Test
    public void testIntraMatrix() {
        int[][] expected = {
                { 0, 0, 0, 0 },
                { 1, 0, 0, 0 },
                { 0, 1, 0, 0 },
                { 0, 0, 1, 0 }
        };
        assertArrayEquals(expected, scenario().intraIterationMatrix().toIntArray());
    }

    @Test
    public void testIntraRowIsDownstream() {
        // c has two parents: row c is set in columns a and b
        DependencyMatrix m = MatrixBuilder.intraIteration(List.of("a c", "b c"));
        // nodes: a, c, b
        assertEquals(List.of(0, 2), m.row(1));
        assertEquals(List.of(1), m.column(0));
        assertEquals(List.of(1), m.column(2));
        assertFalse(m.get(1, 1));
    }

    @Test
    public void testIntraDiagonalAlwaysClear() {
        DependencyMatrix m = MatrixBuilder.intraIteration(List.of("a a", "a b"));
        assertFalse(m.get(0, 0));
        assertTrue(m.get(1, 0));
    }

    // --- inter-iteration

    @Test(expected = InvalidArgumentTypeException.class)
    public void testInterNullNodes() {
        MatrixBuilder.interIteration(null, List.of());
    }

    @Test(expected = InvalidArgumentTypeException.class)
    public void testInterNullEdges() {
        MatrixBuilder.interIteration(List.of(), null);
    }

    @Test
    public void testInterEmptyEdges() {
        assertEquals(0, MatrixBuilder.interIteration(List.of("a", "b"), List.of()).size());
    }

    @Test
    public void testInterEmptyNodes() {
        assertEquals(0, MatrixBuilder.interIteration(List.of(), List.of(new Edge("b", "a"))).size());
    }

    @Test(expected = InvalidArgumentValueException.class)
    public void testInterUnknownNode() {
        MatrixBuilder.interIteration(List.of("a", "b"), List.of(new Edge("c", "a")));
    }

    @Test
    public void testInterMatrix() {
        int[][] expected = {
                { 0, 0, 0, 0 },
                { 0, 0, 1, 0 },
                { 0, 0, 0, 0 },
                { 0, 0, 0, 0 }
        };
        Decomposition d = scenario();
        DependencyMatrix inter = MatrixBuilder.interIteration(d.nodes(), d.removedEdges());
        assertArrayEquals(expected, inter.toIntArray());
        assertEquals(List.of(List.of(0, 0, 0, 0), List.of(0, 0, 1, 0), List.of(0, 0, 0, 0), List.of(0, 0, 0, 0)),
                inter.toList());
    }

    @Test
    public void testMatricesPartitionEdges() {
        Random random = new Random(3);
        for (int round = 0; round < 100; round++) {
            TaskGraph input = DecyclifierTest.randomGraph(random, 2 + random.nextInt(8), 1 + random.nextInt(20));
            Decomposition d = new Decyclifier().decyclify(input);
            DependencyMatrix intra = d.intraIterationMatrix();
            DependencyMatrix inter = d.interIterationMatrix();
            int n = input.nodeCount();

            assertEquals(n, intra.size());
            assertTrue(inter.isEmpty() || inter.size() == n);

            for (Edge edge : input.edges()) {
                if (d.droppedEdges().contains(edge))
                    continue;
                int row = input.indexOf(edge.target());
                int col = input.indexOf(edge.source());
                boolean inIntra = row != col && intra.get(row, col);
                boolean inInter = !inter.isEmpty() && inter.get(row, col);
                if (row == col) {
                    // self edges are always back edges
                    assertTrue(inInter);
                } else {
                    assertTrue("edge " + edge + " in exactly one matrix", inIntra ^ inInter);
                }
            }
            assertEquals(d.graph().edgeCount(), intra.count());
            assertEquals(d.removedEdges().size(), inter.count());
        }
    }

    @Test
    public void testMatrixValueEquality() {
        DependencyMatrix a = DependencyMatrix.fromInts(new int[][] { { 0, 1 }, { 0, 0 } });
        DependencyMatrix b = DependencyMatrix.of(new boolean[][] { { false, true }, { false, false } });
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("[[0, 1], [0, 0]]", a.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMatrixMustBeSquare() {
        DependencyMatrix.fromInts(new int[][] { { 0, 1 } });
    }
}
