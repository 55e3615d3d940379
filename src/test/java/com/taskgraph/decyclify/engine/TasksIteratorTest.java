package com.taskgraph.decyclify.engine;

import com.taskgraph.decyclify.api.InvalidArgumentTypeException;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;
import org.junit.Test;

import java.util.List;

import static com.taskgraph.decyclify.engine.CycleIteratorTest.drain;
import static com.taskgraph.decyclify.engine.CycleIteratorTest.sampleGraph;
import static org.junit.Assert.*;

public class TasksIteratorTest {

    private static final List<List<String>> SAMPLE_TWO_CYCLES = List.of(
            List.of("a.0"),
            List.of("b.0", "e.0", "a.1"),
            List.of("c.0", "b.1"),
            List.of("d.0", "c.1"),
            List.of("d.1"));

    @Test(expected = InvalidArgumentTypeException.class)
    public void testNullGraph() {
        new TasksIterator((TaskGraph) null, 1);
    }

    @Test(expected = InvalidArgumentTypeException.class)
    public void testNullDecomposition() {
        new TasksIterator((Decomposition) null, 1);
    }

    @Test(expected = InvalidArgumentValueException.class)
    public void testNegativeCycles() {
        new TasksIterator(new TaskGraph(), -1);
    }

    @Test(expected = InvalidArgumentValueException.class)
    public void testZeroCycles() {
        new TasksIterator(sampleGraph(), 0);
    }

    @Test
    public void testTasksIterator() {
        Decomposition d = new Decyclifier().decyclify(sampleGraph(), "a");
        TasksIterator iterator = new TasksIterator(d, 2);
        assertEquals(SAMPLE_TWO_CYCLES, drain(iterator, SAMPLE_TWO_CYCLES.size()));
        assertEquals(0, iterator.activeCycles());
    }

    @Test
    public void testTasksIteratorOverCyclicGraph() {
        TasksIterator iterator = new TasksIterator(sampleGraph(), 2);
        assertEquals(1, iterator.interIterationMatrix().count());
        assertEquals(SAMPLE_TWO_CYCLES, drain(iterator, SAMPLE_TWO_CYCLES.size()));
    }

    @Test
    public void testTasksIteratorOverDecyclifiedGraph() {
        Decomposition d = new Decyclifier().decyclify(sampleGraph(), "a");
        TasksIterator iterator = new TasksIterator(d.graph(), 2);
        // back edges were already taken out, so there is nothing to gate on
        assertTrue(iterator.interIterationMatrix().isEmpty());
        assertEquals(SAMPLE_TWO_CYCLES, drain(iterator, SAMPLE_TWO_CYCLES.size()));
    }

    @Test
    public void testSingleCycleMatchesCycleIterator() {
        Decomposition d = new Decyclifier().decyclify(sampleGraph());
        assertEquals(drain(new CycleIterator(d.graph(), 1), 10), drain(new TasksIterator(d, 1), 10));
    }

    @Test
    public void testTriggerHoldsBackNextCycle() {
        // c -> a is the back edge: a.1 has to wait for c.0
        Decomposition d = new Decyclifier().decyclify(DecyclifierTest.graph("a b", "b c", "c a"));
        assertEquals(List.of(new Edge("c", "a")), d.removedEdges());

        List<List<String>> expected = List.of(
                List.of("a.0"),
                List.of("b.0"),
                List.of("c.0", "a.1"),
                List.of("b.1"),
                List.of("c.1"));
        assertEquals(expected, drain(new TasksIterator(d, 2), expected.size()));
    }

    @Test
    public void testThreeCyclesPipeline() {
        Decomposition d = new Decyclifier().decyclify(DecyclifierTest.graph("a b", "b c", "c a"));
        List<List<String>> expected = List.of(
                List.of("a.0"),
                List.of("b.0"),
                List.of("c.0", "a.1"),
                List.of("b.1"),
                List.of("c.1", "a.2"),
                List.of("b.2"),
                List.of("c.2"));
        assertEquals(expected, drain(new TasksIterator(d, 3), expected.size()));
    }

    @Test
    public void testTrailingCycleSkipsOverBudgetNodes() {
        // b.0 and c.0 run together, a.1 then gets one slot per step: c.1 is skipped
        Decomposition d = new Decyclifier().decyclify(DecyclifierTest.graph("a b", "a c", "b d"));
        List<List<String>> expected = List.of(
                List.of("a.0"),
                List.of("b.0", "c.0", "a.1"),
                List.of("d.0", "b.1"),
                List.of("d.1"));
        assertEquals(expected, drain(new TasksIterator(d, 2), expected.size()));
    }

    @Test
    public void testEmptyGraph() {
        TasksIterator iterator = new TasksIterator(new TaskGraph(), 3);
        assertFalse(iterator.hasNext());
        assertEquals(0, iterator.activeCycles());
    }
}
