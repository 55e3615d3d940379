package com.taskgraph.decyclify.io;

import com.taskgraph.decyclify.api.InvalidArgumentValueException;
import com.taskgraph.decyclify.engine.TaskGraph;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.*;

public class ScheduleLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testParse() {
        String json = "{\"schedule\": {\"name\": \"demo\", \"start\": \"a\", \"cycles\": 3,"
                + " \"edges\": [\"a b\", \"b c\", \"c b\"], \"owner\": \"ops\"}}";
        ScheduleDefinition def = ScheduleLoader.parse(json);
        assertEquals("demo", def.getSchedule().getName());
        assertEquals("a", def.getSchedule().getStart());
        assertEquals(3, def.getSchedule().getCycles());
        assertNull(def.getSchedule().getDescription());

        TaskGraph graph = ScheduleLoader.toGraph(def);
        assertEquals(List.of("a", "b", "c"), graph.nodes());
        assertTrue(graph.hasEdge("c", "b"));
    }

    @Test
    public void testDefaults() {
        ScheduleDefinition def = ScheduleLoader.parse("{\"schedule\": {\"edges\": []}}");
        assertEquals(1, def.getSchedule().getCycles());
        assertNull(def.getSchedule().getStart());
        assertTrue(ScheduleLoader.toGraph(def).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingSchedule() {
        ScheduleLoader.parse("{}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingEdges() {
        ScheduleLoader.parse("{\"schedule\": {\"name\": \"x\"}}");
    }

    @Test(expected = InvalidArgumentValueException.class)
    public void testZeroCycles() {
        ScheduleLoader.parse("{\"schedule\": {\"cycles\": 0, \"edges\": [\"a b\"]}}");
    }

    @Test
    public void testMalformedJson() {
        try {
            ScheduleLoader.parse("{\"schedule\": ");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Invalid schedule JSON"));
        }
    }

    @Test
    public void testParseFile() throws Exception {
        File file = folder.newFile("schedule.json");
        Files.writeString(file.toPath(), "{\"schedule\": {\"name\": \"file\", \"edges\": [\"x y\"]}}");
        assertEquals("file", ScheduleLoader.parseFile(file.toPath()).getSchedule().getName());
    }

    @Test
    public void testParseResource() {
        ScheduleDefinition def = ScheduleLoader.parseResource("schedules/sample.json");
        assertEquals("sample", def.getSchedule().getName());
        assertEquals(2, def.getSchedule().getCycles());
        assertEquals(5, def.getSchedule().getEdges().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() {
        ScheduleLoader.parseResource("schedules/nope.json");
    }
}
