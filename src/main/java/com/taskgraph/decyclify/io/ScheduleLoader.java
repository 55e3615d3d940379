package com.taskgraph.decyclify.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.decyclify.api.InvalidArgumentValueException;
import com.taskgraph.decyclify.engine.TaskGraph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link ScheduleDefinition} JSON documents.
 *
 * <pre>
 * {"schedule": {"name": "demo", "start": "a", "cycles": 2,
 *               "edges": ["a b", "b c", "c b", "c d"]}}
 * </pre>
 */
@Log4j2
public final class ScheduleLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ScheduleLoader() {
        // Utility class
    }

    /** Parses a JSON string. */
    public static ScheduleDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, ScheduleDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid schedule JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Reads a JSON file. */
    public static ScheduleDefinition parseFile(Path path) throws IOException {
        log.debug("Loading schedule from {}", path);
        return parse(Files.readString(path));
    }

    /** Reads a classpath resource. */
    public static ScheduleDefinition parseResource(String resource) {
        try (InputStream in = ScheduleLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Schedule resource not found: " + resource);
            return validate(MAPPER.readValue(in, ScheduleDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load schedule resource " + resource, e);
        }
    }

    /** Builds the task graph described by a definition. */
    public static TaskGraph toGraph(ScheduleDefinition definition) {
        return TaskGraph.fromEdgeList(definition.getSchedule().getEdges());
    }

    private static ScheduleDefinition validate(ScheduleDefinition definition) {
        var info = definition.getSchedule();
        if (info == null)
            throw new IllegalArgumentException("Missing 'schedule' key");
        if (info.getEdges() == null)
            throw new IllegalArgumentException("Schedule '" + info.getName() + "' has no 'edges'");
        if (info.getCycles() < 1)
            throw new InvalidArgumentValueException("cycles", "must be at least '1'", info.getCycles());
        return definition;
    }
}
