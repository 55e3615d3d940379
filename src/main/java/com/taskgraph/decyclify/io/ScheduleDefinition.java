package com.taskgraph.decyclify.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a repeating schedule: a cyclic task graph and how
 * to replay it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScheduleDefinition {
    private ScheduleInfo schedule;

    /** The schedule body. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ScheduleInfo {
        private String name, description;
        /** Traversal start node; the first node when absent. */
        private String start;
        /** Number of replay cycles. */
        private int cycles = 1;
        /** Edge tokens, {@code "source target"}. */
        private List<String> edges;
    }
}
