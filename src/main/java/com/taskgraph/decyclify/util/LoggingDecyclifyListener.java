package com.taskgraph.decyclify.util;

import com.taskgraph.decyclify.api.DecyclifyListener;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Logs traversal events and keeps simple counters.
 */
@Log4j2
public class LoggingDecyclifyListener implements DecyclifyListener {
    @Getter
    private int backEdges;
    @Getter
    private int droppedEdges;

    @Override
    public void onBackEdgeRemoved(String source, String target, int order) {
        backEdges++;
        log.info("Back edge #{}: {} -> {} becomes an inter-iteration dependency", order, source, target);
    }

    @Override
    public void onEdgeDropped(String source, String target) {
        droppedEdges++;
        log.info("Edge {} -> {} dropped by the post-pass", source, target);
    }

    @Override
    public void onDecyclified(int nodeCount, int removedCount, int droppedCount) {
        log.info("Decyclified {} nodes: {} removed, {} dropped", nodeCount, removedCount, droppedCount);
    }
}
