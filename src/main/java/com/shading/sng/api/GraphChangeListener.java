package com.shading.sng.api;

import com.shading.sng.model.NodeGraph;

/**
 * Notified after every successful mutation of an edited graph.
 */
@FunctionalInterface
public interface GraphChangeListener {

    /**
     * @param graph  the graph after the change
     * @param change short description of the mutation, e.g. {@code "connect"}
     */
    void onGraphChanged(NodeGraph graph, String change);
}
