package com.shading.sng.api;

import com.shading.sng.model.NodeId;

/**
 * Observability hook for compile passes.
 * <p>
 * Callbacks run synchronously on the compiling thread, in evaluation order. Keep implementations
 * cheap; they are invoked for every node of every compile.
 */
public interface CompilationListener {

    /** Called before the sink lookup of a compile pass. */
    default void onCompileStart(ShaderBackend backend) {
    }

    /**
     * Called once a node's bindings have been emitted.
     *
     * @param order zero-based position of the node in evaluation order
     */
    default void onNodeEmitted(ShaderBackend backend, NodeId nodeId, String definitionId, int order) {
    }

    /** Called when a reachable node contributes nothing, e.g. its definition is unknown. */
    default void onNodeSkipped(ShaderBackend backend, NodeId nodeId, String definitionId, String reason) {
    }

    /**
     * Called when the document has been assembled.
     *
     * @param nodesEmitted number of nodes that produced bindings
     * @param fallback     true if the default document was returned
     */
    default void onCompileEnd(ShaderBackend backend, int nodesEmitted, boolean fallback) {
    }
}
