package com.shading.sng.api;

import java.util.List;

import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;

/**
 * Turns a graph snapshot into a shader document for one backend.
 * <p>
 * Implementations are pure with respect to the graph: they never mutate nodes or connections, and
 * the same snapshot always yields byte-identical output. Per-call bookkeeping is discarded when
 * {@link #generate} returns, so one instance may be reused for any number of compiles.
 */
public interface ShaderGenerator {

    ShaderBackend backend();

    /**
     * Compiles the graph. Never throws for an acyclic graph; falls back to
     * {@link #generateDefault()} when the graph has no sink node.
     */
    ShaderSource generate(List<Node> nodes, List<Connection> connections);

    /** Minimal valid document used when there is nothing to compile. */
    ShaderSource generateDefault();
}
