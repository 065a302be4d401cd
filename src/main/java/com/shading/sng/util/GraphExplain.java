package com.shading.sng.util;

import java.util.List;
import java.util.Optional;

import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.codegen.AbstractCodeEmitter;
import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.Socket;

/**
 * Diagnostic utility for inspecting graph topology and the names the compiler will generate.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging. Allocates freely; do not call per
 * frame.
 */
public final class GraphExplain {
    private final NodeGraph graph;
    private final NodeCatalog catalog;

    public GraphExplain(NodeGraph graph, NodeCatalog catalog) {
        this.graph = graph;
        this.catalog = catalog;
    }

    /**
     * One line per node in insertion order, followed by its outgoing edges.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.connectionCount())
                .append(" connections):\n");
        int i = 0;
        for (Node node : graph.allNodes()) {
            sb.append("  [").append(i++).append("] ").append(node.id()).append(" (").append(node.definitionId())
                    .append(')');
            if (catalog.getDefinition(node.definitionId()).isEmpty())
                sb.append(" (UNKNOWN)");
            List<String> targets = graph.connectionsTouchingNode(node.id()).stream()
                    .filter(c -> c.fromNodeId().equals(node.id()))
                    .map(this::edgeText)
                    .toList();
            if (!targets.isEmpty())
                sb.append(" -> ").append(String.join(", ", targets));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, edges labelled {@code output:input}.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");
        for (Node node : graph.allNodes()) {
            String title = catalog.getDefinition(node.definitionId()).map(NodeDefinition::getName)
                    .orElse(node.definitionId());
            sb.append("  ").append(sanitize(node.id().value())).append("[\"").append(title).append("<br/>")
                    .append(node.id()).append("\"];\n");
        }
        for (Connection c : graph.allConnections()) {
            String from = socketName(c.fromSocketId().value(), graph.getSocket(c.fromSocketId()));
            String to = socketName(c.toSocketId().value(), graph.getSocket(c.toSocketId()));
            sb.append("  ").append(sanitize(c.fromNodeId().value())).append(" -- \"").append(from).append(':')
                    .append(to).append("\" --> ").append(sanitize(c.toNodeId().value())).append(";\n");
        }
        return sb.toString();
    }

    /**
     * Generated function names per node: one for single-output nodes, one per output otherwise. Color
     * pickers and nodes without a template generate none.
     */
    public String functionNames() {
        StringBuilder sb = new StringBuilder(512);
        for (Node node : graph.allNodes()) {
            String base = AbstractCodeEmitter.NODE_PREFIX + AbstractCodeEmitter.mangle(node.id().value());
            sb.append("  ").append(node.id()).append(" -> ");
            Optional<NodeDefinition> def = catalog.getDefinition(node.definitionId());
            if (def.isEmpty() || def.get().isColorPicker() || def.get().getCode() == null
                    || def.get().getCode().isEmpty()) {
                sb.append("(none)\n");
            } else if (def.get().getOutputs().size() > 1) {
                sb.append(String.join(", ", def.get().getOutputs().stream()
                        .map(o -> AbstractCodeEmitter.functionName(base, o.getName())).toList())).append('\n');
            } else {
                sb.append(base).append('\n');
            }
        }
        return sb.toString();
    }

    private String edgeText(Connection c) {
        return c.toNodeId() + "." + graph.getSocket(c.toSocketId()).map(Socket::name).orElse(c.toSocketId().value());
    }

    private static String socketName(String fallback, Optional<Socket> socket) {
        return socket.map(Socket::name).orElse(fallback);
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
