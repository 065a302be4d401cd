package com.shading.sng.editor;

import java.util.ArrayList;
import java.util.List;

import com.shading.sng.api.GraphChangeListener;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.model.Connection;
import com.shading.sng.model.ConnectionId;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Position;
import com.shading.sng.model.Socket;
import com.shading.sng.model.SocketId;

import lombok.extern.log4j.Log4j2;

/**
 * Mutating operations on a {@link NodeGraph}.
 * <p>
 * This is where the connection rules live: output to input only, compatible types, no self-loops and
 * at most one connection per input socket. A graph changed only through this class always satisfies
 * them. Every successful mutation is followed by a call to each registered
 * {@link GraphChangeListener}; a rejected one leaves the graph untouched and notifies nobody.
 */
@Log4j2
public final class GraphEditor {
    public static final double DUPLICATE_OFFSET = 20;

    private final NodeGraph graph;
    private final NodeCatalog catalog;
    private final IdGenerator ids;
    private final NodeFactory factory;
    private final List<GraphChangeListener> listeners = new ArrayList<>();

    public GraphEditor(NodeCatalog catalog) {
        this(new NodeGraph(), catalog);
    }

    public GraphEditor(NodeGraph graph, NodeCatalog catalog) {
        this.graph = graph;
        this.catalog = catalog;
        this.ids = new IdGenerator();
        this.factory = new NodeFactory(ids);
        for (Node n : graph.allNodes()) {
            ids.reserve(n.id().value());
            n.inputs().forEach(s -> ids.reserve(s.id().value()));
            n.outputs().forEach(s -> ids.reserve(s.id().value()));
        }
        for (Connection c : graph.allConnections())
            ids.reserve(c.id().value());
    }

    public NodeGraph graph() {
        return graph;
    }

    public void addListener(GraphChangeListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(GraphChangeListener listener) {
        return listeners.remove(listener);
    }

    public Node addNode(String definitionId, Position position) {
        NodeDefinition def = catalog.getDefinition(definitionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node definition: " + definitionId));
        Node node = factory.create(def, position != null ? position : Position.ORIGIN);
        graph.addNode(node);
        log.debug("Added node {} ({})", node.id(), definitionId);
        fire("addNode");
        return node;
    }

    /** Removes the node and every connection touching it; returns the removed connections. */
    public List<Connection> deleteNode(NodeId nodeId) {
        requireNode(nodeId);
        List<Connection> removed = graph.connectionsTouchingNode(nodeId);
        for (Connection c : removed)
            graph.removeConnection(c.id());
        graph.removeNode(nodeId);
        log.debug("Deleted node {} and {} connections", nodeId, removed.size());
        fire("deleteNode");
        return removed;
    }

    /**
     * Connects two sockets given in either order. Any existing connection into the input socket is
     * removed first.
     *
     * @throws IllegalArgumentException if a socket is unknown, both sockets have the same direction,
     *                                  they belong to the same node or their types are incompatible
     */
    public ConnectResult connect(SocketId a, SocketId b) {
        Socket first = requireSocket(a);
        Socket second = requireSocket(b);
        if (first.direction() == second.direction())
            throw new IllegalArgumentException("Cannot connect two " + first.direction() + " sockets");
        Socket from = first.isOutput() ? first : second;
        Socket to = first.isOutput() ? second : first;
        if (from.nodeId().equals(to.nodeId()))
            throw new IllegalArgumentException("Cannot create connection within the same node: " + from.nodeId());
        if (!from.type().isCompatible(to.type()))
            throw new IllegalArgumentException(
                    "Incompatible socket types: " + from.type().jsonName() + " -> " + to.type().jsonName());

        List<Connection> replaced = graph.connectionsFeedingInput(to.id());
        for (Connection c : replaced)
            graph.removeConnection(c.id());
        Connection connection = new Connection(ids.nextConnectionId(), from.nodeId(), from.id(), to.nodeId(), to.id());
        graph.addConnection(connection);
        log.debug("Connected {}.{} -> {}.{} (replaced {})", from.nodeId(), from.name(), to.nodeId(), to.name(),
                replaced.size());
        fire("connect");
        return new ConnectResult(connection, replaced);
    }

    public Connection disconnect(ConnectionId connectionId) {
        Connection removed = graph.removeConnection(connectionId)
                .orElseThrow(() -> new IllegalArgumentException("Connection not found: " + connectionId));
        fire("disconnect");
        return removed;
    }

    public void moveNode(NodeId nodeId, Position position) {
        requireNode(nodeId).moveTo(position);
        fire("moveNode");
    }

    /**
     * Sets the stored value for {@code name}. A null value clears it so the socket default applies
     * again.
     */
    public void updateValue(NodeId nodeId, String name, NodeValue value) {
        requireNode(nodeId).setValue(name, value);
        fire("updateValue");
    }

    /** Copies a node (not its connections) under new ids, offset on the canvas. */
    public Node duplicateNode(NodeId nodeId) {
        Node copy = factory.duplicate(requireNode(nodeId), DUPLICATE_OFFSET, DUPLICATE_OFFSET);
        graph.addNode(copy);
        fire("duplicateNode");
        return copy;
    }

    private Node requireNode(NodeId nodeId) {
        return graph.getNode(nodeId).orElseThrow(() -> new IllegalArgumentException("Node not found: " + nodeId));
    }

    private Socket requireSocket(SocketId socketId) {
        return graph.getSocket(socketId)
                .orElseThrow(() -> new IllegalArgumentException("Socket not found: " + socketId));
    }

    private void fire(String change) {
        for (GraphChangeListener l : listeners)
            l.onGraphChanged(graph, change);
    }
}
