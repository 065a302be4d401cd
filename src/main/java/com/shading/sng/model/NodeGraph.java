package com.shading.sng.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate holding all live nodes and connections.
 * <p>
 * Pure storage: no business rule is enforced here beyond identity. Iteration follows insertion
 * order so that anything derived from the graph is deterministic. Read paths never throw for an
 * unknown id; they return an empty result.
 */
public final class NodeGraph {
    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final Map<ConnectionId, Connection> connections = new LinkedHashMap<>();

    public NodeGraph() {
    }

    public NodeGraph(List<Node> nodes, List<Connection> connections) {
        nodes.forEach(this::addNode);
        connections.forEach(this::addConnection);
    }

    public void addNode(Node node) {
        nodes.put(node.id(), node);
    }

    /** Removes only the node; callers cascade connections themselves. */
    public Optional<Node> removeNode(NodeId nodeId) {
        return Optional.ofNullable(nodes.remove(nodeId));
    }

    public void addConnection(Connection connection) {
        connections.put(connection.id(), connection);
    }

    public Optional<Connection> removeConnection(ConnectionId connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public Optional<Node> getNode(NodeId nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /** Searches every node for the socket. O(sockets). */
    public Optional<Socket> getSocket(SocketId socketId) {
        for (Node node : nodes.values()) {
            Optional<Socket> s = node.socket(socketId);
            if (s.isPresent())
                return s;
        }
        return Optional.empty();
    }

    public Optional<Connection> getConnection(ConnectionId connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public boolean hasNode(NodeId nodeId) {
        return nodes.containsKey(nodeId);
    }

    public boolean hasConnection(ConnectionId connectionId) {
        return connections.containsKey(connectionId);
    }

    public List<Node> allNodes() {
        return List.copyOf(nodes.values());
    }

    public List<Connection> allConnections() {
        return List.copyOf(connections.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int connectionCount() {
        return connections.size();
    }

    /** The connection feeding an input socket; at most one while the editor invariant holds. */
    public Optional<Connection> connectionFeedingInput(SocketId inputSocketId) {
        for (Connection c : connections.values())
            if (c.toSocketId().equals(inputSocketId))
                return Optional.of(c);
        return Optional.empty();
    }

    public List<Connection> connectionsFeedingInput(SocketId inputSocketId) {
        List<Connection> out = new ArrayList<>(1);
        for (Connection c : connections.values())
            if (c.toSocketId().equals(inputSocketId))
                out.add(c);
        return out;
    }

    public List<Connection> connectionsTouchingNode(NodeId nodeId) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections.values())
            if (c.involvesNode(nodeId))
                out.add(c);
        return out;
    }

    public List<Connection> connectionsTouchingSocket(SocketId socketId) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections.values())
            if (c.involvesSocket(socketId))
                out.add(c);
        return out;
    }
}
