package com.shading.sng.model;

/**
 * Directed edge from one node's output socket to another node's input socket.
 * <p>
 * Only the no-self-loop rule is checked here. Direction, type compatibility and the
 * one-connection-per-input rule are enforced by the operation that creates connections.
 */
public record Connection(ConnectionId id, NodeId fromNodeId, SocketId fromSocketId, NodeId toNodeId,
        SocketId toSocketId) {

    public Connection {
        if (id == null || fromNodeId == null || fromSocketId == null || toNodeId == null || toSocketId == null)
            throw new IllegalArgumentException("Connection endpoints are required");
        if (fromNodeId.equals(toNodeId))
            throw new IllegalArgumentException("Cannot create connection within the same node: " + fromNodeId);
    }

    public boolean involvesSocket(SocketId socketId) {
        return fromSocketId.equals(socketId) || toSocketId.equals(socketId);
    }

    public boolean involvesNode(NodeId nodeId) {
        return fromNodeId.equals(nodeId) || toNodeId.equals(nodeId);
    }
}
