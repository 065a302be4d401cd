package com.shading.sng.model;

import java.util.Optional;

/**
 * A typed, named port on a node. Immutable once created.
 *
 * @param id           unique identity across the graph
 * @param nodeId       owning node
 * @param name         unique within the owning node and direction
 * @param type         semantic type
 * @param direction    input or output
 * @param defaultValue definition-level default, used when the input is unconnected and the node
 *                     stores no value of its own; may be null
 */
public record Socket(SocketId id, NodeId nodeId, String name, SocketType type, SocketDirection direction,
        NodeValue defaultValue) {

    public Socket {
        if (id == null || nodeId == null || type == null || direction == null)
            throw new IllegalArgumentException("Socket id, node, type and direction are required");
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Socket name cannot be empty");
    }

    public Socket(SocketId id, NodeId nodeId, String name, SocketType type, SocketDirection direction) {
        this(id, nodeId, name, type, direction, null);
    }

    public Optional<NodeValue> defaultValueOpt() {
        return Optional.ofNullable(defaultValue);
    }

    public boolean isInput() {
        return direction == SocketDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == SocketDirection.OUTPUT;
    }

    /**
     * Whether a connection may be formed between this socket and {@code other}, in either order:
     * different nodes, opposite directions, compatible types.
     */
    public boolean canConnectTo(Socket other) {
        if (nodeId.equals(other.nodeId))
            return false;
        if (direction == other.direction)
            return false;
        Socket out = isOutput() ? this : other;
        Socket in = isOutput() ? other : this;
        return out.type.isCompatible(in.type);
    }
}
