package com.shading.sng.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An instance of a catalog definition placed on the canvas.
 * <p>
 * Socket lists are fixed at creation. Position and stored input values are the only mutable state;
 * stored values are consulted only for inputs that have no incoming connection.
 */
public final class Node {
    private final NodeId id;
    private final String definitionId;
    private final List<Socket> inputs;
    private final List<Socket> outputs;
    private final Map<String, NodeValue> values;
    private Position position;

    public Node(NodeId id, String definitionId, Position position, List<Socket> inputs, List<Socket> outputs,
            Map<String, NodeValue> values) {
        if (id == null)
            throw new IllegalArgumentException("Node id is required");
        if (definitionId == null || definitionId.isBlank())
            throw new IllegalArgumentException("Node definitionId cannot be empty");
        this.id = id;
        this.definitionId = definitionId;
        this.position = position != null ? position : Position.ORIGIN;
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.values = new LinkedHashMap<>(values != null ? values : Map.of());
        checkSockets(this.inputs, SocketDirection.INPUT);
        checkSockets(this.outputs, SocketDirection.OUTPUT);
    }

    private void checkSockets(List<Socket> sockets, SocketDirection expected) {
        List<String> seen = new ArrayList<>(sockets.size());
        for (Socket s : sockets) {
            if (!s.nodeId().equals(id))
                throw new IllegalArgumentException("Socket " + s.id() + " does not belong to node " + id);
            if (s.direction() != expected)
                throw new IllegalArgumentException("Socket " + s.name() + " must be " + expected);
            if (seen.contains(s.name()))
                throw new IllegalArgumentException("Duplicate " + expected + " socket name: " + s.name());
            seen.add(s.name());
        }
    }

    public NodeId id() {
        return id;
    }

    public String definitionId() {
        return definitionId;
    }

    public Position position() {
        return position;
    }

    public void moveTo(Position position) {
        if (position == null)
            throw new IllegalArgumentException("Position is required");
        this.position = position;
    }

    public List<Socket> inputs() {
        return inputs;
    }

    public List<Socket> outputs() {
        return outputs;
    }

    public Optional<Socket> socket(SocketId socketId) {
        for (Socket s : inputs)
            if (s.id().equals(socketId))
                return Optional.of(s);
        for (Socket s : outputs)
            if (s.id().equals(socketId))
                return Optional.of(s);
        return Optional.empty();
    }

    public Optional<Socket> input(String name) {
        return inputs.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Optional<Socket> output(String name) {
        return outputs.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Optional<NodeValue> value(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public void setValue(String name, NodeValue value) {
        if (value == null)
            values.remove(name);
        else
            values.put(name, value);
    }

    /** Copy of all stored values, in insertion order. */
    public Map<String, NodeValue> values() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Node n && n.id.equals(id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Node[" + id + ", " + definitionId + "]";
    }
}
