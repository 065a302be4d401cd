package com.shading.sng.editor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.catalog.SocketDefinition;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Position;
import com.shading.sng.model.Socket;
import com.shading.sng.model.SocketDirection;

/**
 * Creates node instances from catalog definitions.
 */
public final class NodeFactory {
    private final IdGenerator ids;

    public NodeFactory(IdGenerator ids) {
        this.ids = ids;
    }

    /**
     * New node with fresh socket ids. Every input that declares a default starts with that default
     * as its stored value.
     */
    public Node create(NodeDefinition definition, Position position) {
        NodeId nodeId = ids.nextNodeId();
        List<Socket> inputs = sockets(definition.getInputs(), nodeId, SocketDirection.INPUT);
        List<Socket> outputs = sockets(definition.getOutputs(), nodeId, SocketDirection.OUTPUT);

        Map<String, NodeValue> values = new LinkedHashMap<>();
        for (Socket in : inputs)
            in.defaultValueOpt().ifPresent(v -> values.put(in.name(), v));
        return new Node(nodeId, definition.getId(), position, inputs, outputs, values);
    }

    private List<Socket> sockets(List<SocketDefinition> defs, NodeId nodeId, SocketDirection direction) {
        if (defs == null)
            return List.of();
        List<Socket> out = new ArrayList<>(defs.size());
        for (SocketDefinition d : defs)
            out.add(new Socket(ids.nextSocketId(), nodeId, d.getName(), d.getType(), direction, d.defaultNodeValue()));
        return out;
    }

    /** Copy of {@code node} under new ids, moved by {@code (dx, dy)}, with all stored values copied. */
    public Node duplicate(Node node, double dx, double dy) {
        NodeId nodeId = ids.nextNodeId();
        List<Socket> inputs = new ArrayList<>(node.inputs().size());
        for (Socket s : node.inputs())
            inputs.add(new Socket(ids.nextSocketId(), nodeId, s.name(), s.type(), s.direction(), s.defaultValue()));
        List<Socket> outputs = new ArrayList<>(node.outputs().size());
        for (Socket s : node.outputs())
            outputs.add(new Socket(ids.nextSocketId(), nodeId, s.name(), s.type(), s.direction(), s.defaultValue()));
        return new Node(nodeId, node.definitionId(), node.position().move(dx, dy), inputs, outputs, node.values());
    }
}
