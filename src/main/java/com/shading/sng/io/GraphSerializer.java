package com.shading.sng.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.shading.sng.model.Connection;
import com.shading.sng.model.ConnectionId;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Position;
import com.shading.sng.model.Socket;
import com.shading.sng.model.SocketDirection;
import com.shading.sng.model.SocketId;
import com.shading.sng.model.SocketType;

/**
 * Saves and restores graphs as JSON. Every id is preserved, so a restored graph compiles to the same
 * text as the one that was saved.
 */
public final class GraphSerializer {
    private static final Logger log = LogManager.getLogger(GraphSerializer.class);

    private final ObjectMapper mapper;

    public GraphSerializer() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(NodeGraph graph) {
        try {
            return mapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph", e);
        }
    }

    public NodeGraph fromJson(String json) {
        GraphDocument doc;
        try {
            doc = mapper.readValue(json, GraphDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse graph document", e);
        }
        NodeGraph graph = fromDocument(doc);
        log.debug("Loaded graph with {} nodes and {} connections", graph.nodeCount(), graph.connectionCount());
        return graph;
    }

    public GraphDocument toDocument(NodeGraph graph) {
        GraphDocument doc = new GraphDocument();
        for (Node n : graph.allNodes()) {
            GraphDocument.NodeDoc nd = new GraphDocument.NodeDoc();
            nd.setId(n.id().value());
            nd.setDefinitionId(n.definitionId());
            nd.getPosition().setX(n.position().x());
            nd.getPosition().setY(n.position().y());
            n.inputs().forEach(s -> nd.getInputs().add(socketDoc(s)));
            n.outputs().forEach(s -> nd.getOutputs().add(socketDoc(s)));
            n.values().forEach((k, v) -> nd.getValues().put(k, raw(v)));
            doc.getNodes().add(nd);
        }
        for (Connection c : graph.allConnections()) {
            GraphDocument.ConnectionDoc cd = new GraphDocument.ConnectionDoc();
            cd.setId(c.id().value());
            cd.setFromNodeId(c.fromNodeId().value());
            cd.setFromSocketId(c.fromSocketId().value());
            cd.setToNodeId(c.toNodeId().value());
            cd.setToSocketId(c.toSocketId().value());
            doc.getConnections().add(cd);
        }
        return doc;
    }

    public NodeGraph fromDocument(GraphDocument doc) {
        if (doc.getVersion() > GraphDocument.FORMAT_VERSION)
            throw new IllegalArgumentException("Unsupported graph document version: " + doc.getVersion());
        NodeGraph graph = new NodeGraph();
        for (GraphDocument.NodeDoc nd : nullSafe(doc.getNodes())) {
            NodeId nodeId = new NodeId(nd.getId());
            List<Socket> inputs = sockets(nd.getInputs(), nodeId, SocketDirection.INPUT);
            List<Socket> outputs = sockets(nd.getOutputs(), nodeId, SocketDirection.OUTPUT);
            Map<String, NodeValue> values = new LinkedHashMap<>();
            if (nd.getValues() != null)
                nd.getValues().forEach((k, v) -> values.put(k, NodeValue.of(v)));
            Position pos = nd.getPosition() != null ? new Position(nd.getPosition().getX(), nd.getPosition().getY())
                    : Position.ORIGIN;
            graph.addNode(new Node(nodeId, nd.getDefinitionId(), pos, inputs, outputs, values));
        }
        for (GraphDocument.ConnectionDoc cd : nullSafe(doc.getConnections())) {
            graph.addConnection(new Connection(new ConnectionId(cd.getId()), new NodeId(cd.getFromNodeId()),
                    new SocketId(cd.getFromSocketId()), new NodeId(cd.getToNodeId()), new SocketId(cd.getToSocketId())));
        }
        return graph;
    }

    private static GraphDocument.SocketDoc socketDoc(Socket s) {
        GraphDocument.SocketDoc sd = new GraphDocument.SocketDoc();
        sd.setId(s.id().value());
        sd.setName(s.name());
        sd.setType(s.type().jsonName());
        sd.setDefaultValue(s.defaultValueOpt().map(GraphSerializer::raw).orElse(null));
        return sd;
    }

    private static List<Socket> sockets(List<GraphDocument.SocketDoc> docs, NodeId nodeId, SocketDirection direction) {
        List<Socket> out = new ArrayList<>();
        for (GraphDocument.SocketDoc sd : nullSafe(docs)) {
            NodeValue def = sd.getDefaultValue() == null ? null : NodeValue.of(sd.getDefaultValue());
            out.add(new Socket(new SocketId(sd.getId()), nodeId, sd.getName(), SocketType.fromString(sd.getType()),
                    direction, def));
        }
        return out;
    }

    private static Object raw(NodeValue value) {
        if (value instanceof NodeValue.Scalar s)
            return s.value();
        return value.components();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
