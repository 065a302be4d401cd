package com.shading.sng.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.Socket;
import com.shading.sng.model.SocketId;

/**
 * Immutable lookup index over one graph snapshot.
 * <p>
 * Built once per compile so that the resolver's per-input lookups are O(1) hash probes instead of
 * scans over the connection list. Node order follows the snapshot order given to {@link #of}.
 */
public final class GraphIndex {
    private static final Logger log = LogManager.getLogger(GraphIndex.class);

    private final Map<NodeId, Node> nodes;
    private final Map<SocketId, Connection> feeding;
    private final Map<SocketId, Socket> sockets;
    private final Map<String, List<Node>> byDefinition;

    private GraphIndex(Map<NodeId, Node> nodes, Map<SocketId, Connection> feeding, Map<SocketId, Socket> sockets,
            Map<String, List<Node>> byDefinition) {
        this.nodes = nodes;
        this.feeding = feeding;
        this.sockets = sockets;
        this.byDefinition = byDefinition;
    }

    public static GraphIndex of(List<Node> nodeList, List<Connection> connections) {
        Map<NodeId, Node> nodes = new LinkedHashMap<>(nodeList.size() * 2);
        Map<SocketId, Socket> sockets = new HashMap<>(nodeList.size() * 8);
        Map<String, List<Node>> byDefinition = new LinkedHashMap<>();
        for (Node n : nodeList) {
            nodes.put(n.id(), n);
            for (Socket s : n.inputs())
                sockets.put(s.id(), s);
            for (Socket s : n.outputs())
                sockets.put(s.id(), s);
            byDefinition.computeIfAbsent(n.definitionId(), k -> new ArrayList<>()).add(n);
        }

        Map<SocketId, Connection> feeding = new HashMap<>(connections.size() * 2);
        for (Connection c : connections) {
            Connection prev = feeding.putIfAbsent(c.toSocketId(), c);
            if (prev != null)
                log.warn("Input socket {} has more than one incoming connection; keeping {}, ignoring {}",
                        c.toSocketId(), prev.id(), c.id());
        }
        return new GraphIndex(nodes, feeding, sockets, byDefinition);
    }

    public Optional<Node> node(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<Socket> socket(SocketId id) {
        return Optional.ofNullable(sockets.get(id));
    }

    /** The connection feeding an input socket, if any. */
    public Optional<Connection> feeding(SocketId inputSocketId) {
        return Optional.ofNullable(feeding.get(inputSocketId));
    }

    /** Instances of a definition in snapshot order. */
    public List<Node> instancesOf(String definitionId) {
        return Collections.unmodifiableList(byDefinition.getOrDefault(definitionId, List.of()));
    }

    /** First node, in snapshot order, whose definition id is {@code definitionId}. */
    public Optional<Node> firstOf(String definitionId) {
        List<Node> list = byDefinition.get(definitionId);
        return list == null || list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int connectionCount() {
        return feeding.size();
    }
}
