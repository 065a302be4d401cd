package com.shading.sng.editor;

import com.shading.sng.model.ConnectionId;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.SocketId;

/**
 * Sequential ids: {@code node_1}, {@code socket_1}, {@code conn_1}, ...
 * <p>
 * Ids are deterministic for a given sequence of editing operations, which keeps compiled output
 * reproducible across sessions. {@link #reserve} advances the counters past ids that arrived from
 * elsewhere, e.g. a loaded document.
 */
public final class IdGenerator {
    public static final String NODE_PREFIX = "node_";
    public static final String SOCKET_PREFIX = "socket_";
    public static final String CONNECTION_PREFIX = "conn_";

    private long nodeCounter;
    private long socketCounter;
    private long connectionCounter;

    public NodeId nextNodeId() {
        return new NodeId(NODE_PREFIX + (++nodeCounter));
    }

    public SocketId nextSocketId() {
        return new SocketId(SOCKET_PREFIX + (++socketCounter));
    }

    public ConnectionId nextConnectionId() {
        return new ConnectionId(CONNECTION_PREFIX + (++connectionCounter));
    }

    /** Makes sure no future id collides with {@code existing}. */
    public void reserve(String existing) {
        nodeCounter = Math.max(nodeCounter, suffix(existing, NODE_PREFIX));
        socketCounter = Math.max(socketCounter, suffix(existing, SOCKET_PREFIX));
        connectionCounter = Math.max(connectionCounter, suffix(existing, CONNECTION_PREFIX));
    }

    private static long suffix(String id, String prefix) {
        if (!id.startsWith(prefix))
            return 0;
        String tail = id.substring(prefix.length());
        if (tail.isEmpty() || tail.length() > 18)
            return 0;
        for (int i = 0; i < tail.length(); i++)
            if (!Character.isDigit(tail.charAt(i)))
                return 0;
        return Long.parseLong(tail);
    }
}
