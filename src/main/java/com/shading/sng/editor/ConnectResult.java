package com.shading.sng.editor;

import java.util.List;

import com.shading.sng.model.Connection;

/**
 * Outcome of {@link GraphEditor#connect}: the new connection and whatever it displaced from the
 * input socket.
 */
public record ConnectResult(Connection connection, List<Connection> replaced) {
    public ConnectResult {
        replaced = List.copyOf(replaced);
    }

    public boolean replacedExisting() {
        return !replaced.isEmpty();
    }
}
