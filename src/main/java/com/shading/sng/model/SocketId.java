package com.shading.sng.model;

/**
 * Identity of a {@link Socket}, unique across the whole graph.
 */
public record SocketId(String value) {
    public SocketId {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("SocketId cannot be empty");
    }

    @Override
    public String toString() {
        return value;
    }
}
