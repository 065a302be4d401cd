package com.shading.sng.model;

/**
 * Identity of a {@link Node}. Stable for the node's lifetime.
 */
public record NodeId(String value) {
    public NodeId {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("NodeId cannot be empty");
    }

    @Override
    public String toString() {
        return value;
    }
}
