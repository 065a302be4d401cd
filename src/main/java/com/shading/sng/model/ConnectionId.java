package com.shading.sng.model;

public record ConnectionId(String value) {
    public ConnectionId {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("ConnectionId cannot be empty");
    }

    @Override
    public String toString() {
        return value;
    }
}
