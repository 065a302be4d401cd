package com.shading.sng.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of semantic socket types.
 * <p>
 * {@link #COLOR} is an alias of {@link #VEC3}: both lower to the same shader type and may be
 * connected to each other. There is no two-component socket type; authored {@code "vec2"} sockets are
 * read as {@link #VEC3} with the third component left at zero.
 */
public enum SocketType {
    FLOAT("float", 1),
    VEC3("vec3", 3),
    COLOR("color", 3),
    SAMPLER("sampler", 0),
    TEXTURE("texture2d", 0);

    private final String jsonName;
    private final int components;

    SocketType(String jsonName, int components) {
        this.jsonName = jsonName;
        this.components = components;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    /** Number of numeric components a literal of this type carries; 0 for opaque resources. */
    public int components() {
        return components;
    }

    public boolean isVector() {
        return components == 3;
    }

    /** Whether an output of this type may feed an input of {@code destination}. */
    public boolean isCompatible(SocketType destination) {
        return SocketCoercion.of(this, destination).connectable();
    }

    @JsonCreator
    public static SocketType fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Socket type cannot be null");
        String key = s.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "float", "f32", "scalar" -> FLOAT;
            case "vec3", "vec2" -> VEC3;
            case "color" -> COLOR;
            case "sampler" -> SAMPLER;
            case "texture2d", "texture" -> TEXTURE;
            default -> throw new IllegalArgumentException("Unknown socket type: " + s);
        };
    }
}
