package com.shading.sng.codegen;

import com.shading.sng.model.SocketType;

/**
 * Spelling of types and constructors in each target language.
 * <p>
 * Only numeric types have a spelling. Sampler and texture sockets are refused when definitions are
 * loaded, since every value is bound to a local and neither language allows opaque locals.
 */
public enum Dialect {
    WGSL("f32", "vec3f", "vec4f"),
    GLSL("float", "vec3", "vec4");

    private final String scalar, vec3, vec4;

    Dialect(String scalar, String vec3, String vec4) {
        this.scalar = scalar;
        this.vec3 = vec3;
        this.vec4 = vec4;
    }

    public String typeName(SocketType type) {
        return switch (type) {
            case FLOAT -> scalar;
            case VEC3, COLOR -> vec3;
            case SAMPLER, TEXTURE -> throw new IllegalArgumentException("No " + name() + " local type for " + type);
        };
    }

    /** Three-component vector constructor, e.g. {@code vec3f}. */
    public String vec3() {
        return vec3;
    }

    /** Four-component vector constructor, e.g. {@code vec4f}. */
    public String vec4() {
        return vec4;
    }
}
