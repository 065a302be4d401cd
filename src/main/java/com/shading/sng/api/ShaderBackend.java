package com.shading.sng.api;

import java.util.Locale;

/**
 * Target shading languages the compiler can emit.
 */
public enum ShaderBackend {
    /** WebGPU shading language; one self-contained module per document. */
    WGSL("wgsl"),
    /** GLSL ES 3.00 for WebGL2; separate vertex and fragment stage texts. */
    GLSL("glsl");

    private final String key;

    ShaderBackend(String key) {
        this.key = key;
    }

    /** Key under which node definitions carry this backend's code template. */
    public String key() {
        return key;
    }

    public static ShaderBackend fromString(String s) {
        String k = s.trim().toLowerCase(Locale.ROOT);
        return switch (k) {
            case "wgsl", "webgpu" -> WGSL;
            case "glsl", "webgl", "webgl2" -> GLSL;
            default -> throw new IllegalArgumentException("Unknown shader backend: " + s);
        };
    }
}
