package com.shading.sng.api;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A compiled shader document: one module, or a vertex/fragment pair.
 */
public interface ShaderSource {

    ShaderBackend backend();

    /** The document as a single text. Stage bundles serialize to a JSON object. */
    String text();

    /** WGSL form: uniforms, vertex and fragment stage in one module. */
    record SingleModule(String code) implements ShaderSource {
        @Override
        public ShaderBackend backend() {
            return ShaderBackend.WGSL;
        }

        @Override
        public String text() {
            return code;
        }
    }

    /** GLSL form: two separately compiled stages. */
    record StageBundle(String vertex, String fragment) implements ShaderSource {
        private static final ObjectMapper MAPPER = new ObjectMapper();

        @Override
        public ShaderBackend backend() {
            return ShaderBackend.GLSL;
        }

        @Override
        public String text() {
            return toJson();
        }

        /** {@code {"vertex": ..., "fragment": ...}} */
        public String toJson() {
            Map<String, String> stages = new LinkedHashMap<>();
            stages.put("vertex", vertex);
            stages.put("fragment", fragment);
            try {
                return MAPPER.writeValueAsString(stages);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize shader stages", e);
            }
        }

        public static StageBundle fromJson(String json) {
            try {
                Map<?, ?> stages = MAPPER.readValue(json, Map.class);
                if (stages == null || !(stages.get("vertex") instanceof String vertex)
                        || !(stages.get("fragment") instanceof String fragment))
                    throw new IllegalArgumentException(
                            "Not a shader stage bundle: vertex and fragment must both be strings");
                return new StageBundle(vertex, fragment);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Not a shader stage bundle: " + e.getOriginalMessage(), e);
            }
        }
    }
}
