package com.shading.sng.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shading.sng.api.ShaderBackend;

import lombok.Data;

/**
 * POJO representation of a catalog entry: sockets plus one code template per backend.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NodeDefinition {
    public static final String COLOR_PICKER_UI = "colorPicker";

    private String id, name, category, description, color;
    private List<SocketDefinition> inputs = new ArrayList<>();
    private List<SocketDefinition> outputs = new ArrayList<>();
    /** Backend key ({@link ShaderBackend#key()}) to template text. */
    private Map<String, String> code = new LinkedHashMap<>();
    @JsonProperty("customUI")
    private String customUi;

    @JsonIgnore
    public boolean isColorPicker() {
        return COLOR_PICKER_UI.equals(customUi);
    }

    /** The code template for {@code backend}, if this definition declares one. */
    @JsonIgnore
    public Optional<CodeTemplate> template(ShaderBackend backend) {
        String text = code == null ? null : code.get(backend.key());
        if (text == null || text.isBlank())
            return Optional.empty();
        return Optional.of(new CodeTemplate(text));
    }

    /**
     * Checks structure and templates. Throws {@link IllegalArgumentException} describing the first
     * problem found.
     */
    public void validate() {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node definition without id");
        checkSockets(inputs, "input");
        checkSockets(outputs, "output");
        if (code != null) {
            for (Map.Entry<String, String> e : code.entrySet()) {
                try {
                    new CodeTemplate(e.getValue());
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException(
                            "Definition '" + id + "' has an invalid " + e.getKey() + " template: " + ex.getMessage(), ex);
                }
            }
        }
    }

    private void checkSockets(List<SocketDefinition> sockets, String kind) {
        if (sockets == null)
            return;
        List<String> names = new ArrayList<>();
        for (SocketDefinition s : sockets) {
            if (s.getName() == null || s.getName().isBlank())
                throw new IllegalArgumentException("Definition '" + id + "' has an unnamed " + kind + " socket");
            if (s.getType() == null)
                throw new IllegalArgumentException(
                        "Definition '" + id + "' " + kind + " '" + s.getName() + "' has no type");
            if (s.getType().components() == 0)
                throw new IllegalArgumentException("Definition '" + id + "' " + kind + " '" + s.getName()
                        + "' has opaque type " + s.getType() + ", which generated shaders cannot bind");
            if (names.contains(s.getName()))
                throw new IllegalArgumentException(
                        "Definition '" + id + "' declares " + kind + " '" + s.getName() + "' twice");
            names.add(s.getName());
            if (s.getDefaultValue() != null)
                s.defaultNodeValue();
        }
    }
}
