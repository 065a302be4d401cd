package com.shading.sng.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.SocketType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Socket declared by a node definition.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SocketDefinition {
    private String name;
    private SocketType type;
    @JsonProperty("default")
    private Object defaultValue;
    private String description;

    public SocketDefinition(String name, SocketType type) {
        this(name, type, null, null);
    }

    public SocketDefinition(String name, SocketType type, Object defaultValue) {
        this(name, type, defaultValue, null);
    }

    /** The authored default as a typed value, or null when none is declared. */
    @JsonIgnore
    public NodeValue defaultNodeValue() {
        return defaultValue == null ? null : NodeValue.of(defaultValue);
    }
}
