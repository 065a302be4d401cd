package com.shading.sng.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a saved graph.
 * <p>
 * Values are plain JSON: a number for a scalar, an array of numbers for a vector.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    public static final int FORMAT_VERSION = 1;

    private int version = FORMAT_VERSION;
    private List<NodeDoc> nodes = new ArrayList<>();
    private List<ConnectionDoc> connections = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDoc {
        private String id, definitionId;
        private PositionDoc position = new PositionDoc();
        private List<SocketDoc> inputs = new ArrayList<>();
        private List<SocketDoc> outputs = new ArrayList<>();
        private Map<String, Object> values = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PositionDoc {
        private double x, y;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class SocketDoc {
        private String id, name, type;
        private Object defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDoc {
        private String id, fromNodeId, fromSocketId, toNodeId, toSocketId;
    }
}
