package com.shading.sng.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Catalog of node definitions loaded from JSON.
 * <p>
 * Every definition is validated as it is registered, so a template that lacks the
 * {@value CodeTemplate#PLACEHOLDER} placeholder fails here rather than during compilation. Once
 * built, the registry is only read and may be shared between compilers and threads.
 */
public final class DefinitionRegistry implements NodeCatalog {
    private static final Logger log = LogManager.getLogger(DefinitionRegistry.class);

    /** Definition files bundled with the library, in menu order. */
    public static final List<String> BUILT_IN_RESOURCES = List.of(
            "nodes/input.json",
            "nodes/math.json",
            "nodes/vector.json",
            "nodes/color.json",
            "nodes/pattern.json",
            "nodes/output.json");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<NodeDefinition>> DEFINITION_LIST = new TypeReference<>() {
    };

    private final Map<String, NodeDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, List<NodeDefinition>> categories = new LinkedHashMap<>();

    public DefinitionRegistry() {
    }

    /** Registry holding every bundled definition. */
    public static DefinitionRegistry builtIn() {
        return fromResources(BUILT_IN_RESOURCES);
    }

    public static DefinitionRegistry fromResources(List<String> resources) {
        DefinitionRegistry registry = new DefinitionRegistry();
        for (String r : resources)
            registry.loadResource(r);
        return registry;
    }

    public DefinitionRegistry register(NodeDefinition def) {
        def.validate();
        if (definitions.containsKey(def.getId()))
            throw new IllegalArgumentException("Duplicate node definition id: " + def.getId());
        definitions.put(def.getId(), def);
        String category = def.getCategory() != null ? def.getCategory() : "misc";
        categories.computeIfAbsent(category, k -> new ArrayList<>()).add(def);
        return this;
    }

    /** Parses a JSON array of definitions and registers each one. */
    public DefinitionRegistry loadJson(String json) {
        try {
            List<NodeDefinition> defs = MAPPER.readValue(json, DEFINITION_LIST);
            defs.forEach(this::register);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse node definitions", e);
        }
    }

    public DefinitionRegistry loadResource(String resource) {
        ClassLoader cl = DefinitionRegistry.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Node definition resource not found: " + resource);
            List<NodeDefinition> defs = MAPPER.readValue(in, DEFINITION_LIST);
            defs.forEach(this::register);
            log.debug("Loaded {} node definitions from {}", defs.size(), resource);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load node definitions from " + resource, e);
        }
    }

    @Override
    public Optional<NodeDefinition> getDefinition(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    @Override
    public List<NodeDefinition> allDefinitions() {
        return List.copyOf(definitions.values());
    }

    @Override
    public List<String> categories() {
        return List.copyOf(categories.keySet());
    }

    @Override
    public List<NodeDefinition> definitionsByCategory(String category) {
        return List.copyOf(categories.getOrDefault(category, List.of()));
    }

    @Override
    public List<NodeDefinition> search(String query) {
        String q = query.toLowerCase(Locale.ROOT);
        return definitions.values().stream()
                .filter(d -> contains(d.getName(), q) || contains(d.getDescription(), q) || contains(d.getCategory(), q))
                .toList();
    }

    private static boolean contains(String field, String lowerQuery) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }

    public int size() {
        return definitions.size();
    }
}
