package com.shading.sng.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shading.sng.catalog.DefinitionRegistry;

import lombok.Data;

/**
 * Compiler settings. Every field has a working default; a classpath resource named
 * {@value #RESOURCE} overrides the fields it names.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompilerConfig {
    public static final String RESOURCE = "sng-compiler.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Definition id marking the graph's final output node. */
    private String sinkDefinitionId = "output_color";
    /** Stored-value key holding a color picker's RGB triple. */
    private String colorValueKey = "_color";
    /** Run {@code DocumentLint} over every compiled document and log its findings. */
    private boolean lintEnabled = true;
    /** Classpath resources the default catalog is loaded from, in order. */
    private List<String> catalogResources = new ArrayList<>(DefinitionRegistry.BUILT_IN_RESOURCES);

    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    /** Defaults overlaid with {@value #RESOURCE} when it is on the classpath. */
    public static CompilerConfig load() {
        try (InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null)
                return defaults();
            return MAPPER.readerForUpdating(defaults()).readValue(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static CompilerConfig fromJson(String json) {
        try {
            return MAPPER.readerForUpdating(defaults()).readValue(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid compiler configuration", e);
        }
    }

    /** Catalog holding the definitions listed in {@link #catalogResources}. */
    public DefinitionRegistry createCatalog() {
        return DefinitionRegistry.fromResources(catalogResources);
    }
}
