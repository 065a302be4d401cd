package com.shading.sng.codegen;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderGenerator;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.io.CompilerConfig;
import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.util.CompositeCompilationListener;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point: {@code compile(nodes, connections, backend)}.
 * <p>
 * Holds one generator per backend, all sharing the same catalog and configuration. Listeners added
 * through {@link #addListener} see the compiles of every backend.
 */
@Log4j2
public final class ShaderCompiler {
    private final NodeCatalog catalog;
    private final CompilerConfig config;
    private final CompositeCompilationListener listeners = new CompositeCompilationListener();
    private final Map<ShaderBackend, ShaderGenerator> generators = new EnumMap<>(ShaderBackend.class);

    public ShaderCompiler(NodeCatalog catalog) {
        this(catalog, CompilerConfig.defaults());
    }

    public ShaderCompiler(NodeCatalog catalog, CompilerConfig config) {
        this.catalog = catalog;
        this.config = config;
        generators.put(ShaderBackend.WGSL, new WgslShaderGenerator(catalog, config, listeners));
        generators.put(ShaderBackend.GLSL, new GlslShaderGenerator(catalog, config, listeners));
    }

    /** Compiler over the catalog named by {@link CompilerConfig#load()}. */
    public static ShaderCompiler withDefaults() {
        CompilerConfig config = CompilerConfig.load();
        return new ShaderCompiler(config.createCatalog(), config);
    }

    public ShaderCompiler addListener(CompilationListener listener) {
        listeners.add(listener);
        return this;
    }

    public NodeCatalog catalog() {
        return catalog;
    }

    public CompilerConfig config() {
        return config;
    }

    public ShaderGenerator generator(ShaderBackend backend) {
        ShaderGenerator g = generators.get(backend);
        if (g == null)
            throw new IllegalArgumentException("No generator for backend " + backend);
        return g;
    }

    public ShaderSource compile(List<Node> nodes, List<Connection> connections, ShaderBackend backend) {
        long start = System.nanoTime();
        ShaderSource source = generator(backend).generate(nodes, connections);
        if (log.isDebugEnabled())
            log.debug("{} compile of {} nodes took {} us", backend, nodes.size(), (System.nanoTime() - start) / 1000);
        return source;
    }

    public ShaderSource compile(NodeGraph graph, ShaderBackend backend) {
        return compile(graph.allNodes(), graph.allConnections(), backend);
    }

    public ShaderSource defaultDocument(ShaderBackend backend) {
        return generator(backend).generateDefault();
    }
}
