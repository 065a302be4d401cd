package com.shading.sng.codegen;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderGenerator;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.engine.DependencyResolver;
import com.shading.sng.engine.EvaluationContext;
import com.shading.sng.engine.GraphIndex;
import com.shading.sng.io.CompilerConfig;
import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;

/**
 * One compile pass: index the snapshot, find the sink, resolve, assemble.
 * <p>
 * Holds only read-only collaborators; every piece of per-compile state lives in the
 * {@link EvaluationContext} created for that call.
 */
public abstract class AbstractShaderGenerator implements ShaderGenerator {
    private static final Logger log = LogManager.getLogger(AbstractShaderGenerator.class);

    private final NodeCatalog catalog;
    private final CompilerConfig config;
    private final AbstractCodeEmitter emitter;
    private final ShaderAssembler assembler;
    private final CompilationListener listener;

    protected AbstractShaderGenerator(NodeCatalog catalog, CompilerConfig config, AbstractCodeEmitter emitter,
            ShaderAssembler assembler, CompilationListener listener) {
        if (catalog == null)
            throw new IllegalArgumentException("Node catalog is required");
        this.catalog = catalog;
        this.config = config != null ? config : CompilerConfig.defaults();
        this.emitter = emitter;
        this.assembler = assembler;
        this.listener = listener != null ? listener : new CompilationListener() {
        };
    }

    @Override
    public ShaderBackend backend() {
        return emitter.backend();
    }

    public AbstractCodeEmitter emitter() {
        return emitter;
    }

    @Override
    public ShaderSource generate(List<Node> nodes, List<Connection> connections) {
        listener.onCompileStart(backend());
        GraphIndex index = GraphIndex.of(nodes, connections);

        Optional<Node> sink = index.firstOf(config.getSinkDefinitionId());
        if (sink.isEmpty()) {
            log.debug("No '{}' node among {} nodes; using the default {} document",
                    config.getSinkDefinitionId(), index.nodeCount(), backend());
            listener.onCompileEnd(backend(), 0, true);
            return generateDefault();
        }
        if (index.instancesOf(config.getSinkDefinitionId()).size() > 1)
            log.warn("Graph has {} '{}' nodes; compiling from {}", index.instancesOf(config.getSinkDefinitionId()).size(),
                    config.getSinkDefinitionId(), sink.get().id());

        DependencyResolver resolver = new DependencyResolver(catalog, emitter, config.getSinkDefinitionId(), listener);
        Set<String> used = resolver.usedDefinitions(index, sink.get());
        List<String> functions = resolver.functionDeclarations(index, used);
        EvaluationContext ctx = resolver.resolve(index, sink.get());

        ShaderSource source = assembler.assemble(functions, ctx.lines(),
                ctx.finalExpression().orElse(AbstractCodeEmitter.FINAL_COLOR));

        if (config.isLintEnabled()) {
            for (String finding : DocumentLint.check(source))
                log.warn("{} lint: {}", backend(), finding);
        }
        log.debug("Compiled {} nodes into {} functions for {}", ctx.evaluationOrder().size(), functions.size(), backend());
        listener.onCompileEnd(backend(), ctx.evaluationOrder().size(), false);
        return source;
    }

    @Override
    public ShaderSource generateDefault() {
        return assembler.defaultDocument();
    }
}
