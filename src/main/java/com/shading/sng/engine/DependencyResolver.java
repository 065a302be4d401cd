package com.shading.sng.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.catalog.CodeTemplate;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.model.Connection;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Socket;

/**
 * Depth-first, memoized evaluation of the graph upstream of the sink node.
 * <p>
 * A node is evaluated only after every node feeding its inputs, so the emitted bindings form a
 * dependency-first order. Inputs are resolved left to right in declaration order, which is also the
 * argument order of the node's generated call. Each node is evaluated at most once per pass no
 * matter how many consumers it has; later consumers reuse the variables it registered.
 * <p>
 * The graph is assumed acyclic. A cycle does not loop forever (the visited set cuts it) but the
 * back edge resolves to a zero literal.
 */
public final class DependencyResolver {
    private static final Logger log = LogManager.getLogger(DependencyResolver.class);

    private final NodeCatalog catalog;
    private final NodeEmitter emitter;
    private final String sinkDefinitionId;
    private final CompilationListener listener;

    public DependencyResolver(NodeCatalog catalog, NodeEmitter emitter, String sinkDefinitionId,
            CompilationListener listener) {
        this.catalog = catalog;
        this.emitter = emitter;
        this.sinkDefinitionId = sinkDefinitionId;
        this.listener = listener != null ? listener : new CompilationListener() {
        };
    }

    /**
     * Definition ids reachable from the sink, in depth-first pre-order. Nodes whose definition is
     * missing from the catalog end the walk along their branch.
     */
    public Set<String> usedDefinitions(GraphIndex index, Node sink) {
        Set<String> used = new LinkedHashSet<>();
        collect(sink, index, new LinkedHashSet<>(), used);
        return used;
    }

    private void collect(Node node, GraphIndex index, Set<NodeId> seen, Set<String> used) {
        if (!seen.add(node.id()))
            return;
        boolean sink = sinkDefinitionId.equals(node.definitionId());
        if (!sink && catalog.getDefinition(node.definitionId()).isEmpty())
            return;
        used.add(node.definitionId());
        for (Socket input : node.inputs()) {
            index.feeding(input.id())
                    .flatMap(c -> index.node(c.fromNodeId()))
                    .ifPresent(source -> collect(source, index, seen, used));
        }
    }

    /**
     * Function declarations for every instance of every used definition, deduplicated by text and
     * kept in first-seen order.
     */
    public List<String> functionDeclarations(GraphIndex index, Set<String> usedDefinitions) {
        Set<String> declarations = new LinkedHashSet<>();
        for (String defId : usedDefinitions) {
            Optional<CodeTemplate> template = catalog.getDefinition(defId)
                    .flatMap(def -> def.template(emitter.backend()));
            if (template.isEmpty())
                continue;
            for (Node instance : index.instancesOf(defId))
                declarations.add(template.get().instantiate(emitter.mangledId(instance)));
        }
        return new ArrayList<>(declarations);
    }

    /** Evaluates everything upstream of {@code sink}, then the sink itself. */
    public EvaluationContext resolve(GraphIndex index, Node sink) {
        EvaluationContext ctx = new EvaluationContext();
        evaluate(sink, index, ctx);
        return ctx;
    }

    private void evaluate(Node node, GraphIndex index, EvaluationContext ctx) {
        if (!ctx.visit(node.id()))
            return;

        boolean sink = sinkDefinitionId.equals(node.definitionId());
        Optional<NodeDefinition> definition = catalog.getDefinition(node.definitionId());
        if (definition.isEmpty() && !sink) {
            log.warn("Skipping node {}: unknown definition '{}'", node.id(), node.definitionId());
            listener.onNodeSkipped(emitter.backend(), node.id(), node.definitionId(), "unknown definition");
            return;
        }

        List<String> args = new ArrayList<>(node.inputs().size());
        for (Socket input : node.inputs())
            args.add(resolveInput(node, input, index, ctx));

        if (sink)
            emitter.emitSink(node, args, ctx);
        else
            emitter.emitNode(node, definition.get(), args, ctx);

        int order = ctx.markEmitted(node.id());
        log.debug("Evaluated node {} ({}) at position {} with args {}", node.id(), node.definitionId(), order, args);
        listener.onNodeEmitted(emitter.backend(), node.id(), node.definitionId(), order);
    }

    private String resolveInput(Node node, Socket input, GraphIndex index, EvaluationContext ctx) {
        Optional<Connection> feeding = index.feeding(input.id());
        if (feeding.isPresent()) {
            Connection c = feeding.get();
            Optional<Node> source = index.node(c.fromNodeId());
            if (source.isPresent()) {
                evaluate(source.get(), index, ctx);
                Optional<String> variable = index.socket(c.fromSocketId())
                        .flatMap(out -> ctx.variableFor(c.fromNodeId(), out.name()));
                if (variable.isPresent())
                    return variable.get();
            }
            log.debug("Input {}.{} is fed by {} but the source produced no value; using zero",
                    node.id(), input.name(), c.id());
            return emitter.literal(input.type(), null);
        }
        NodeValue value = node.value(input.name()).orElse(input.defaultValue());
        return emitter.literal(input.type(), value);
    }
}
