package com.shading.sng.engine;

import java.util.List;

import com.shading.sng.api.ShaderBackend;
import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.SocketType;

/**
 * Backend-specific half of code generation, driven by the {@link DependencyResolver}.
 * <p>
 * The resolver decides what is evaluated and in which order; the emitter decides how each step is
 * spelled in the target language.
 */
public interface NodeEmitter {

    ShaderBackend backend();

    /** Identifier substituted for the template placeholder of {@code node}. */
    String mangledId(Node node);

    /**
     * Literal for a value landing in a socket of {@code type}. A null value yields the type's zero
     * literal.
     */
    String literal(SocketType type, NodeValue value);

    /**
     * Emits the bindings of an ordinary node and registers its output variables in {@code ctx}.
     *
     * @param args resolved argument expressions, in input declaration order
     */
    void emitNode(Node node, NodeDefinition definition, List<String> args, EvaluationContext ctx);

    /** Emits the final color binding of the sink node and records it as the final expression. */
    void emitSink(Node sink, List<String> args, EvaluationContext ctx);
}
