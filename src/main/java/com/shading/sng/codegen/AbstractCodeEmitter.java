package com.shading.sng.codegen;

import java.util.List;
import java.util.Locale;

import com.shading.sng.catalog.NodeDefinition;
import com.shading.sng.catalog.SocketDefinition;
import com.shading.sng.engine.EvaluationContext;
import com.shading.sng.engine.NodeEmitter;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.SocketCoercion;
import com.shading.sng.model.SocketType;

/**
 * Shared emission algorithm. Subclasses only decide how a binding statement and the final color
 * statement are spelled.
 * <p>
 * Generated names:
 * <ul>
 * <li>{@code node_<id>} for a single-output node, where {@code <id>} is the node id without its
 * {@code node_} prefix, escaped by {@link #mangle(String)}</li>
 * <li>{@code node_<id>_<output>} per output of a multi-output node, output name lower-cased</li>
 * <li>{@code v1, v2, ...} for intermediate bindings, in evaluation order</li>
 * <li>{@value #FINAL_COLOR} for the sink's result</li>
 * </ul>
 */
public abstract class AbstractCodeEmitter implements NodeEmitter {
    public static final String FINAL_COLOR = "finalColor";
    public static final String NODE_PREFIX = "node_";
    public static final String DEFAULT_ALPHA = "1.0";
    static final int COLOR_PICKER_DECIMALS = 4;
    private static final double[] WHITE = { 1, 1, 1 };

    protected final Dialect dialect;
    protected final LiteralFormatter literals;
    private final String colorValueKey;

    protected AbstractCodeEmitter(Dialect dialect, String colorValueKey) {
        this.dialect = dialect;
        this.literals = new LiteralFormatter(dialect);
        this.colorValueKey = colorValueKey;
    }

    public Dialect dialect() {
        return dialect;
    }

    public LiteralFormatter literals() {
        return literals;
    }

    /** Spells {@code <type> <var> = <expr>;} (or the backend's equivalent), indented for a body. */
    protected abstract String binding(String variable, String typeName, String expression);

    /** Spells the statement that names the sink's 4-component result {@value #FINAL_COLOR}. */
    protected abstract String finalColorBinding(String expression);

    @Override
    public String literal(SocketType type, NodeValue value) {
        return literals.format(type, value);
    }

    @Override
    public String mangledId(Node node) {
        return mangle(node.id().value());
    }

    /**
     * Turns a node id into an identifier fragment. Distinct ids always give distinct fragments.
     * <p>
     * ASCII letters and digits are kept, {@code _} becomes {@code __} and any other character
     * becomes {@code _x<hex code point>_}. Ids carrying the {@code node_} prefix lose it; ids
     * without it are marked with a leading {@code _n}, which no escaped id can start with.
     */
    public static String mangle(String nodeId) {
        if (nodeId.startsWith(NODE_PREFIX))
            return escape(nodeId.substring(NODE_PREFIX.length()));
        return "_n" + escape(nodeId);
    }

    private static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> {
            if (cp < 128 && Character.isLetterOrDigit(cp))
                sb.appendCodePoint(cp);
            else if (cp == '_')
                sb.append("__");
            else
                sb.append("_x").append(Integer.toHexString(cp).toUpperCase(Locale.ROOT)).append('_');
        });
        return sb.toString();
    }

    public String functionName(Node node) {
        return NODE_PREFIX + mangledId(node);
    }

    public String functionName(Node node, String outputName) {
        return functionName(functionName(node), outputName);
    }

    /** {@code <base>_<output>}, output name lower-cased. */
    public static String functionName(String base, String outputName) {
        return base + "_" + outputName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }

    @Override
    public void emitNode(Node node, NodeDefinition definition, List<String> args, EvaluationContext ctx) {
        List<SocketDefinition> outputs = definition.getOutputs();
        if (outputs == null || outputs.isEmpty())
            return;

        if (definition.isColorPicker()) {
            SocketDefinition out = outputs.get(0);
            double[] rgb = node.value(colorValueKey).map(NodeValue::components).orElse(WHITE);
            String variable = ctx.nextVariable();
            ctx.register(node.id(), out.getName(), variable);
            ctx.emit(binding(variable, dialect.typeName(out.getType()),
                    literals.fixedVector(SocketCoercion.fit(rgb, SocketType.VEC3), COLOR_PICKER_DECIMALS)));
            return;
        }

        String argList = String.join(", ", args);
        if (outputs.size() == 1) {
            SocketDefinition out = outputs.get(0);
            String variable = ctx.nextVariable();
            ctx.register(node.id(), out.getName(), variable);
            ctx.emit(binding(variable, dialect.typeName(out.getType()), functionName(node) + "(" + argList + ")"));
            return;
        }

        // one generated function per output, all taking the same arguments
        for (SocketDefinition out : outputs) {
            String variable = ctx.nextVariable();
            ctx.register(node.id(), out.getName(), variable);
            ctx.emit(binding(variable, dialect.typeName(out.getType()),
                    functionName(node, out.getName()) + "(" + argList + ")"));
        }
    }

    @Override
    public void emitSink(Node sink, List<String> args, EvaluationContext ctx) {
        String rgb = args.size() > 0 ? args.get(0) : literals.zero(SocketType.VEC3);
        String alpha = args.size() > 1 ? args.get(1) : DEFAULT_ALPHA;
        ctx.emit(finalColorBinding(dialect.vec4() + "(" + rgb + ", " + alpha + ")"));
        ctx.setFinalExpression(FINAL_COLOR);
    }
}
