package com.shading.sng.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.shading.sng.model.NodeId;

/**
 * Per-compile bookkeeping: visited nodes, the variable counter, the output-variable registry and
 * the emitted body lines.
 * <p>
 * One instance lives for exactly one compile pass and is never shared.
 */
public final class EvaluationContext {
    private final Set<NodeId> visited = new HashSet<>();
    private final Map<NodeId, Map<String, String>> outputVars = new HashMap<>();
    private final List<String> lines = new ArrayList<>();
    private final List<NodeId> evaluationOrder = new ArrayList<>();
    private int variableCounter;
    private String finalExpression;

    /** Marks the node visited; false if it already was. */
    public boolean visit(NodeId nodeId) {
        return visited.add(nodeId);
    }

    public boolean isVisited(NodeId nodeId) {
        return visited.contains(nodeId);
    }

    /** Next fresh variable name: v1, v2, ... */
    public String nextVariable() {
        return "v" + (++variableCounter);
    }

    public int variableCount() {
        return variableCounter;
    }

    public void register(NodeId nodeId, String outputName, String variable) {
        outputVars.computeIfAbsent(nodeId, k -> new LinkedHashMap<>()).put(outputName, variable);
    }

    public Optional<String> variableFor(NodeId nodeId, String outputName) {
        Map<String, String> vars = outputVars.get(nodeId);
        return vars == null ? Optional.empty() : Optional.ofNullable(vars.get(outputName));
    }

    public void emit(String line) {
        lines.add(line);
    }

    /** Records that a node produced bindings; returns its zero-based position. */
    public int markEmitted(NodeId nodeId) {
        evaluationOrder.add(nodeId);
        return evaluationOrder.size() - 1;
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public List<NodeId> evaluationOrder() {
        return Collections.unmodifiableList(evaluationOrder);
    }

    public Optional<String> finalExpression() {
        return Optional.ofNullable(finalExpression);
    }

    public void setFinalExpression(String finalExpression) {
        this.finalExpression = finalExpression;
    }
}
