package com.shading.sng.util;

import java.util.Arrays;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.model.NodeId;

/**
 * Fans compile callbacks out to several listeners, in registration order.
 */
public class CompositeCompilationListener implements CompilationListener {
    private CompilationListener[] listeners = new CompilationListener[0];

    public void add(CompilationListener listener) {
        CompilationListener[] old = listeners;
        CompilationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onCompileStart(ShaderBackend backend) {
        for (CompilationListener l : listeners)
            l.onCompileStart(backend);
    }

    @Override
    public void onNodeEmitted(ShaderBackend backend, NodeId nodeId, String definitionId, int order) {
        for (CompilationListener l : listeners)
            l.onNodeEmitted(backend, nodeId, definitionId, order);
    }

    @Override
    public void onNodeSkipped(ShaderBackend backend, NodeId nodeId, String definitionId, String reason) {
        for (CompilationListener l : listeners)
            l.onNodeSkipped(backend, nodeId, definitionId, reason);
    }

    @Override
    public void onCompileEnd(ShaderBackend backend, int nodesEmitted, boolean fallback) {
        for (CompilationListener l : listeners)
            l.onCompileEnd(backend, nodesEmitted, fallback);
    }
}
