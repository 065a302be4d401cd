package com.shading.sng.editor;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.shading.sng.api.GraphChangeListener;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.codegen.ShaderCompiler;
import com.shading.sng.model.NodeGraph;

/**
 * Recompiles the graph after every edit and keeps the latest document per backend.
 * <p>
 * Runs synchronously on the editing thread, so the documents are always in step with the graph
 * that was just changed.
 */
public final class LiveShaderCompiler implements GraphChangeListener {
    private static final Logger log = LogManager.getLogger(LiveShaderCompiler.class);

    private final ShaderCompiler compiler;
    private final Map<ShaderBackend, ShaderSource> latest = new EnumMap<>(ShaderBackend.class);
    private long compileCount;

    public LiveShaderCompiler(ShaderCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public void onGraphChanged(NodeGraph graph, String change) {
        for (ShaderBackend backend : ShaderBackend.values())
            latest.put(backend, compiler.compile(graph, backend));
        compileCount++;
        log.debug("Recompiled after {} (#{})", change, compileCount);
    }

    /** Latest document for {@code backend}; empty until the first change. */
    public Optional<ShaderSource> latest(ShaderBackend backend) {
        return Optional.ofNullable(latest.get(backend));
    }

    public long compileCount() {
        return compileCount;
    }
}
