package com.shading.sng.codegen;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.shading.sng.ScenarioGraphs;
import com.shading.sng.api.CompilationListener;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.io.CompilerConfig;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.NodeId;

public class ShaderCompilerTest {

    private static final class RecordingListener implements CompilationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onCompileStart(ShaderBackend backend) {
            events.add("start " + backend);
        }

        @Override
        public void onNodeEmitted(ShaderBackend backend, NodeId nodeId, String definitionId, int order) {
            events.add(order + " " + nodeId);
        }

        @Override
        public void onCompileEnd(ShaderBackend backend, int nodesEmitted, boolean fallback) {
            events.add("end " + nodesEmitted + " " + fallback);
        }
    }

    @Test
    public void testCompilesEachBackendToItsDocumentShape() {
        ShaderCompiler compiler = new ShaderCompiler(ScenarioGraphs.CATALOG);
        NodeGraph graph = ScenarioGraphs.uvSeparateCombine().graph();
        assertTrue(compiler.compile(graph, ShaderBackend.WGSL) instanceof ShaderSource.SingleModule);
        assertTrue(compiler.compile(graph, ShaderBackend.GLSL) instanceof ShaderSource.StageBundle);
    }

    @Test
    public void testListenerSeesEvaluationOrder() {
        RecordingListener listener = new RecordingListener();
        ShaderCompiler compiler = new ShaderCompiler(ScenarioGraphs.CATALOG).addListener(listener);
        compiler.compile(ScenarioGraphs.uvSeparateCombine().graph(), ShaderBackend.WGSL);
        assertEquals(List.of("start WGSL", "0 node_1", "1 node_2", "2 node_3", "3 node_4", "end 4 false"),
                listener.events);
    }

    @Test
    public void testListenerSeesFallback() {
        RecordingListener listener = new RecordingListener();
        ShaderCompiler compiler = new ShaderCompiler(ScenarioGraphs.CATALOG).addListener(listener);
        ShaderSource source = compiler.compile(new NodeGraph(), ShaderBackend.GLSL);
        assertEquals(compiler.defaultDocument(ShaderBackend.GLSL), source);
        assertEquals(List.of("start GLSL", "end 0 true"), listener.events);
    }

    @Test
    public void testCustomSinkDefinition() {
        CompilerConfig config = CompilerConfig.fromJson("{\"sinkDefinitionId\": \"my_output\"}");
        ShaderCompiler compiler = new ShaderCompiler(ScenarioGraphs.CATALOG, config);
        // output_color is now an ordinary node with no template, so there is no sink
        assertEquals(compiler.defaultDocument(ShaderBackend.WGSL),
                compiler.compile(ScenarioGraphs.uvSeparateCombine().graph(), ShaderBackend.WGSL));
    }

    @Test
    public void testWithDefaultsUsesBundledCatalog() {
        ShaderCompiler compiler = ShaderCompiler.withDefaults();
        assertTrue(compiler.catalog().getDefinition("output_color").isPresent());
        assertEquals("output_color", compiler.config().getSinkDefinitionId());
    }
}
