package com.shading.sng.util;

import static org.junit.Assert.*;

import org.junit.Test;

import com.shading.sng.ScenarioGraphs;
import com.shading.sng.editor.GraphEditor;

public class GraphExplainTest {

    private final GraphEditor editor = ScenarioGraphs.uvSeparateCombine();
    private final GraphExplain explain = new GraphExplain(editor.graph(), ScenarioGraphs.CATALOG);

    @Test
    public void testDumpTopology() {
        String dump = explain.dumpTopology();
        assertTrue(dump.startsWith("Graph (4 nodes, 4 connections):\n"));
        assertTrue(dump.contains("  [1] node_2 (vec_separate2) -> node_3.X, node_3.Y\n"));
        assertTrue(dump.contains("  [3] node_4 (output_color)\n"));
    }

    @Test
    public void testMermaidLabelsEdgesWithSocketNames() {
        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph LR;\n"));
        assertTrue(mermaid.contains("  node_2 -- \"X:X\" --> node_3;\n"));
    }

    @Test
    public void testFunctionNames() {
        String names = explain.functionNames();
        assertTrue(names.contains("  node_1 -> node_1\n"));
        assertTrue(names.contains("  node_2 -> node_2_x, node_2_y\n"));
        assertTrue(names.contains("  node_4 -> (none)\n"));
    }

    @Test
    public void testCompositeListenerFansOut() {
        CompositeCompilationListener composite = new CompositeCompilationListener();
        int[] calls = new int[1];
        composite.add(new com.shading.sng.api.CompilationListener() {
            @Override
            public void onCompileStart(com.shading.sng.api.ShaderBackend backend) {
                calls[0]++;
            }
        });
        composite.add(new com.shading.sng.api.CompilationListener() {
            @Override
            public void onCompileStart(com.shading.sng.api.ShaderBackend backend) {
                calls[0] += 10;
            }
        });
        composite.onCompileStart(com.shading.sng.api.ShaderBackend.WGSL);
        assertEquals(11, calls[0]);
        assertEquals(2, composite.size());
    }
}
