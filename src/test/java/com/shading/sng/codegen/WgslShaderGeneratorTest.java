package com.shading.sng.codegen;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.shading.sng.ScenarioGraphs;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.editor.GraphEditor;
import com.shading.sng.io.GraphSerializer;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Position;

public class WgslShaderGeneratorTest {
    private final WgslShaderGenerator generator = new WgslShaderGenerator(ScenarioGraphs.CATALOG);

    private String compile(NodeGraph graph) {
        return generator.generate(graph.allNodes(), graph.allConnections()).text();
    }

    private static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1))
            n++;
        return n;
    }

    @Test
    public void testScenarioDocument() {
        ShaderSource source = generator.generate(ScenarioGraphs.uvSeparateCombine().graph().allNodes(),
                ScenarioGraphs.uvSeparateCombine().graph().allConnections());
        assertTrue(source instanceof ShaderSource.SingleModule);
        assertEquals(ShaderBackend.WGSL, source.backend());

        String text = source.text();
        assertTrue(text.startsWith("// Generated WGSL Shader\n"));
        assertTrue(text.contains("@group(0) @binding(0) var<uniform> uniforms: Uniforms;"));
        assertTrue(text.contains("fn vertexMain(@builtin(vertex_index) vertexIndex: u32) -> VertexOutput {"));
        assertTrue(text.contains("fn node_3(x: f32, y: f32, z: f32) -> vec3f {"));
        assertTrue(text.contains("  let v4: vec3f = node_3(v2, v3, 0.0);\n"));
        assertTrue(text.contains("  fragUv = input.uv;\n"));
        assertTrue(text.endsWith("  let finalColor = vec4f(v4, 1.0);\n\n  return finalColor;\n}\n"));
        assertEquals(List.of(), DocumentLint.check(source));
    }

    @Test
    public void testMultiOutputNodeCallsOneFunctionPerOutput() {
        String text = compile(ScenarioGraphs.uvSeparateCombine().graph());
        assertTrue(text.contains("fn node_2_x(v: vec3f) -> f32 {"));
        assertTrue(text.contains("fn node_2_y(v: vec3f) -> f32 {"));
        assertEquals(1, count(text, "= node_2_x(v1);"));
        assertEquals(1, count(text, "= node_2_y(v1);"));
        assertTrue(text.indexOf("let v2: f32 = node_2_x(v1);") < text.indexOf("let v3: f32 = node_2_y(v1);"));
    }

    @Test
    public void testFanOutEmitsSharedNodeOnce() {
        String text = compile(ScenarioGraphs.fanOut().graph());
        assertEquals(1, count(text, "fn node_2("));
        assertEquals(1, count(text, "= node_2("));
        assertTrue(text.contains("  let v3: f32 = node_3(v2, v2);"));
    }

    @Test
    public void testOutputIsDeterministic() {
        GraphEditor editor = ScenarioGraphs.fanOut();
        assertEquals(compile(editor.graph()), compile(editor.graph()));
        assertEquals(compile(ScenarioGraphs.fanOut().graph()), compile(editor.graph()));
    }

    @Test
    public void testEmptyGraphFallsBackToDefault() {
        String text = compile(new NodeGraph());
        assertEquals(generator.generateDefault().text(), text);
        assertTrue(text.contains("return vec4f(input.uv, 0.5 + 0.5 * sin(uniforms.time), 1.0);"));
    }

    @Test
    public void testGraphWithoutSinkFallsBackToDefault() {
        GraphEditor editor = new GraphEditor(ScenarioGraphs.CATALOG);
        Node time = editor.addNode("input_time", Position.ORIGIN);
        Node sin = editor.addNode("math_sin", Position.ORIGIN);
        ScenarioGraphs.link(editor, time, "Time", sin, "Value");
        assertEquals(generator.generateDefault().text(), compile(editor.graph()));
    }

    @Test
    public void testLoneSinkUsesItsDefaults() {
        GraphEditor editor = new GraphEditor(ScenarioGraphs.CATALOG);
        editor.addNode("output_color", Position.ORIGIN);
        String text = compile(editor.graph());
        assertTrue(text.contains("  let finalColor = vec4f(vec3f(0.0, 0.0, 0.0), 1.0);"));
    }

    @Test
    public void testColorPickerEmitsFixedPrecisionLiteral() {
        GraphEditor editor = new GraphEditor(ScenarioGraphs.CATALOG);
        Node picker = editor.addNode("input_color", Position.ORIGIN);
        Node output = editor.addNode("output_color", Position.ORIGIN);
        ScenarioGraphs.link(editor, picker, "Color", output, "Color");

        assertTrue(compile(editor.graph()).contains("  let v1: vec3f = vec3f(1.0000, 1.0000, 1.0000);"));

        editor.updateValue(picker.id(), "_color", NodeValue.vector(0.2, 0.4, 0.6));
        String text = compile(editor.graph());
        assertTrue(text.contains("  let v1: vec3f = vec3f(0.2000, 0.4000, 0.6000);"));
        assertFalse(text.contains("fn node_1"));
        assertTrue(text.contains("  let finalColor = vec4f(v1, 1.0);"));
    }

    @Test
    public void testLegacyTwoComponentDefaultsArePadded() {
        GraphEditor editor = new GraphEditor(ScenarioGraphs.CATALOG);
        Node hsv = editor.addNode("color_hsv", Position.ORIGIN);
        Node circle = editor.addNode("pattern_circle", Position.ORIGIN);
        Node output = editor.addNode("output_color", Position.ORIGIN);
        ScenarioGraphs.link(editor, circle, "Value", hsv, "Value");
        ScenarioGraphs.link(editor, hsv, "Color", output, "Color");

        String text = compile(editor.graph());
        assertTrue(text.contains("  let v1: f32 = node_2(vec3f(0.0, 0.0, 0.0), vec3f(0.5, 0.5, 0.0), 0.25);"));
        assertTrue(text.contains("  let v2: vec3f = node_1(0.0, 1.0, v1);"));
    }

    @Test
    public void testAlphaInputIsPassedThrough() {
        GraphEditor editor = ScenarioGraphs.uvSeparateCombine();
        Node output = editor.graph().allNodes().get(3);
        editor.updateValue(output.id(), "Alpha", NodeValue.scalar(0.5));
        assertTrue(compile(editor.graph()).contains("  let finalColor = vec4f(v4, 0.5);"));
    }

    @Test
    public void testMangledNamesStripPrefixAndEscape() {
        assertEquals("12", AbstractCodeEmitter.mangle("node_12"));
        assertEquals("a__b", AbstractCodeEmitter.mangle("node_a_b"));
        assertEquals("a_x2D_b_x2E_c", AbstractCodeEmitter.mangle("node_a-b.c"));
        assertEquals("_n12", AbstractCodeEmitter.mangle("12"));
        assertEquals("node_x_value", AbstractCodeEmitter.functionName("node_x", "Value"));
    }

    @Test
    public void testMangledNamesAreDistinctForDistinctIds() {
        List<String> ids = List.of("node_a-1", "node_a.1", "node_a_1", "node_a1", "a1", "node_a__1");
        assertEquals(ids.size(), ids.stream().map(AbstractCodeEmitter::mangle).distinct().count());
    }

    @Test
    public void testIdsDifferingOnlyInPunctuationGetOwnFunctions() {
        NodeGraph graph = new GraphSerializer().fromJson("""
                {"nodes": [
                  {"id": "node_a-1", "definitionId": "input_time",
                   "outputs": [{"id": "s1", "name": "Time", "type": "float"}]},
                  {"id": "node_a.1", "definitionId": "math_sin",
                   "inputs": [{"id": "s2", "name": "Value", "type": "float"}],
                   "outputs": [{"id": "s3", "name": "Result", "type": "float"}]},
                  {"id": "node_out", "definitionId": "output_color",
                   "inputs": [{"id": "s4", "name": "Color", "type": "color"},
                              {"id": "s5", "name": "Alpha", "type": "float"}]}],
                 "connections": [
                  {"id": "c1", "fromNodeId": "node_a-1", "fromSocketId": "s1",
                   "toNodeId": "node_a.1", "toSocketId": "s2"},
                  {"id": "c2", "fromNodeId": "node_a.1", "fromSocketId": "s3",
                   "toNodeId": "node_out", "toSocketId": "s5"}]}
                """);

        String text = compile(graph);
        assertEquals(1, count(text, "fn node_a_x2D_1("));
        assertEquals(1, count(text, "fn node_a_x2E_1("));
        assertTrue(text.contains("  let v1: f32 = node_a_x2D_1();"));
        assertTrue(text.contains("  let v2: f32 = node_a_x2E_1(v1);"));
    }
}
