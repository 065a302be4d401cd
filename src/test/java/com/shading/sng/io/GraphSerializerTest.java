package com.shading.sng.io;

import static org.junit.Assert.*;

import org.junit.Test;

import com.shading.sng.ScenarioGraphs;
import com.shading.sng.api.ShaderBackend;
import com.shading.sng.codegen.ShaderCompiler;
import com.shading.sng.editor.GraphEditor;
import com.shading.sng.model.Node;
import com.shading.sng.model.NodeGraph;
import com.shading.sng.model.NodeId;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.Position;

public class GraphSerializerTest {
    private final GraphSerializer serializer = new GraphSerializer();

    @Test
    public void testRestoredGraphCompilesIdentically() {
        GraphEditor editor = ScenarioGraphs.uvSeparateCombine();
        NodeGraph restored = serializer.fromJson(serializer.toJson(editor.graph()));

        ShaderCompiler compiler = new ShaderCompiler(ScenarioGraphs.CATALOG);
        for (ShaderBackend backend : ShaderBackend.values())
            assertEquals(compiler.compile(editor.graph(), backend), compiler.compile(restored, backend));
        assertEquals(editor.graph().allConnections(), restored.allConnections());
    }

    @Test
    public void testValuesAndPositionsSurvive() {
        GraphEditor editor = new GraphEditor(ScenarioGraphs.CATALOG);
        Node circle = editor.addNode("pattern_circle", new Position(12.5, -3));
        editor.updateValue(circle.id(), "Radius", NodeValue.scalar(0.125));

        Node restored = serializer.fromJson(serializer.toJson(editor.graph())).getNode(new NodeId("node_1")).get();
        assertEquals(new Position(12.5, -3), restored.position());
        assertEquals(NodeValue.scalar(0.125), restored.value("Radius").get());
        assertEquals(NodeValue.vector(0.5, 0.5), restored.value("Center").get());
        assertEquals(NodeValue.vector(0.5, 0.5), restored.input("Center").get().defaultValue());
        assertEquals(circle.input("UV").get().id(), restored.input("UV").get().id());
    }

    @Test
    public void testReadsHandWrittenDocument() {
        NodeGraph graph = serializer.fromJson("""
                {"nodes": [
                  {"id": "n1", "definitionId": "input_time",
                   "outputs": [{"id": "s1", "name": "Time", "type": "f32"}]},
                  {"id": "n2", "definitionId": "math_sin", "position": {"x": 1, "y": 2},
                   "inputs": [{"id": "s2", "name": "Value", "type": "float"}],
                   "outputs": [{"id": "s3", "name": "Result", "type": "float"}],
                   "values": {"Value": 3}}],
                 "connections": [{"id": "c1", "fromNodeId": "n1", "fromSocketId": "s1",
                                  "toNodeId": "n2", "toSocketId": "s2"}]}
                """);
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.connectionCount());
        assertEquals(NodeValue.scalar(3), graph.getNode(new NodeId("n2")).get().value("Value").get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNewerVersionRejected() {
        serializer.fromJson("{\"version\": 99}");
    }

    @Test(expected = java.io.UncheckedIOException.class)
    public void testMalformedJsonRejected() {
        serializer.fromJson("{nodes:");
    }
}
