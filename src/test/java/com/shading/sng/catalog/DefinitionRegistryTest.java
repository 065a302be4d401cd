package com.shading.sng.catalog;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.shading.sng.api.ShaderBackend;
import com.shading.sng.model.NodeValue;
import com.shading.sng.model.SocketType;

public class DefinitionRegistryTest {

    private static final String ADD = """
            [{"id": "my_add", "name": "My Add", "category": "custom",
              "inputs": [{"name": "A", "type": "float", "default": 2}],
              "outputs": [{"name": "Result", "type": "float"}],
              "code": {"wgsl": "fn node_{{id}}(a: f32) -> f32 { return a; }",
                       "glsl": "float node_{{id}}(float a) { return a; }"}}]
            """;

    @Test
    public void testBuiltInCatalogLoads() {
        DefinitionRegistry registry = DefinitionRegistry.builtIn();
        assertEquals(List.of("input", "math", "vector", "color", "pattern", "output"), registry.categories());
        assertTrue(registry.getDefinition("output_color").isPresent());
        assertTrue(registry.getDefinition("vec_separate2").isPresent());
        assertTrue(registry.getDefinition("input_color").get().isColorPicker());
    }

    @Test
    public void testEveryBuiltInTemplateHasBothBackends() {
        for (NodeDefinition def : DefinitionRegistry.builtIn().allDefinitions()) {
            if (def.isColorPicker() || "output_color".equals(def.getId()))
                continue;
            for (ShaderBackend backend : ShaderBackend.values())
                assertTrue(def.getId() + " lacks " + backend, def.template(backend).isPresent());
        }
    }

    @Test
    public void testLoadJsonParsesSocketsAndDefaults() {
        DefinitionRegistry registry = new DefinitionRegistry().loadJson(ADD);
        NodeDefinition def = registry.getDefinition("my_add").get();
        assertEquals(SocketType.FLOAT, def.getInputs().get(0).getType());
        assertEquals(NodeValue.scalar(2), def.getInputs().get(0).defaultNodeValue());
        assertEquals("fn node_7(a: f32) -> f32 { return a; }",
                def.template(ShaderBackend.WGSL).get().instantiate("7"));
        assertEquals(List.of(def), registry.definitionsByCategory("custom"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateIdRejected() {
        new DefinitionRegistry().loadJson(ADD).loadJson(ADD);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTemplateWithoutPlaceholderRejected() {
        new DefinitionRegistry().loadJson("""
                [{"id": "bad", "outputs": [{"name": "R", "type": "float"}],
                  "code": {"wgsl": "fn broken() -> f32 { return 1.0; }"}}]
                """);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSamplerInputRejected() {
        new DefinitionRegistry().loadJson("""
                [{"id": "tex_sample", "inputs": [{"name": "Tex", "type": "sampler"}],
                  "outputs": [{"name": "Color", "type": "color"}],
                  "code": {"wgsl": "fn node_{{id}}() -> vec3f { return vec3f(0.0); }"}}]
                """);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTextureOutputRejected() {
        new DefinitionRegistry().loadJson("""
                [{"id": "tex_source", "outputs": [{"name": "Tex", "type": "texture2d"}]}]
                """);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResourceRejected() {
        new DefinitionRegistry().loadResource("nodes/does_not_exist.json");
    }

    @Test
    public void testSearchIsCaseInsensitive() {
        DefinitionRegistry registry = DefinitionRegistry.builtIn();
        List<String> ids = registry.search("NOISE").stream().map(NodeDefinition::getId).toList();
        assertEquals(List.of("pattern_noise"), ids);
        assertTrue(registry.search("zzzz").isEmpty());
    }

    @Test
    public void testPlaceholderReplacedEverywhere() {
        CodeTemplate t = new CodeTemplate("fn node_{{id}}_x() {}\nfn node_{{id}}_y() {}");
        assertEquals("fn node_a_x() {}\nfn node_a_y() {}", t.instantiate("a"));
    }
}
