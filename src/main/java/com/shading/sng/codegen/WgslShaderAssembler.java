package com.shading.sng.codegen;

import java.util.List;

import com.shading.sng.api.ShaderSource;

/**
 * Single-module WGSL document: uniforms, full-screen quad vertex stage, node functions and the
 * fragment entry point.
 * <p>
 * The fragment entry point copies its interpolated UV into the module-scope {@code fragUv} before
 * anything else runs, so node functions can read it without it being threaded through every call.
 */
public final class WgslShaderAssembler implements ShaderAssembler {

    static final String UNIFORMS = """
            struct Uniforms {
              time: f32,
              resolution: vec2f,
              mouse: vec2f,
            }

            @group(0) @binding(0) var<uniform> uniforms: Uniforms;
            """;

    static final String VERTEX_STAGE = """
            struct VertexOutput {
              @builtin(position) position: vec4f,
              @location(0) uv: vec2f,
            }

            @vertex
            fn vertexMain(@builtin(vertex_index) vertexIndex: u32) -> VertexOutput {
              var pos = array<vec2f, 6>(
                vec2f(-1.0, -1.0),
                vec2f( 1.0, -1.0),
                vec2f(-1.0,  1.0),
                vec2f(-1.0,  1.0),
                vec2f( 1.0, -1.0),
                vec2f( 1.0,  1.0)
              );

              var output: VertexOutput;
              output.position = vec4f(pos[vertexIndex], 0.0, 1.0);
              output.uv = pos[vertexIndex] * 0.5 + 0.5;
              return output;
            }
            """;

    static final String DEFAULT_DOCUMENT = "// Default WGSL Shader\n" + UNIFORMS + "\n" + VERTEX_STAGE + """

            @fragment
            fn fragmentMain(input: VertexOutput) -> @location(0) vec4f {
              return vec4f(input.uv, 0.5 + 0.5 * sin(uniforms.time), 1.0);
            }
            """;

    @Override
    public ShaderSource assemble(List<String> functions, List<String> body, String finalExpression) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("// Generated WGSL Shader\n")
                .append(UNIFORMS).append('\n')
                .append("var<private> fragUv: vec2f;\n\n")
                .append(VERTEX_STAGE).append('\n')
                .append("// Node functions\n");
        if (!functions.isEmpty())
            sb.append(String.join("\n\n", functions)).append('\n');
        sb.append('\n')
                .append("@fragment\n")
                .append("fn fragmentMain(input: VertexOutput) -> @location(0) vec4f {\n")
                .append("  fragUv = input.uv;\n\n");
        for (String line : body)
            sb.append(line).append('\n');
        sb.append('\n')
                .append("  return ").append(finalExpression).append(";\n")
                .append("}\n");
        return new ShaderSource.SingleModule(sb.toString());
    }

    @Override
    public ShaderSource defaultDocument() {
        return new ShaderSource.SingleModule(DEFAULT_DOCUMENT);
    }
}
