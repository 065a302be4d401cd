package com.shading.sng.codegen;

import java.util.List;

import com.shading.sng.api.ShaderSource;

/**
 * GLSL ES 3.00 vertex/fragment pair for WebGL2.
 */
public final class GlslShaderAssembler implements ShaderAssembler {

    static final String VERTEX_STAGE = """
            #version 300 es
            precision highp float;

            out vec2 vUv;

            void main() {
              vec2 positions[6] = vec2[](
                vec2(-1.0, -1.0),
                vec2( 1.0, -1.0),
                vec2(-1.0,  1.0),
                vec2(-1.0,  1.0),
                vec2( 1.0, -1.0),
                vec2( 1.0,  1.0)
              );

              vec2 pos = positions[gl_VertexID];
              gl_Position = vec4(pos, 0.0, 1.0);
              vUv = pos * 0.5 + 0.5;
            }
            """;

    static final String FRAGMENT_PREAMBLE = """
            #version 300 es
            precision highp float;

            uniform float u_time;
            uniform vec2 u_resolution;
            uniform vec2 u_mouse;

            in vec2 vUv;
            out vec4 fragColor;
            """;

    static final String DEFAULT_FRAGMENT = FRAGMENT_PREAMBLE + """

            void main() {
              fragColor = vec4(vUv, 0.5 + 0.5 * sin(u_time), 1.0);
            }
            """;

    @Override
    public ShaderSource assemble(List<String> functions, List<String> body, String finalExpression) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append(FRAGMENT_PREAMBLE).append('\n')
                .append("// Node functions\n");
        if (!functions.isEmpty())
            sb.append(String.join("\n\n", functions)).append('\n');
        sb.append('\n')
                .append("void main() {\n");
        for (String line : body)
            sb.append(line).append('\n');
        sb.append('\n')
                .append("  fragColor = ").append(finalExpression).append(";\n")
                .append("}\n");
        return new ShaderSource.StageBundle(VERTEX_STAGE, sb.toString());
    }

    @Override
    public ShaderSource defaultDocument() {
        return new ShaderSource.StageBundle(VERTEX_STAGE, DEFAULT_FRAGMENT);
    }
}
