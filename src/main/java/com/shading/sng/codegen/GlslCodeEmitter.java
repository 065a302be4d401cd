package com.shading.sng.codegen;

import com.shading.sng.api.ShaderBackend;

/**
 * GLSL bindings: {@code float v1 = node_3(v2);}
 */
public final class GlslCodeEmitter extends AbstractCodeEmitter {

    public GlslCodeEmitter(String colorValueKey) {
        super(Dialect.GLSL, colorValueKey);
    }

    @Override
    public ShaderBackend backend() {
        return ShaderBackend.GLSL;
    }

    @Override
    protected String binding(String variable, String typeName, String expression) {
        return "  " + typeName + " " + variable + " = " + expression + ";";
    }

    @Override
    protected String finalColorBinding(String expression) {
        return "  " + dialect.vec4() + " " + FINAL_COLOR + " = " + expression + ";";
    }
}
