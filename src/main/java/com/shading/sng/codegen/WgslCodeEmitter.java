package com.shading.sng.codegen;

import com.shading.sng.api.ShaderBackend;

/**
 * WGSL bindings: {@code let v1: f32 = node_3(v2);}
 */
public final class WgslCodeEmitter extends AbstractCodeEmitter {

    public WgslCodeEmitter(String colorValueKey) {
        super(Dialect.WGSL, colorValueKey);
    }

    @Override
    public ShaderBackend backend() {
        return ShaderBackend.WGSL;
    }

    @Override
    protected String binding(String variable, String typeName, String expression) {
        return "  let " + variable + ": " + typeName + " = " + expression + ";";
    }

    @Override
    protected String finalColorBinding(String expression) {
        return "  let " + FINAL_COLOR + " = " + expression + ";";
    }
}
