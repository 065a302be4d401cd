package com.shading.sng.codegen;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.io.CompilerConfig;

/**
 * Compiles graphs into a single WGSL module for WebGPU.
 */
public final class WgslShaderGenerator extends AbstractShaderGenerator {

    public WgslShaderGenerator(NodeCatalog catalog) {
        this(catalog, CompilerConfig.defaults(), null);
    }

    public WgslShaderGenerator(NodeCatalog catalog, CompilerConfig config, CompilationListener listener) {
        super(catalog, config, new WgslCodeEmitter(colorKey(config)), new WgslShaderAssembler(), listener);
    }

    static String colorKey(CompilerConfig config) {
        return config != null ? config.getColorValueKey() : CompilerConfig.defaults().getColorValueKey();
    }
}
