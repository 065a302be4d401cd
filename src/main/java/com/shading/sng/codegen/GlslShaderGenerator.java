package com.shading.sng.codegen;

import com.shading.sng.api.CompilationListener;
import com.shading.sng.catalog.NodeCatalog;
import com.shading.sng.io.CompilerConfig;

/**
 * Compiles graphs into a GLSL ES 3.00 vertex/fragment pair for WebGL2.
 */
public final class GlslShaderGenerator extends AbstractShaderGenerator {

    public GlslShaderGenerator(NodeCatalog catalog) {
        this(catalog, CompilerConfig.defaults(), null);
    }

    public GlslShaderGenerator(NodeCatalog catalog, CompilerConfig config, CompilationListener listener) {
        super(catalog, config, new GlslCodeEmitter(WgslShaderGenerator.colorKey(config)), new GlslShaderAssembler(),
                listener);
    }
}
