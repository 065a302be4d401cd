package com.shading.sng;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.shading.sng.api.ShaderBackend;
import com.shading.sng.api.ShaderSource;
import com.shading.sng.catalog.DefinitionRegistry;
import com.shading.sng.codegen.ShaderCompiler;
import com.shading.sng.editor.GraphEditor;
import com.shading.sng.editor.LiveShaderCompiler;
import com.shading.sng.io.GraphSerializer;
import com.shading.sng.model.Node;
import com.shading.sng.model.Position;
import com.shading.sng.util.GraphExplain;

/**
 * Builds UV -> separate -> combine -> output and logs the documents of both backends.
 */
public class ShaderGraphDemo {
    private static final Logger log = LogManager.getLogger(ShaderGraphDemo.class);

    public static void main(String[] args) {
        log.info("Starting shader graph demo...");

        ShaderCompiler compiler = ShaderCompiler.withDefaults();
        DefinitionRegistry catalog = (DefinitionRegistry) compiler.catalog();
        log.info("Catalog: {} definitions in {}", catalog.size(), catalog.categories());

        GraphEditor editor = new GraphEditor(catalog);
        LiveShaderCompiler live = new LiveShaderCompiler(compiler);
        editor.addListener(live);

        Node uv = editor.addNode("input_uv", new Position(0, 0));
        Node separate = editor.addNode("vec_separate2", new Position(200, 0));
        Node combine = editor.addNode("vec_combine3", new Position(400, 0));
        Node output = editor.addNode("output_color", new Position(600, 0));

        editor.connect(uv.output("UV").orElseThrow().id(), separate.input("Vector").orElseThrow().id());
        editor.connect(separate.output("X").orElseThrow().id(), combine.input("X").orElseThrow().id());
        editor.connect(separate.output("Y").orElseThrow().id(), combine.input("Y").orElseThrow().id());
        editor.connect(combine.output("Vector").orElseThrow().id(), output.input("Color").orElseThrow().id());

        GraphExplain explain = new GraphExplain(editor.graph(), catalog);
        log.info("\n{}", explain.dumpTopology());
        log.info("Function names:\n{}", explain.functionNames());

        for (ShaderBackend backend : ShaderBackend.values()) {
            ShaderSource source = live.latest(backend).orElseThrow();
            if (source instanceof ShaderSource.StageBundle bundle) {
                log.info("{} vertex stage:\n{}", backend, bundle.vertex());
                log.info("{} fragment stage:\n{}", backend, bundle.fragment());
            } else {
                log.info("{} module:\n{}", backend, source.text());
            }
        }

        log.info("Saved graph:\n{}", new GraphSerializer().toJson(editor.graph()));
        log.info("Recompiled {} times. Demo finished.", live.compileCount());
    }
}
