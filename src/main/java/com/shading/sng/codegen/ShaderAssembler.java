package com.shading.sng.codegen;

import java.util.List;

import com.shading.sng.api.ShaderSource;

/**
 * Wraps generated functions and body statements into a complete document.
 */
public interface ShaderAssembler {

    /**
     * @param functions       function declarations, already deduplicated and ordered
     * @param body            binding statements in evaluation order, ending with the final color
     * @param finalExpression name of the value the fragment stage outputs
     */
    ShaderSource assemble(List<String> functions, List<String> body, String finalExpression);

    /** Time-varying gradient used when the graph has no sink node. */
    ShaderSource defaultDocument();
}
