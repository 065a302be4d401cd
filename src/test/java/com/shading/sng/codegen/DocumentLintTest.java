package com.shading.sng.codegen;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.shading.sng.api.ShaderSource;

public class DocumentLintTest {

    @Test
    public void testBalancedTextIsClean() {
        assertEquals(List.of(), DocumentLint.check("fn f(a: array<f32, 2>) -> f32 {\n  return a[0];\n}\n"));
    }

    @Test
    public void testUnclosedBraceReported() {
        assertEquals(List.of("unclosed '{' opened at line 1"), DocumentLint.check("fn f() {\n  return 1.0;\n"));
    }

    @Test
    public void testMismatchReportedWithLines() {
        assertEquals(List.of("'(' opened at line 1 closed by ']' at line 2"), DocumentLint.check("f(\n]"));
    }

    @Test
    public void testStrayCloserReported() {
        assertEquals(List.of("unmatched ')' at line 1"), DocumentLint.check("a)"));
    }

    @Test
    public void testCommentsIgnored() {
        assertTrue(DocumentLint.check("// (unbalanced { in a comment\nlet x = 1.0;\n").isEmpty());
    }

    @Test
    public void testLeftoverPlaceholderReported() {
        assertEquals(List.of("unsubstituted placeholder {{id}}"), DocumentLint.check("fn node_{{id}}() {}"));
    }

    @Test
    public void testBundleFindingsCarryStageName() {
        ShaderSource source = new ShaderSource.StageBundle("void main() {}", "void main() {");
        assertEquals(List.of("fragment: unclosed '{' opened at line 1"), DocumentLint.check(source));
    }
}
