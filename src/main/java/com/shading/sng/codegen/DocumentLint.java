package com.shading.sng.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.shading.sng.api.ShaderSource;
import com.shading.sng.catalog.CodeTemplate;

/**
 * Advisory structural checks over a compiled document.
 * <p>
 * Reports unbalanced brackets and leftover template placeholders. It does not parse either shading
 * language; a clean report does not mean the document compiles, and a dirty one never stops the
 * document from being returned.
 */
public final class DocumentLint {

    private DocumentLint() {
    }

    public static List<String> check(ShaderSource source) {
        if (source instanceof ShaderSource.StageBundle b) {
            List<String> findings = new ArrayList<>();
            for (String f : check(b.vertex()))
                findings.add("vertex: " + f);
            for (String f : check(b.fragment()))
                findings.add("fragment: " + f);
            return findings;
        }
        return check(source.text());
    }

    public static List<String> check(String text) {
        List<String> findings = new ArrayList<>();
        if (text.contains(CodeTemplate.PLACEHOLDER))
            findings.add("unsubstituted placeholder " + CodeTemplate.PLACEHOLDER);

        Deque<int[]> open = new ArrayDeque<>();
        int line = 1;
        boolean comment = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                comment = false;
                continue;
            }
            if (comment)
                continue;
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                comment = true;
                continue;
            }
            switch (c) {
                case '(', '{', '[' -> open.push(new int[] { c, line });
                case ')', '}', ']' -> {
                    char expected = c == ')' ? '(' : c == '}' ? '{' : '[';
                    if (open.isEmpty()) {
                        findings.add("unmatched '" + c + "' at line " + line);
                    } else if (open.peek()[0] != expected) {
                        int[] top = open.pop();
                        findings.add("'" + (char) top[0] + "' opened at line " + top[1] + " closed by '" + c
                                + "' at line " + line);
                    } else {
                        open.pop();
                    }
                }
                default -> {
                }
            }
        }
        while (!open.isEmpty()) {
            int[] top = open.pop();
            findings.add("unclosed '" + (char) top[0] + "' opened at line " + top[1]);
        }
        return findings;
    }
}
