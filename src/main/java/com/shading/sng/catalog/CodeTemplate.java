package com.shading.sng.catalog;

/**
 * Shader source template authored in the node catalog.
 * <p>
 * Contains the single placeholder {@value #PLACEHOLDER}, replaced per node instance with a mangled
 * identifier so that several instances of the same definition declare distinct functions. A template
 * without the placeholder is rejected when it is built.
 */
public final class CodeTemplate {
    public static final String PLACEHOLDER = "{{id}}";

    private final String text;

    public CodeTemplate(String text) {
        if (text == null || text.isBlank())
            throw new IllegalArgumentException("Code template cannot be empty");
        if (!text.contains(PLACEHOLDER))
            throw new IllegalArgumentException("Code template is missing the " + PLACEHOLDER + " placeholder");
        this.text = text;
    }

    public String text() {
        return text;
    }

    /** Replaces every placeholder occurrence with {@code mangledId}. */
    public String instantiate(String mangledId) {
        return text.replace(PLACEHOLDER, mangledId);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CodeTemplate t && t.text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
