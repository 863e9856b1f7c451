package com.jsunparser.render;

/**
 * Layout settings for one renderer.
 *
 * @param indentStep    characters added per nesting level
 * @param lineSeparator text placed between the lines of a statement list
 */
public record RenderOptions(int indentStep, String lineSeparator) {

    public static final int DEFAULT_INDENT_STEP = 2;
    public static final String DEFAULT_LINE_SEPARATOR = "\n";

    public RenderOptions {
        if (indentStep < 0) {
            throw new IllegalArgumentException("indentStep must not be negative: " + indentStep);
        }
        if (lineSeparator == null) {
            throw new IllegalArgumentException("lineSeparator must not be null");
        }
    }

    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_INDENT_STEP, DEFAULT_LINE_SEPARATOR);
    }

    /**
     * Single-line layout: no indentation and no line breaks.
     */
    public static RenderOptions compact() {
        return new RenderOptions(0, "");
    }

    public RenderOptions withIndentStep(int step) {
        return new RenderOptions(step, lineSeparator);
    }

    public RenderOptions withLineSeparator(String separator) {
        return new RenderOptions(indentStep, separator);
    }
}
