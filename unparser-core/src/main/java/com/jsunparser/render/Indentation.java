package com.jsunparser.render;

/**
 * Current indentation of a render, in characters.
 *
 * <p>Levels are only raised through {@link #deeper()}, whose scope puts the
 * previous level back when closed:</p>
 * <pre>{@code
 * try (Indentation.Scope scope = indentation.deeper()) {
 *     body = renderer.statements(block, children);
 * }
 * }</pre>
 */
public final class Indentation {

    private final int step;
    private int level;

    public Indentation(int step) {
        if (step < 0) {
            throw new IllegalArgumentException("step must not be negative: " + step);
        }
        this.step = step;
    }

    public int level() {
        return level;
    }

    public int step() {
        return step;
    }

    /**
     * Returns the prefix for a line at the current level.
     */
    public String prefix() {
        return " ".repeat(level);
    }

    /**
     * Raises the level by one step until the returned scope is closed.
     */
    public Scope deeper() {
        int previous = level;
        level += step;
        return () -> level = previous;
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
