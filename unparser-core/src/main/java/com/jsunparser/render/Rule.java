package com.jsunparser.render;

import com.jsunparser.ast.Node;

/**
 * Formatting rule for one node kind.
 *
 * <p>A rule may recurse into children through {@link Renderer#render(Node)}
 * and may raise the indentation through {@link Renderer#indentation()}, but
 * has to leave the level as it found it.</p>
 *
 * @param <N> the node kind this rule formats
 */
@FunctionalInterface
public interface Rule<N extends Node> {

    String apply(N node, Renderer renderer);
}
