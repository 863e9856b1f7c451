package com.jsunparser.render;

import com.jsunparser.ast.Node;
import com.jsunparser.ast.Program;

/**
 * Entry point for turning syntax trees back into source text.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * String source = Unparser.standard().renderProgram(program);
 * String minified = Unparser.compact().renderProgram(program);
 * }</pre>
 *
 * <p>An {@code Unparser} is immutable and can be shared between threads; every
 * call renders with its own {@link Renderer}.</p>
 */
public final class Unparser {

    private final RuleSet rules;
    private final RenderOptions options;

    public Unparser(RuleSet rules, RenderOptions options) {
        if (rules == null || options == null) {
            throw new IllegalArgumentException("rules and options must not be null");
        }
        this.rules = rules;
        this.options = options;
    }

    public static Unparser standard() {
        return new Unparser(Rules.standard(), RenderOptions.defaults());
    }

    public static Unparser compact() {
        return new Unparser(Rules.compact(), RenderOptions.compact());
    }

    public Unparser withRules(RuleSet rules) {
        return new Unparser(rules, options);
    }

    public Unparser withOptions(RenderOptions options) {
        return new Unparser(rules, options);
    }

    public RuleSet rules() {
        return rules;
    }

    public RenderOptions options() {
        return options;
    }

    public Renderer newRenderer() {
        return new Renderer(rules, options);
    }

    /**
     * Renders any node, statement-level or not.
     *
     * @throws RenderException if the tree is malformed
     */
    public String render(Node node) {
        return newRenderer().render(node);
    }

    public String renderProgram(Program program) {
        return render(program);
    }
}
