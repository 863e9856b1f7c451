package com.jsunparser.render;

import com.jsunparser.ast.Node;
import com.jsunparser.ast.NodeKinds;
import com.jsunparser.ast.UnknownNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable table holding one formatting rule per node kind.
 *
 * <p>Alternate styles are made by replacing single entries:</p>
 * <pre>{@code
 * RuleSet loud = Rules.standard().toBuilder()
 *     .rule(Identifier.class, (node, r) -> node.value().toUpperCase())
 *     .build();
 * }</pre>
 */
public final class RuleSet {

    private final Map<Class<? extends Node>, Rule<?>> rules;

    private RuleSet(Map<Class<? extends Node>, Rule<?>> rules) {
        this.rules = Map.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder(new HashMap<>());
    }

    public Builder toBuilder() {
        return new Builder(new HashMap<>(rules));
    }

    /**
     * Returns the rule registered for a kind.
     *
     * @throws IllegalArgumentException if the kind has no rule, which a built
     *                                  set never allows
     */
    @SuppressWarnings("unchecked")
    public <N extends Node> Rule<N> rule(Class<N> kind) {
        Rule<N> rule = (Rule<N>) rules.get(kind);
        if (rule == null) {
            throw new IllegalArgumentException("No rule registered for " + kind.getSimpleName());
        }
        return rule;
    }

    /**
     * Returns a copy of this set with one rule replaced.
     */
    public <N extends Node> RuleSet with(Class<N> kind, Rule<? super N> rule) {
        return toBuilder().rule(kind, rule).build();
    }

    public static final class Builder {
        private final Map<Class<? extends Node>, Rule<?>> rules;

        private Builder(Map<Class<? extends Node>, Rule<?>> rules) {
            this.rules = rules;
        }

        public <N extends Node> Builder rule(Class<N> kind, Rule<? super N> rule) {
            if (kind == null || rule == null) {
                throw new IllegalArgumentException("kind and rule must not be null");
            }
            rules.put(kind, rule);
            return this;
        }

        /**
         * Builds the set.
         *
         * @throws IllegalStateException if any kind, including {@link UnknownNode}, has no rule
         */
        public RuleSet build() {
            List<String> missing = new ArrayList<>();
            for (Class<? extends Node> kind : NodeKinds.all()) {
                if (!rules.containsKey(kind)) {
                    missing.add(kind.getSimpleName());
                }
            }
            if (!rules.containsKey(UnknownNode.class)) {
                missing.add(UnknownNode.class.getSimpleName());
            }
            if (!missing.isEmpty()) {
                missing.sort(null);
                throw new IllegalStateException("No rule registered for " + String.join(", ", missing));
            }
            return new RuleSet(rules);
        }
    }
}
