package com.jsunparser.ast;

public record Conditional(
    Expression predicate,
    Expression consequent,
    Expression alternative
) implements Expression {

    @Override
    public String type() {
        return "Conditional";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
