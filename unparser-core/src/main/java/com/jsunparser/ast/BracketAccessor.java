package com.jsunparser.ast;

public record BracketAccessor(
    Expression node,
    Expression expr
) implements Expression {

    @Override
    public String type() {
        return "BracketAccessor";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBracketAccessor(this);
    }
}
