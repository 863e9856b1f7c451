package com.jsunparser.ast;

public record DotAccessor(
    Expression node,
    Identifier identifier
) implements Expression {

    @Override
    public String type() {
        return "DotAccessor";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDotAccessor(this);
    }
}
