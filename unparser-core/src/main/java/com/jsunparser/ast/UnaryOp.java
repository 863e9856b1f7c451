package com.jsunparser.ast;

public record UnaryOp(
    String op,
    Expression value,
    boolean postfix  // true for x++, false for ++x
) implements Expression {

    @Override
    public String type() {
        return "UnaryOp";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
