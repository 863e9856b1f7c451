package com.jsunparser.ast;

public record Assign(
    String op,  // "=", "+=", ...
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "Assign";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
