package com.jsunparser.ast;

public record Comma(
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "Comma";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComma(this);
    }
}
