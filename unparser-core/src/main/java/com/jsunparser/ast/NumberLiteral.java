package com.jsunparser.ast;

public record NumberLiteral(
    String value
) implements Expression {

    @Override
    public String type() {
        return "Number";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
