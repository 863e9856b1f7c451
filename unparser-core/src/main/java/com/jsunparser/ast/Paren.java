package com.jsunparser.ast;

public record Paren(
    Expression expr
) implements Expression {

    @Override
    public String type() {
        return "Paren";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParen(this);
    }
}
