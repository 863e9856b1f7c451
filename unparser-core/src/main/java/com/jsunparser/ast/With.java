package com.jsunparser.ast;

public record With(
    Expression expr,
    Statement statement
) implements Statement {

    @Override
    public String type() {
        return "With";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWith(this);
    }
}
