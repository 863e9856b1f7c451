package com.jsunparser.ast;

public record Throw(
    Expression expr
) implements Statement {

    @Override
    public String type() {
        return "Throw";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }
}
