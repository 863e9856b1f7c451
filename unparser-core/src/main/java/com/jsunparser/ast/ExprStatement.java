package com.jsunparser.ast;

public record ExprStatement(
    Expression expr
) implements Statement {

    @Override
    public String type() {
        return "ExprStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExprStatement(this);
    }
}
