package com.jsunparser.ast;

public record While(
    Expression predicate,
    Statement statement
) implements Statement {

    @Override
    public String type() {
        return "While";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
