package com.jsunparser.ast;

public record DoWhile(
    Statement statement,
    Expression predicate
) implements Statement {

    @Override
    public String type() {
        return "DoWhile";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDoWhile(this);
    }
}
