package com.jsunparser.ast;

public record If(
    Expression predicate,  // Can be null
    Statement consequent,
    Statement alternative  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "If";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
