package com.jsunparser.ast;

public record ForIn(
    Node item,  // VarDecl or Expression
    Expression iterable,
    Statement statement
) implements Statement {

    @Override
    public String type() {
        return "ForIn";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForIn(this);
    }
}
