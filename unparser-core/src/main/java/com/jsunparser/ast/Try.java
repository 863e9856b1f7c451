package com.jsunparser.ast;

public record Try(
    Block statements,
    Catch catchClause,  // Can be null
    Finally fin  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Try";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTry(this);
    }
}
