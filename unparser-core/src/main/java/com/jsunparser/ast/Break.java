package com.jsunparser.ast;

public record Break(
    Identifier identifier  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Break";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
