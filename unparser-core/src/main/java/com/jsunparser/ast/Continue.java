package com.jsunparser.ast;

public record Continue(
    Identifier identifier  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Continue";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
