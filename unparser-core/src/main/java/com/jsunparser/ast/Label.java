package com.jsunparser.ast;

public record Label(
    Identifier identifier,
    Statement statement
) implements Statement {

    @Override
    public String type() {
        return "Label";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLabel(this);
    }
}
