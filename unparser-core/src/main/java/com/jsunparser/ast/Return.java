package com.jsunparser.ast;

public record Return(
    Expression expr  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Return";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
