package com.jsunparser.ast;

public record Catch(
    Identifier identifier,
    Block elements
) implements Node {

    @Override
    public String type() {
        return "Catch";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCatch(this);
    }
}
