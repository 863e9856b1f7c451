package com.jsunparser.ast;

public record PropAssign(
    Expression left,  // Identifier, String or Number key
    Expression right
) implements Node {

    @Override
    public String type() {
        return "PropAssign";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPropAssign(this);
    }
}
