package com.jsunparser.ast;

public record Identifier(
    String value
) implements Expression {

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
