package com.jsunparser.ast;

public record BooleanLiteral(
    String value  // "true" | "false"
) implements Expression {

    @Override
    public String type() {
        return "Boolean";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
