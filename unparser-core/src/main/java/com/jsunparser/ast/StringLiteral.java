package com.jsunparser.ast;

public record StringLiteral(
    String value  // quotes included
) implements Expression {

    @Override
    public String type() {
        return "String";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
