package com.jsunparser.ast;

public record EmptyStatement(
    String value  // normally ";"
) implements Statement {

    @Override
    public String type() {
        return "EmptyStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEmptyStatement(this);
    }
}
