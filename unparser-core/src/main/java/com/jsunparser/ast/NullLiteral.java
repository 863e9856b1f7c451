package com.jsunparser.ast;

public record NullLiteral() implements Expression {

    @Override
    public String type() {
        return "Null";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNull(this);
    }
}
