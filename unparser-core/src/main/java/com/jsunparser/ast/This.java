package com.jsunparser.ast;

public record This() implements Expression {

    @Override
    public String type() {
        return "This";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThis(this);
    }
}
