package com.jsunparser.ast;

public record BinOp(
    String op,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "BinOp";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinOp(this);
    }
}
