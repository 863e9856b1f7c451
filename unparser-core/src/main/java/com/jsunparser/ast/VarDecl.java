package com.jsunparser.ast;

public record VarDecl(
    Identifier identifier,
    Expression initializer  // Can be null
) implements Node {

    @Override
    public String type() {
        return "VarDecl";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }
}
