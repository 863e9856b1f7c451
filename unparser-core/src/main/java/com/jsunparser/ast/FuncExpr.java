package com.jsunparser.ast;

import java.util.List;

public record FuncExpr(
    Identifier identifier,  // Can be null
    List<Identifier> parameters,
    List<Statement> elements
) implements Expression {

    @Override
    public String type() {
        return "FuncExpr";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFuncExpr(this);
    }
}
