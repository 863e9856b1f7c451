package com.jsunparser.ast;

import java.util.List;

public record NewExpr(
    Expression identifier,
    List<Expression> args  // null when written without parentheses
) implements Expression {

    @Override
    public String type() {
        return "NewExpr";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNewExpr(this);
    }
}
