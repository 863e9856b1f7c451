package com.jsunparser.ast;

import java.util.List;

public record FunctionCall(
    Expression identifier,
    List<Expression> args
) implements Expression {

    @Override
    public String type() {
        return "FunctionCall";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
