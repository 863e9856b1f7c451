package com.jsunparser.ast;

import java.util.List;

public record ArrayLiteral(
    List<Expression> items  // null entries are holes
) implements Expression {

    @Override
    public String type() {
        return "Array";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
