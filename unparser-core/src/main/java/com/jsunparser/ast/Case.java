package com.jsunparser.ast;

import java.util.List;

public record Case(
    Expression expr,
    List<Statement> elements
) implements Node {

    @Override
    public String type() {
        return "Case";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCase(this);
    }
}
