package com.jsunparser.ast;

import java.util.List;

public record Default(
    List<Statement> elements
) implements Node {

    @Override
    public String type() {
        return "Default";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDefault(this);
    }
}
