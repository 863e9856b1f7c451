package com.jsunparser.ast;

import java.util.List;

public record Block(
    List<Statement> children
) implements Statement {

    @Override
    public String type() {
        return "Block";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
