package com.jsunparser.ast;

import java.util.List;

public record Program(
    List<Statement> children
) implements Node {

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
