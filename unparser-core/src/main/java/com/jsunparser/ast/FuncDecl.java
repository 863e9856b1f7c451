package com.jsunparser.ast;

import java.util.List;

public record FuncDecl(
    Identifier identifier,
    List<Identifier> parameters,
    List<Statement> elements
) implements Statement {

    @Override
    public String type() {
        return "FuncDecl";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFuncDecl(this);
    }
}
