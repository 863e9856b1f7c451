package com.jsunparser.ast;

import java.util.List;

public record VarStatement(
    List<VarDecl> children
) implements Statement {

    @Override
    public String type() {
        return "VarStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVarStatement(this);
    }
}
