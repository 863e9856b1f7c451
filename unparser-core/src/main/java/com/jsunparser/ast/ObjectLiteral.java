package com.jsunparser.ast;

import java.util.List;

public record ObjectLiteral(
    List<PropAssign> properties
) implements Expression {

    @Override
    public String type() {
        return "Object";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }
}
