package com.jsunparser.ast;

import java.util.List;

public record Switch(
    Expression expr,
    List<Case> cases,
    Default defaultClause  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Switch";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
