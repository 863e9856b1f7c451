package com.jsunparser.ast;

public record Debugger() implements Statement {

    @Override
    public String type() {
        return "Debugger";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDebugger(this);
    }
}
