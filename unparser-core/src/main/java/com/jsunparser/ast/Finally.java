package com.jsunparser.ast;

public record Finally(
    Block elements
) implements Node {

    @Override
    public String type() {
        return "Finally";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFinally(this);
    }
}
