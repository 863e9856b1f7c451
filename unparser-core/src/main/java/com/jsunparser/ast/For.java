package com.jsunparser.ast;

public record For(
    Node init,  // VarStatement | Expression | null
    Expression cond,  // Can be null
    Expression count,  // Can be null
    Statement statement
) implements Statement {

    @Override
    public String type() {
        return "For";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
