package com.jsunparser.ast;

public record RegexLiteral(
    String value  // /pattern/flags
) implements Expression {

    @Override
    public String type() {
        return "Regex";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRegex(this);
    }
}
