package com.jsunparser.ast;

/**
 * A construct that has no kind of its own in this tree model.
 *
 * <p>Produced when a tree arrives with a kind name the model does not know,
 * e.g. from a newer parser. It keeps the kind name and the raw representation
 * it was read from so it can still be reported or written back.</p>
 */
public record UnknownNode(
    String type,
    String raw
) implements Statement, Expression {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnknown(this);
    }
}
