package com.jsunparser.ast;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>The hierarchy is closed: every kind is a record listed here or under
 * {@link Statement} and {@link Expression}, and every kind has a matching
 * method on {@link NodeVisitor}.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    VarDecl,
    Case,
    Default,
    Catch,
    Finally,
    PropAssign {

    /**
     * Returns the kind name of this node, e.g. {@code "If"}.
     */
    String type();

    <R> R accept(NodeVisitor<R> visitor);
}
