package com.jsunparser.render;

import com.jsunparser.ast.Node;

/**
 * Thrown when a node cannot be rendered because it does not have the shape its
 * kind requires, e.g. a {@code While} without a predicate.
 */
public class RenderException extends RuntimeException {

    private final String nodeType;

    public RenderException(String nodeType, String message) {
        super(message);
        this.nodeType = nodeType;
    }

    public static RenderException missing(Node node, String field) {
        return new RenderException(node.type(), "Malformed " + node.type() + ": missing " + field);
    }

    public static RenderException malformed(Node node, String problem) {
        return new RenderException(node.type(), "Malformed " + node.type() + ": " + problem);
    }

    /**
     * Returns the kind of the offending node.
     */
    public String nodeType() {
        return nodeType;
    }
}
