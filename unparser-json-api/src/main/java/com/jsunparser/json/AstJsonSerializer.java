package com.jsunparser.json;

import com.jsunparser.ast.Node;

/**
 * Writes a node and everything below it as JSON. Each object carries the
 * node's kind in a {@code "type"} member and absent children are left out.
 */
public interface AstJsonSerializer {

    String serialize(Node node) throws AstJsonException;

    /**
     * Same content as {@link #serialize(Node)}, laid out over several lines.
     */
    String serializePretty(Node node) throws AstJsonException;
}
