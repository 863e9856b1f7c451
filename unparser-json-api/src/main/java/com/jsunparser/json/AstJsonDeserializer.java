package com.jsunparser.json;

import com.jsunparser.ast.Node;
import com.jsunparser.ast.Program;

/**
 * Reads trees produced by an external parser.
 *
 * <p>Every node is an object whose {@code "type"} member names its kind. Nodes
 * of a kind the tree model does not know come back as
 * {@link com.jsunparser.ast.UnknownNode} wherever a statement or expression is
 * allowed.</p>
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole tree; the root object must be a {@code Program}.
     *
     * @throws AstJsonException if the text is not JSON, the root is not a
     *         program, or a node appears where its kind is not allowed
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a single node of the given class, or any of its kinds when
     * {@code type} is {@code Statement}, {@code Expression} or {@code Node}.
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
