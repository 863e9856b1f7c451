package com.jsunparser.json;

/**
 * Thrown when a tree cannot be converted to or from its JSON form.
 */
public class AstJsonException extends RuntimeException {

    // Node class being read or written, if known
    private final String target;

    public AstJsonException(String target, String message) {
        super(message);
        this.target = target;
    }

    public AstJsonException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
