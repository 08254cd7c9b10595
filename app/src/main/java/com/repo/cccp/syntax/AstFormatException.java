package com.repo.cccp.syntax;

/**
 * Thrown when a JSON AST document does not have the expected shape.
 */
public class AstFormatException extends RuntimeException {

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
