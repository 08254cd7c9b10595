package com.repo.cccp.core;

import java.nio.file.Path;

/**
 * A source file could not be turned into a syntax tree.
 */
public class SyntaxSourceException extends Exception {

    private final Path sourceFile;

    public SyntaxSourceException(Path sourceFile, String message) {
        super(message);
        this.sourceFile = sourceFile;
    }

    public SyntaxSourceException(Path sourceFile, String message, Throwable cause) {
        super(message, cause);
        this.sourceFile = sourceFile;
    }

    public Path getSourceFile() {
        return sourceFile;
    }
}
