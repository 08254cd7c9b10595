package com.repo.cccp.metrics;

/**
 * A statement kind the control-tree builder cannot score. The whole unit has to
 * be skipped; there is no partial result.
 */
public class UnsupportedConstructException extends RuntimeException {

    private final String kind;
    private final int line;

    public UnsupportedConstructException(String kind, int line) {
        super("Unsupported construct " + kind + " at line " + line);
        this.kind = kind;
        this.line = line;
    }

    public String getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }
}
