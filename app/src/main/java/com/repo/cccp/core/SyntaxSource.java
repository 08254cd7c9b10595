package com.repo.cccp.core;

import com.repo.cccp.syntax.Stmt;

import java.nio.file.Path;
import java.util.Set;

/**
 * Plugin interface for components that turn a source file into a syntax tree.
 * Each implementation handles one or more file types.
 */
public interface SyntaxSource {

    /**
     * Unique identifier for this source (e.g., "python", "json-ast").
     */
    String getSourceId();

    /**
     * File name suffixes this source handles (e.g., ".py", ".ast.json").
     * Suffixes should include the leading dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * Check if this source is usable at runtime.
     * For example, the Python source checks that the interpreter can be started.
     *
     * @return true if all required dependencies are available
     */
    boolean isAvailable();

    /**
     * Parse a single source file.
     *
     * @param sourceFile path to the source file
     * @param config     analyzer configuration
     * @return the module root of the file
     * @throws SyntaxSourceException if the file cannot be read or parsed
     */
    Stmt.Module parse(Path sourceFile, AnalyzerConfig config) throws SyntaxSourceException;

    /**
     * Priority for this source when several support the same suffix.
     * Lower values = higher priority. Default is 100.
     */
    default int getPriority() {
        return 100;
    }
}
