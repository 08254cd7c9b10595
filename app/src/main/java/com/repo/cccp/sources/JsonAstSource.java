package com.repo.cccp.sources;

import com.repo.cccp.core.AnalyzerConfig;
import com.repo.cccp.core.SyntaxSource;
import com.repo.cccp.core.SyntaxSourceException;
import com.repo.cccp.syntax.AstFormatException;
import com.repo.cccp.syntax.JsonAstReader;
import com.repo.cccp.syntax.Stmt;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads ASTs that were dumped to JSON ahead of time, e.g. by running
 * python_ast_dump.py on another machine.
 */
public class JsonAstSource implements SyntaxSource {

    private static final Set<String> EXTENSIONS = Set.of(".ast.json");

    private final JsonAstReader reader = new JsonAstReader();

    @Override
    public String getSourceId() {
        return "json-ast";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Stmt.Module parse(Path sourceFile, AnalyzerConfig config) throws SyntaxSourceException {
        try (Reader in = Files.newBufferedReader(sourceFile, StandardCharsets.UTF_8)) {
            return reader.read(in);
        } catch (IOException e) {
            throw new SyntaxSourceException(sourceFile, "Could not read " + sourceFile + ": " + e.getMessage(), e);
        } catch (AstFormatException e) {
            throw new SyntaxSourceException(sourceFile, e.getMessage(), e);
        }
    }
}
