package com.repo.cccp.sources;

import com.repo.cccp.core.AnalyzerConfig;
import com.repo.cccp.core.SyntaxSource;
import com.repo.cccp.core.SyntaxSourceException;
import com.repo.cccp.syntax.AstFormatException;
import com.repo.cccp.syntax.JsonAstReader;
import com.repo.cccp.syntax.Stmt;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Python source that shells out to the python_ast_dump.py script and reads the
 * JSON AST it prints.
 */
public class PythonSyntaxSource implements SyntaxSource {

    private static final Set<String> EXTENSIONS = Set.of(".py");
    static final String SCRIPT_NAME = "python_ast_dump.py";
    private static final String SCRIPT_RESOURCE = "/analyzers/" + SCRIPT_NAME;

    private final String pythonCommand;
    private final JsonAstReader reader = new JsonAstReader();
    private Path scriptPath;
    private Boolean pythonAvailable;

    public PythonSyntaxSource(String pythonCommand) {
        this.pythonCommand = pythonCommand;
    }

    public PythonSyntaxSource() {
        this("python3");
    }

    private Path findScript() throws IOException {
        // Check relative paths first so a checked-out script can be edited in place
        List<Path> candidates = List.of(
                Path.of("analyzers", SCRIPT_NAME),
                Path.of("..", "analyzers", SCRIPT_NAME),
                Path.of(System.getProperty("user.dir"), "analyzers", SCRIPT_NAME));

        for (Path candidate : candidates) {
            if (Files.exists(candidate)) {
                return candidate.toAbsolutePath();
            }
        }

        return extractBundledScript();
    }

    private Path extractBundledScript() throws IOException {
        try (InputStream in = PythonSyntaxSource.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("Bundled script missing: " + SCRIPT_RESOURCE);
            }
            Path target = Files.createTempFile("cccp-", "-" + SCRIPT_NAME);
            target.toFile().deleteOnExit();
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        }
    }

    @Override
    public String getSourceId() {
        return "python";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public synchronized boolean isAvailable() {
        if (pythonAvailable == null) {
            pythonAvailable = checkPythonAvailable() && resolveScript().isPresent();
        }
        return pythonAvailable;
    }

    @Override
    public int getPriority() {
        return 10; // High priority for Python files
    }

    @Override
    public Stmt.Module parse(Path sourceFile, AnalyzerConfig config) throws SyntaxSourceException {
        Path script = resolveScript()
                .orElseThrow(() -> new SyntaxSourceException(sourceFile, "AST dump script not available"));
        String json;
        try {
            json = executeScript(script, sourceFile, config.getPythonTimeoutSeconds());
        } catch (IOException e) {
            throw new SyntaxSourceException(sourceFile, "Python parser failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyntaxSourceException(sourceFile, "Interrupted while parsing", e);
        }

        try {
            return reader.read(json);
        } catch (AstFormatException e) {
            throw new SyntaxSourceException(sourceFile, e.getMessage(), e);
        }
    }

    private synchronized Optional<Path> resolveScript() {
        if (scriptPath == null) {
            try {
                scriptPath = findScript();
            } catch (IOException e) {
                System.err.println("Python source: " + e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(scriptPath);
    }

    private boolean checkPythonAvailable() {
        try {
            ProcessBuilder pb = new ProcessBuilder(pythonCommand, "--version");
            pb.redirectErrorStream(true);
            Process process = pb.start();
            boolean finished = process.waitFor(5, TimeUnit.SECONDS);
            return finished && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String executeScript(Path script, Path sourceFile, int timeoutSeconds)
            throws IOException, InterruptedException {
        // Output goes to a file; only waitFor may block
        Path output = Files.createTempFile("cccp-ast-", ".json");
        try {
            ProcessBuilder pb = new ProcessBuilder(
                    pythonCommand,
                    script.toString(),
                    sourceFile.toAbsolutePath().toString());
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
            pb.redirectOutput(output.toFile());

            Process process = pb.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Python script timed out after " + timeoutSeconds + "s");
            }

            String json = Files.readString(output, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                throw new IOException("Python script produced no output (exit code " + process.exitValue() + ")");
            }
            return json;
        } finally {
            Files.deleteIfExists(output);
        }
    }
}
