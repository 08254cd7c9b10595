package com.repo.cccp.sources;

import com.repo.cccp.core.AnalyzerConfig;
import com.repo.cccp.core.SyntaxSourceException;
import com.repo.cccp.core.UnitAnalyzer;
import com.repo.cccp.metrics.AlgorithmVariant;
import com.repo.cccp.metrics.PlanScores;
import com.repo.cccp.syntax.Stmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonSyntaxSourceTest {

    @TempDir
    Path tempDir;

    private final PythonSyntaxSource source = new PythonSyntaxSource();

    @BeforeEach
    void requirePython() {
        assumeTrue(source.isAvailable(), "python3 not installed");
    }

    @Test
    void testParsesAndScoresLoop() throws Exception {
        Path file = tempDir.resolve("loop.py");
        Files.writeString(file, "for i in range(10):\n    x = i\n");

        Stmt.Module module = source.parse(file, AnalyzerConfig.defaults());

        assertEquals(new PlanScores(4, 3), UnitAnalyzer.score(module, AlgorithmVariant.CANONICAL));
    }

    @Test
    void testIndentedSnippetIsDedented() throws Exception {
        Path file = tempDir.resolve("snippet.py");
        Files.writeString(file, "    x = 1\n    y = x\n");

        Stmt.Module module = source.parse(file, AnalyzerConfig.defaults());
        assertEquals(2, module.body().size());
    }

    @Test
    void testSyntaxError() throws IOException {
        Path file = tempDir.resolve("broken.py");
        Files.writeString(file, "def (:\n");

        SyntaxSourceException e = assertThrows(SyntaxSourceException.class,
                () -> source.parse(file, AnalyzerConfig.defaults()));
        assertTrue(e.getMessage().contains("SyntaxError"));
        assertEquals(file, e.getSourceFile());
    }

    @Test
    void testUnavailableInterpreter() {
        PythonSyntaxSource bogus = new PythonSyntaxSource("no-such-python-interpreter");
        assertFalse(bogus.isAvailable());
    }

    @Test
    void testHungParserIsKilledAfterTimeout() throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "no POSIX shell");
        Path slowPython = tempDir.resolve("slow-python");
        Files.writeString(slowPython, """
                #!/bin/sh
                if [ "$1" = "--version" ]; then exec python3 --version; fi
                exec sleep 60
                """);
        assumeTrue(slowPython.toFile().setExecutable(true), "cannot mark script executable");

        Path config = tempDir.resolve("cccp.yaml");
        Files.writeString(config, "python:\n  timeout_seconds: 1\n");
        Path file = tempDir.resolve("loop.py");
        Files.writeString(file, "x = 1\n");

        PythonSyntaxSource slow = new PythonSyntaxSource(slowPython.toString());
        assumeTrue(slow.isAvailable(), "wrapper script cannot be executed here");
        long start = System.nanoTime();
        SyntaxSourceException e = assertThrows(SyntaxSourceException.class,
                () -> slow.parse(file, AnalyzerConfig.loadFile(config)));
        long elapsedSeconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start);

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(elapsedSeconds < 30, "took " + elapsedSeconds + "s");
    }
}
