package com.repo.cccp.core;

import com.repo.cccp.syntax.Stmt;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private record FakeSource(String id, Set<String> extensions, boolean available, int priority)
            implements SyntaxSource {

        @Override
        public String getSourceId() {
            return id;
        }

        @Override
        public Set<String> getSupportedExtensions() {
            return extensions;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Stmt.Module parse(Path sourceFile, AnalyzerConfig config) {
            return new Stmt.Module(List.of());
        }

        @Override
        public int getPriority() {
            return priority;
        }
    }

    @Test
    void testRoutesBySuffix() {
        FakeSource python = new FakeSource("python", Set.of(".py"), true, 10);
        FakeSource json = new FakeSource("json", Set.of(".json"), true, 100);
        FakeSource ast = new FakeSource("ast", Set.of(".ast.json"), true, 100);
        SourceRegistry registry = new SourceRegistry(List.of(python, json, ast));

        assertEquals(python, registry.getSource(Path.of("a", "b.py")).orElseThrow());
        assertEquals(ast, registry.getSource(Path.of("b.ast.json")).orElseThrow());
        assertEquals(json, registry.getSource(Path.of("data.json")).orElseThrow());
        assertTrue(registry.getSource(Path.of("README.md")).isEmpty());
        assertFalse(registry.supports(Path.of("setup.cfg")));
    }

    @Test
    void testPriorityAndAvailability() {
        FakeSource slow = new FakeSource("slow", Set.of(".py"), true, 50);
        FakeSource fast = new FakeSource("fast", Set.of(".py"), true, 5);
        FakeSource missing = new FakeSource("missing", Set.of(".py"), false, 1);
        SourceRegistry registry = new SourceRegistry(List.of(slow, fast, missing));

        assertEquals(fast, registry.getSource(Path.of("x.py")).orElseThrow());
        assertEquals(List.of(slow, fast), registry.getAvailableSources());
        assertEquals(Set.of(".py"), registry.getSupportedExtensions());
    }
}
