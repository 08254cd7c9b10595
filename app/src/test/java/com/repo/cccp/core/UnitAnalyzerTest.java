package com.repo.cccp.core;

import com.repo.cccp.metrics.AlgorithmVariant;
import com.repo.cccp.metrics.PlanScores;
import com.repo.cccp.metrics.UnsupportedConstructException;
import com.repo.cccp.syntax.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repo.cccp.syntax.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class UnitAnalyzerTest {

    // import os
    // def f():
    //     x = 1
    // y = g(2)
    private final Stmt.Module script = module(
            new Stmt.Simple(1, Stmt.SimpleKind.IMPORT),
            new Stmt.FunctionDef(2, "f", List.of(assign(3, store("x"), num(1)))),
            assign(4, store("y"), call("g", num(2))));

    @Test
    void testScore() {
        Stmt.Module loop = module(forLoop(1, "i", call("range", num(10)), assign(2, store("x"), name("i"))));
        assertEquals(new PlanScores(4, 3), UnitAnalyzer.score(loop, AlgorithmVariant.CANONICAL));
    }

    @Test
    void testModuleModeRejectsFunctions() {
        UnitAnalyzer analyzer = new UnitAnalyzer(AnalyzerConfig.defaults());
        UnitResults results = analyzer.analyze("script.py", script);

        assertTrue(results.scores().isEmpty());
        UnsupportedConstructException e = results.failures().get("script.py");
        assertEquals("FunctionDef", e.getKind());
        assertEquals(2, e.getLine());
    }

    @Test
    void testFailingUnitKeepsSiblings() {
        UnitAnalyzer analyzer = new UnitAnalyzer(AnalyzerConfig.defaults().withUnitMode(UnitMode.FUNCTION));
        Stmt.Module withClass = module(
                new Stmt.FunctionDef(1, "f", List.of(assign(2, store("x"), num(1)))),
                new Stmt.Unsupported(3, "ClassDef"),
                new Stmt.FunctionDef(4, "g", List.of(new Stmt.Unsupported(5, "Try"))),
                new Stmt.FunctionDef(6, "h", List.of(pass(7))));

        UnitResults results = analyzer.analyze("s.py", withClass);

        assertEquals(List.of("s.py::f", "s.py::h"),
                results.scores().stream().map(UnitScores::unitId).toList());
        assertEquals(List.of("s.py::g", "s.py::<module>"), List.copyOf(results.failures().keySet()));
        assertEquals("Unsupported construct Try at line 5", results.failures().get("s.py::g").getMessage());
        assertEquals("Unsupported construct ClassDef at line 3",
                results.failures().get("s.py::<module>").getMessage());
    }

    @Test
    void testFunctionMode() {
        UnitAnalyzer analyzer = new UnitAnalyzer(AnalyzerConfig.defaults().withUnitMode(UnitMode.FUNCTION));

        List<UnitScores> units = analyzer.analyze("script.py", script).scores();

        assertEquals(List.of("script.py::f", "script.py::<module>"),
                units.stream().map(UnitScores::unitId).toList());

        UnitScores function = units.get(0);
        assertEquals(1, function.planDepth());
        assertEquals(0, function.maxPlanIndex());

        // import: pd 1, mpi 1; y = g(2): pd 2, mpi 1 + 2 - 1
        UnitScores rest = units.get(1);
        assertEquals(2, rest.planDepth());
        assertEquals(2, rest.maxPlanIndex());
    }

    @Test
    void testFunctionModeOnEmptyFile() {
        UnitAnalyzer analyzer = new UnitAnalyzer(AnalyzerConfig.defaults().withUnitMode(UnitMode.FUNCTION));
        List<UnitScores> units = analyzer.analyze("empty.py", module()).scores();
        assertEquals(1, units.size());
        assertEquals(0, units.get(0).planDepth());
    }

    @Test
    void testModuleMode() {
        UnitAnalyzer analyzer = new UnitAnalyzer(AnalyzerConfig.defaults());
        List<UnitScores> units = analyzer.analyze("a.py", module(assign(1, store("x"), num(1)))).scores();
        assertEquals(1, units.size());
        assertEquals("a.py", units.get(0).unitId());
        assertEquals(1, units.get(0).planDepth());
        assertEquals(2, units.get(0).tree().size());
    }
}
