package com.repo.cccp.core;

import com.repo.cccp.metrics.AlgorithmVariant;
import com.repo.cccp.metrics.ControlTreeBuilder;
import com.repo.cccp.metrics.PlanScores;
import com.repo.cccp.metrics.UnsupportedConstructException;
import com.repo.cccp.syntax.Stmt;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores source units. Holds no state between calls, so one instance may be
 * shared by threads analyzing different files.
 */
public class UnitAnalyzer {

    public static final String MODULE_REST = "<module>";

    private final AnalyzerConfig config;
    private final ControlTreeBuilder builder;

    public UnitAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.builder = new ControlTreeBuilder(config.getVariant());
    }

    /**
     * Score a parsed module with the given rule set.
     *
     * @throws UnsupportedConstructException if the module contains a statement that cannot be scored
     */
    public static PlanScores score(Stmt.Module module, AlgorithmVariant variant) {
        return PlanScores.of(new ControlTreeBuilder(variant).build(module));
    }

    /**
     * Parse {@code file} with {@code source} and score it according to the
     * configured unit mode. A unit containing a statement that cannot be scored
     * is reported in {@link UnitResults#failures()}; the file's other units are
     * still scored.
     *
     * @throws SyntaxSourceException if the file cannot be parsed
     */
    public UnitResults analyze(Path file, SyntaxSource source) throws SyntaxSourceException {
        Stmt.Module module = source.parse(file, config);
        return analyze(file.toString(), module);
    }

    public UnitResults analyze(String fileId, Stmt.Module module) {
        List<UnitScores> scores = new ArrayList<>();
        Map<String, UnsupportedConstructException> failures = new LinkedHashMap<>();

        if (config.getUnitMode() == UnitMode.MODULE) {
            scoreUnit(fileId, module, scores, failures);
            return new UnitResults(scores, failures);
        }

        List<Stmt> rest = new ArrayList<>();
        for (Stmt stmt : module.body()) {
            if (stmt instanceof Stmt.FunctionDef function) {
                scoreUnit(fileId + "::" + function.name(), new Stmt.Module(function.body()), scores, failures);
            } else {
                rest.add(stmt);
            }
        }
        if (!rest.isEmpty() || (scores.isEmpty() && failures.isEmpty())) {
            scoreUnit(fileId + "::" + MODULE_REST, new Stmt.Module(rest), scores, failures);
        }
        return new UnitResults(scores, failures);
    }

    private void scoreUnit(String unitId, Stmt.Module body, List<UnitScores> scores,
            Map<String, UnsupportedConstructException> failures) {
        try {
            scores.add(UnitScores.of(unitId, builder.build(body)));
        } catch (UnsupportedConstructException e) {
            failures.put(unitId, e);
        }
    }
}
