package com.repo.cccp.core;

import com.repo.cccp.metrics.ControlTree;

/**
 * Scores for one analyzed unit.
 *
 * @param unitId       file path, or {@code path::function} in function mode
 * @param planDepth    maximum plan depth over leaf statements
 * @param maxPlanIndex maximum plan index over all statements
 * @param tree         control tree the scores were read from
 */
public record UnitScores(String unitId, int planDepth, int maxPlanIndex, ControlTree tree) {

    public static UnitScores of(String unitId, ControlTree tree) {
        return new UnitScores(unitId, tree.maxPlanDepth(), tree.maxPlanIndex(), tree);
    }
}
