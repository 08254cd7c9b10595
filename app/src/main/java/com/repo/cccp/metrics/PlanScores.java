package com.repo.cccp.metrics;

/**
 * The two scores reported for an analyzed unit.
 */
public record PlanScores(int planDepth, int maxPlanIndex) {

    public static PlanScores of(ControlTree tree) {
        return new PlanScores(tree.maxPlanDepth(), tree.maxPlanIndex());
    }
}
