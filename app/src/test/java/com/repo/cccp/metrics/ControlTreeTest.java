package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repo.cccp.syntax.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class ControlTreeTest {

    private final Stmt.Module root = module();

    @Test
    void testLeafReportsItsOwnValues() {
        ControlTree leaf = ControlTree.leaf(pass(3), 4, 1, 2);
        assertEquals(4, leaf.maxPlanDepth());
        assertEquals(2, leaf.maxPlanIndex());
        assertEquals(3, leaf.line());
    }

    @Test
    void testPlanDepthIgnoresInnerNodes() {
        // a header deeper than its only child never wins
        ControlTree inner = new ControlTree(pass(1), 9, 1, 0, 0, List.of(ControlTree.leaf(pass(2), 3, 1, 0)));
        ControlTree tree = new ControlTree(root, 0, 0, 0, 0, List.of(inner, ControlTree.leaf(pass(5), 2, 0, 0)));
        assertEquals(3, tree.maxPlanDepth());
    }

    @Test
    void testPlanIndexIncludesInnerNodes() {
        ControlTree inner = new ControlTree(pass(1), 1, 1, 0, 7, List.of(ControlTree.leaf(pass(2), 2, 1, 3)));
        ControlTree tree = new ControlTree(root, 0, 0, 0, 0, List.of(inner));
        assertEquals(7, tree.maxPlanIndex());
    }

    @Test
    void testHeaderWithoutBodyCountsAsLeaf() {
        ControlTree emptyLoop = new ControlTree(pass(1), 5, 1, 0, 1, List.of());
        ControlTree tree = new ControlTree(root, 0, 0, 0, 0, List.of(emptyLoop));
        assertEquals(5, tree.maxPlanDepth());
    }

    @Test
    void testReductionsAreRepeatable() {
        ControlTree tree = new ControlTree(root, 0, 0, 0, 0, List.of(
                ControlTree.leaf(pass(1), 2, 0, 4),
                ControlTree.leaf(pass(2), 6, 0, 1)));
        PlanScores first = PlanScores.of(tree);
        assertEquals(first, PlanScores.of(tree));
        assertEquals(new PlanScores(6, 4), first);
        assertEquals(3, tree.size());
    }
}
