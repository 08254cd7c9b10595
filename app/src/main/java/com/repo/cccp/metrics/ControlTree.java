package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Stmt;

import java.util.List;

/**
 * Node of the control tree: one per scored statement, with loop and
 * conditional bodies as children.
 *
 * @param source      statement this node was built from
 * @param planDepth   plan depth including all enclosing structure
 * @param line        source line, 0 for the module root
 * @param branchDepth number of enclosing if/for/while statements
 * @param mpi         plan index of this statement alone
 * @param children    nested statements in source order
 */
public record ControlTree(
        Stmt source,
        int planDepth,
        int line,
        int branchDepth,
        int mpi,
        List<ControlTree> children) {

    public ControlTree {
        children = List.copyOf(children);
    }

    public static ControlTree leaf(Stmt source, int planDepth, int branchDepth, int mpi) {
        return new ControlTree(source, planDepth, source.line(), branchDepth, mpi, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Plan depth of the deepest leaf. Inner nodes only count when they have no
     * children.
     */
    public int maxPlanDepth() {
        if (isLeaf()) {
            return planDepth;
        }
        int max = Integer.MIN_VALUE;
        for (ControlTree child : children) {
            max = Math.max(max, child.maxPlanDepth());
        }
        return max;
    }

    /** Largest plan index of this node or any descendant. */
    public int maxPlanIndex() {
        int max = mpi;
        for (ControlTree child : children) {
            max = Math.max(max, child.maxPlanIndex());
        }
        return max;
    }

    /** Number of nodes in this subtree, root included. */
    public int size() {
        int count = 1;
        for (ControlTree child : children) {
            count += child.size();
        }
        return count;
    }
}
