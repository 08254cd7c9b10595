package com.repo.cccp.report;

import com.repo.cccp.metrics.ControlTree;

/**
 * Renders a control tree as a Graphviz digraph, one box per statement.
 */
public class ControlTreeGraphGenerator {

    public String generateDot(String name, ControlTree tree) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(name)).append("\" {\n");
        dot.append("  node [shape=box, fontname=\"monospace\"];\n");
        appendNode(dot, tree, new int[] {0});
        dot.append("}\n");
        return dot.toString();
    }

    /** Writes {@code node} and its subtree, returning the id assigned to {@code node}. */
    private int appendNode(StringBuilder dot, ControlTree node, int[] nextId) {
        int id = nextId[0]++;
        dot.append("  n").append(id).append(" [label=\"").append(label(node)).append("\"");
        if (!node.isLeaf()) {
            dot.append(", style=filled, color=lightgrey");
        }
        dot.append("];\n");

        for (ControlTree child : node.children()) {
            int childId = appendNode(dot, child, nextId);
            dot.append("  n").append(id).append(" -> n").append(childId).append(";\n");
        }
        return id;
    }

    private String label(ControlTree node) {
        return "%s@%d\\npd=%d bd=%d mpi=%d".formatted(
                node.source().kind(), node.line(), node.planDepth(), node.branchDepth(), node.mpi());
    }

    private String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
