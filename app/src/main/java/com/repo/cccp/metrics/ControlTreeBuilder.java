package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Expr;
import com.repo.cccp.syntax.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link ControlTree} from a module's statements.
 * <p>
 * Each supported statement contributes a plan depth (how much structure must be
 * tracked to execute it) and a plan index (identifiers in play, plus expression
 * depth, plus enclosing branches). Loops and conditionals raise the plan depth
 * of their bodies by the depth of their test and add one branch level.
 */
public class ControlTreeBuilder {

    private final ExpressionEvaluator evaluator;
    private final IdentifierCollector identifiers;

    public ControlTreeBuilder(AlgorithmVariant variant) {
        this.evaluator = new ExpressionEvaluator(variant);
        this.identifiers = new IdentifierCollector(variant);
    }

    public ControlTreeBuilder() {
        this(AlgorithmVariant.CANONICAL);
    }

    /** Build the tree for a whole module, starting at depth 0. */
    public ControlTree build(Stmt.Module module) {
        return build(module, 0, 0);
    }

    /**
     * Build the tree for {@code node}.
     *
     * @throws UnsupportedConstructException if {@code node} or any nested
     *                                       statement is outside the supported set
     */
    public ControlTree build(Stmt node, int parentPlanDepth, int branchDepth) {
        if (node instanceof Stmt.Module module) {
            List<ControlTree> children = buildAll(module.body(), parentPlanDepth, branchDepth);
            return new ControlTree(module, parentPlanDepth, 0, branchDepth, 0, children);
        }
        if (node instanceof Stmt.Assign assign) {
            return assignment(assign, parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.AugAssign augAssign) {
            return augmentedAssignment(augAssign, parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.ExprStmt exprStmt && exprStmt.value() instanceof Expr.Call call) {
            return callStatement(exprStmt, call, parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.For forStmt) {
            return branch(forStmt, forStmt.iter(), forStmt.body(), parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.While whileStmt) {
            return branch(whileStmt, whileStmt.test(), whileStmt.body(), parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.If ifStmt) {
            List<Stmt> both = new ArrayList<>(ifStmt.body());
            both.addAll(ifStmt.orelse());
            return branch(ifStmt, ifStmt.test(), both, parentPlanDepth, branchDepth);
        }
        if (node instanceof Stmt.Simple) {
            return ControlTree.leaf(node, parentPlanDepth + 1, branchDepth, branchDepth + 1);
        }
        throw new UnsupportedConstructException(node.kind(), node.line());
    }

    private List<ControlTree> buildAll(List<Stmt> statements, int parentPlanDepth, int branchDepth) {
        List<ControlTree> result = new ArrayList<>(statements.size());
        for (Stmt child : statements) {
            result.add(build(child, parentPlanDepth, branchDepth));
        }
        return result;
    }

    private ControlTree assignment(Stmt.Assign assign, int parentPlanDepth, int branchDepth) {
        int valueDepth = evaluator.depth(assign.value());
        int targetDepth = 0;
        for (Expr target : assign.targets()) {
            targetDepth = Math.max(targetDepth, evaluator.depth(target));
        }
        // a plain name target is already paid for by the assignment itself
        int assignmentDepth = Math.max(valueDepth + 1, targetDepth);

        Set<String> loaded = identifiers.identifiers(assign.value());
        for (Expr target : assign.targets()) {
            loaded.addAll(identifiers.identifiers(target, true));
        }
        // one identifier is already counted in the assignment depth
        int mpi = loaded.size() + assignmentDepth + branchDepth - 1;
        return ControlTree.leaf(assign, parentPlanDepth + assignmentDepth, branchDepth, mpi);
    }

    private ControlTree augmentedAssignment(Stmt.AugAssign augAssign, int parentPlanDepth, int branchDepth) {
        int valueDepth = evaluator.depth(augAssign.value());
        int targetDepth = evaluator.depth(augAssign.target());
        int assignmentDepth = Math.max(valueDepth + 1, targetDepth) + 1;

        // the target is read before it is written
        Set<String> loaded = identifiers.identifiers(augAssign.value());
        loaded.addAll(identifiers.identifiers(augAssign.target()));
        int mpi = loaded.size() + assignmentDepth + branchDepth - (valueDepth > 0 ? 1 : 0);
        return ControlTree.leaf(augAssign, parentPlanDepth + assignmentDepth, branchDepth, mpi);
    }

    private ControlTree callStatement(Stmt.ExprStmt stmt, Expr.Call call, int parentPlanDepth, int branchDepth) {
        if (call.args().isEmpty()) {
            return ControlTree.leaf(stmt, parentPlanDepth + 1, branchDepth, branchDepth + 1);
        }
        int argDepth = 0;
        for (Expr arg : call.args()) {
            argDepth = Math.max(argDepth, evaluator.depth(arg));
        }
        Set<String> loaded = identifiers.identifiers(call);
        int mpi = loaded.size() + argDepth + branchDepth + (loaded.isEmpty() ? 1 : 0);
        return ControlTree.leaf(stmt, parentPlanDepth + argDepth + 1, branchDepth, mpi);
    }

    /**
     * Shared rule for for/while/if: the header's own cost comes from its
     * test (or iterable) expression, and its body is one branch level deeper.
     */
    private ControlTree branch(Stmt node, Expr test, List<Stmt> body, int parentPlanDepth, int branchDepth) {
        int testDepth = evaluator.depth(test);
        int planDepth = parentPlanDepth + testDepth + 1;
        List<ControlTree> children = buildAll(body, planDepth, branchDepth + 1);

        Set<String> loaded = identifiers.identifiers(test);
        int mpi = loaded.size() + testDepth + branchDepth + (loaded.isEmpty() ? 1 : 0);
        return new ControlTree(node, planDepth, node.line(), branchDepth, mpi, children);
    }
}
