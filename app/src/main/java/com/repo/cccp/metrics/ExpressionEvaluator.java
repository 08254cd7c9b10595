package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Expr;
import com.repo.cccp.syntax.Operator;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the structural depth of an expression.
 * <p>
 * Names and calls cost one level each, containers and subscripts add a level on
 * top of their operands, and mixing a new operator kind into an expression adds
 * one more level. Repeating an operator kind already in use adds nothing, so
 * {@code a + b + c} is shallower than {@code a + b * c}.
 * Unknown expression kinds have depth 0.
 */
public class ExpressionEvaluator {

    private final AlgorithmVariant variant;

    public ExpressionEvaluator(AlgorithmVariant variant) {
        this.variant = variant;
    }

    public ExpressionEvaluator() {
        this(AlgorithmVariant.CANONICAL);
    }

    public int depth(Expr expr) {
        return evaluate(expr).depth();
    }

    public ExpressionDepth evaluate(Expr expr) {
        if (expr instanceof Expr.Constant) {
            return ExpressionDepth.NONE;
        }
        if (expr instanceof Expr.BinOp binOp) {
            return combine(List.of(evaluate(binOp.left()), evaluate(binOp.right())), Set.of(binOp.op()));
        }
        if (expr instanceof Expr.Compare compare) {
            ExpressionDepth left = evaluate(compare.left());
            ExpressionDepth right = ExpressionDepth.of(maxDepth(compare.comparators(), 1));
            return combine(List.of(left, right), compare.ops());
        }
        if (expr instanceof Expr.UnaryOp unaryOp) {
            return ExpressionDepth.of(depth(unaryOp.operand()) + 1);
        }
        if (expr instanceof Expr.BoolOp boolOp) {
            if (boolOp.values().isEmpty()) {
                return ExpressionDepth.NONE;
            }
            return combine(boolOp.values().stream().map(this::evaluate).toList(), Set.of(boolOp.op()));
        }
        if (expr instanceof Expr.Call call) {
            if (call.args().isEmpty()) {
                return ExpressionDepth.of(1);
            }
            return ExpressionDepth.of(maxDepth(call.args(), 0) + 1);
        }
        if (expr instanceof Expr.Name) {
            return ExpressionDepth.of(1);
        }
        if (expr instanceof Expr.Sequence sequence) {
            if (sequence.elements().isEmpty()) {
                return ExpressionDepth.of(variant.emptyContainerDepth());
            }
            return ExpressionDepth.of(maxDepth(sequence.elements(), 0) + 1);
        }
        if (expr instanceof Expr.Subscript subscript) {
            return ExpressionDepth.of(subscriptDepth(subscript));
        }
        return ExpressionDepth.NONE;
    }

    private int subscriptDepth(Expr.Subscript subscript) {
        int base = depth(subscript.value());
        int index = depth(subscript.slice());
        // reading dimension i+1 of a structure happens inside reading dimension i
        if (variant.compoundChainedSubscripts() && subscript.value() instanceof Expr.Subscript) {
            return base + index + 1;
        }
        return Math.max(base, index) + 1;
    }

    /**
     * Takes the deepest operand and adds a level when {@code ops} introduces an
     * operator kind none of the operands used.
     */
    private ExpressionDepth combine(List<ExpressionDepth> operands, Collection<Operator> ops) {
        Set<Operator> childOps = EnumSet.noneOf(Operator.class);
        int max = 0;
        for (ExpressionDepth operand : operands) {
            childOps.addAll(operand.operators());
            max = Math.max(max, operand.depth());
        }
        Set<Operator> allOps = EnumSet.noneOf(Operator.class);
        allOps.addAll(childOps);
        allOps.addAll(ops);
        int diversity = allOps.size() > childOps.size() ? 1 : 0;
        return new ExpressionDepth(max + diversity, allOps);
    }

    /** Deepest element of a list, or {@code emptyDepth} for an empty list. */
    private int maxDepth(List<Expr> exprs, int emptyDepth) {
        if (exprs.isEmpty()) {
            return emptyDepth;
        }
        int max = 0;
        for (Expr e : exprs) {
            max = Math.max(max, depth(e));
        }
        return max;
    }
}
