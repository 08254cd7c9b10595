package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Expr;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the identifiers an expression refers to, following the same node
 * kinds as {@link ExpressionEvaluator}.
 */
public class IdentifierCollector {

    private final AlgorithmVariant variant;

    public IdentifierCollector(AlgorithmVariant variant) {
        this.variant = variant;
    }

    public IdentifierCollector() {
        this(AlgorithmVariant.CANONICAL);
    }

    /** All identifiers read or written in {@code expr}. */
    public Set<String> identifiers(Expr expr) {
        return identifiers(expr, false);
    }

    /**
     * Identifiers in {@code expr}. With {@code excludeAssignmentTargets}, names
     * that are only stored into are skipped, unless the variant counts them.
     */
    public Set<String> identifiers(Expr expr, boolean excludeAssignmentTargets) {
        Set<String> result = new LinkedHashSet<>();
        collect(expr, excludeAssignmentTargets && variant.excludeStoreTargets(), result);
        return result;
    }

    private void collect(Expr expr, boolean skipStores, Set<String> out) {
        if (expr instanceof Expr.BinOp binOp) {
            collect(binOp.left(), skipStores, out);
            collect(binOp.right(), skipStores, out);
        } else if (expr instanceof Expr.Compare compare) {
            collect(compare.left(), skipStores, out);
            compare.comparators().forEach(c -> collect(c, skipStores, out));
        } else if (expr instanceof Expr.UnaryOp unaryOp) {
            collect(unaryOp.operand(), skipStores, out);
        } else if (expr instanceof Expr.BoolOp boolOp) {
            boolOp.values().forEach(v -> collect(v, skipStores, out));
        } else if (expr instanceof Expr.Call call) {
            call.calleeName().ifPresent(out::add);
            call.args().forEach(a -> collect(a, skipStores, out));
        } else if (expr instanceof Expr.Name name) {
            if (!(skipStores && name.context() == Expr.NameContext.STORE)) {
                out.add(name.id());
            }
        } else if (expr instanceof Expr.Sequence sequence) {
            // tuple unpacking targets carry STORE on each element
            sequence.elements().forEach(e -> collect(e, skipStores, out));
        } else if (expr instanceof Expr.Subscript subscript) {
            collect(subscript.value(), skipStores, out);
            collect(subscript.slice(), skipStores, out);
        }
    }
}
