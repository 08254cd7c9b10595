package com.repo.cccp.metrics;

import com.repo.cccp.syntax.Operator;

import java.util.Set;

/**
 * Nesting depth of an expression together with the operator kinds used at its
 * top evaluation level.
 */
public record ExpressionDepth(int depth, Set<Operator> operators) {

    public static final ExpressionDepth NONE = new ExpressionDepth(0, Set.of());

    public ExpressionDepth {
        operators = Set.copyOf(operators);
    }

    public static ExpressionDepth of(int depth) {
        return new ExpressionDepth(depth, Set.of());
    }
}
