package com.repo.cccp.syntax;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operator kinds that can appear in an expression.
 * Names match the node names of Python's {@code ast} module.
 */
public enum Operator {

    // Binary
    ADD("Add"),
    SUB("Sub"),
    MULT("Mult"),
    MAT_MULT("MatMult"),
    DIV("Div"),
    MOD("Mod"),
    POW("Pow"),
    LSHIFT("LShift"),
    RSHIFT("RShift"),
    BIT_OR("BitOr"),
    BIT_XOR("BitXor"),
    BIT_AND("BitAnd"),
    FLOOR_DIV("FloorDiv"),

    // Comparison
    EQ("Eq"),
    NOT_EQ("NotEq"),
    LT("Lt"),
    LT_E("LtE"),
    GT("Gt"),
    GT_E("GtE"),
    IS("Is"),
    IS_NOT("IsNot"),
    IN("In"),
    NOT_IN("NotIn"),

    // Boolean
    AND("And"),
    OR("Or"),

    // Unary
    INVERT("Invert"),
    NOT("Not"),
    U_ADD("UAdd"),
    U_SUB("USub");

    private static final Map<String, Operator> BY_AST_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(Operator::astName, Function.identity()));

    private final String astName;

    Operator(String astName) {
        this.astName = astName;
    }

    public String astName() {
        return astName;
    }

    /**
     * Look up an operator by its {@code ast} node name, e.g. {@code "Add"}.
     *
     * @throws IllegalArgumentException if the name is not an operator
     */
    public static Operator fromAstName(String name) {
        Operator op = BY_AST_NAME.get(name);
        if (op == null) {
            throw new IllegalArgumentException("Unknown operator: " + name);
        }
        return op;
    }
}
