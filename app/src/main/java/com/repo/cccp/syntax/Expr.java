package com.repo.cccp.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Expression nodes understood by the analysis.
 * Anything else is carried as {@link Other} so callers can degrade gracefully.
 */
public sealed interface Expr {

    /** Node kind as named by the parser (e.g. "BinOp"). */
    String kind();

    record Constant(Object value) implements Expr {
        @Override
        public String kind() {
            return "Constant";
        }
    }

    record BinOp(Expr left, Operator op, Expr right) implements Expr {
        @Override
        public String kind() {
            return "BinOp";
        }
    }

    /** Possibly chained comparison: {@code left ops[0] comparators[0] ops[1] ...}. */
    record Compare(Expr left, List<Operator> ops, List<Expr> comparators) implements Expr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }

        @Override
        public String kind() {
            return "Compare";
        }
    }

    record UnaryOp(Operator op, Expr operand) implements Expr {
        @Override
        public String kind() {
            return "UnaryOp";
        }
    }

    record BoolOp(Operator op, List<Expr> values) implements Expr {
        public BoolOp {
            values = List.copyOf(values);
        }

        @Override
        public String kind() {
            return "BoolOp";
        }
    }

    record Call(Expr func, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public String kind() {
            return "Call";
        }

        /** Callee identifier when the call target is a plain name. */
        public Optional<String> calleeName() {
            return func instanceof Name name
                    ? Optional.of(name.id())
                    : Optional.empty();
        }
    }

    record Name(String id, NameContext context) implements Expr {
        @Override
        public String kind() {
            return "Name";
        }
    }

    /** List or tuple display. */
    record Sequence(SequenceKind sequenceKind, List<Expr> elements) implements Expr {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public String kind() {
            return sequenceKind == SequenceKind.LIST ? "List" : "Tuple";
        }
    }

    record Subscript(Expr value, Expr slice) implements Expr {
        @Override
        public String kind() {
            return "Subscript";
        }
    }

    /** Any expression kind outside the supported set. */
    record Other(String kind) implements Expr {
    }

    enum NameContext {
        LOAD, STORE, DEL
    }

    enum SequenceKind {
        LIST, TUPLE
    }
}
