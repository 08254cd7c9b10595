package com.repo.cccp.syntax;

import java.util.List;

/**
 * Statement nodes understood by the control-tree builder.
 * Every statement carries the source line it starts on; the module root uses 0.
 */
public sealed interface Stmt {

    String kind();

    int line();

    record Module(List<Stmt> body) implements Stmt {
        public Module {
            body = List.copyOf(body);
        }

        @Override
        public String kind() {
            return "Module";
        }

        @Override
        public int line() {
            return 0;
        }
    }

    record Assign(int line, List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public String kind() {
            return "Assign";
        }
    }

    record AugAssign(int line, Expr target, Operator op, Expr value) implements Stmt {
        @Override
        public String kind() {
            return "AugAssign";
        }
    }

    /** An expression used as a statement, e.g. a bare call. */
    record ExprStmt(int line, Expr value) implements Stmt {
        @Override
        public String kind() {
            return "Expr";
        }
    }

    record For(int line, Expr target, Expr iter, List<Stmt> body) implements Stmt {
        public For {
            body = List.copyOf(body);
        }

        @Override
        public String kind() {
            return "For";
        }
    }

    record While(int line, Expr test, List<Stmt> body) implements Stmt {
        public While {
            body = List.copyOf(body);
        }

        @Override
        public String kind() {
            return "While";
        }
    }

    record If(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public If {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public String kind() {
            return "If";
        }
    }

    /** Statements with no operands worth scoring: break, continue, pass, imports. */
    record Simple(int line, SimpleKind simpleKind) implements Stmt {
        @Override
        public String kind() {
            return simpleKind.astName();
        }
    }

    /** Function definition. Only used to split a file into per-function units. */
    record FunctionDef(int line, String name, List<Stmt> body) implements Stmt {
        public FunctionDef {
            body = List.copyOf(body);
        }

        @Override
        public String kind() {
            return "FunctionDef";
        }
    }

    /** Any statement kind outside the supported set. */
    record Unsupported(int line, String kind) implements Stmt {
    }

    enum SimpleKind {
        BREAK("Break"),
        CONTINUE("Continue"),
        PASS("Pass"),
        IMPORT("Import"),
        IMPORT_FROM("ImportFrom");

        private final String astName;

        SimpleKind(String astName) {
            this.astName = astName;
        }

        public String astName() {
            return astName;
        }
    }
}
