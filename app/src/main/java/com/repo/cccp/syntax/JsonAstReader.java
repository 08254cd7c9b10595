package com.repo.cccp.syntax;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Python AST serialized as JSON into the {@link Stmt}/{@link Expr} model.
 * <p>
 * Every node is an object with a {@code _type} field naming the {@code ast} class,
 * statements carry {@code lineno}, and the remaining fields mirror the
 * {@code ast} field names. Unknown statements become {@link Stmt.Unsupported},
 * unknown expressions become {@link Expr.Other}.
 */
public class JsonAstReader {

    private static final String TYPE = "_type";

    public Stmt.Module read(String json) {
        try {
            return readRoot(JsonParser.parseString(json));
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                | ClassCastException | NumberFormatException e) {
            throw new AstFormatException("Malformed AST document: " + e.getMessage(), e);
        }
    }

    public Stmt.Module read(Reader reader) {
        try {
            return readRoot(JsonParser.parseReader(reader));
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                | ClassCastException | NumberFormatException e) {
            throw new AstFormatException("Malformed AST document: " + e.getMessage(), e);
        }
    }

    private Stmt.Module readRoot(JsonElement root) {
        if (!root.isJsonObject()) {
            throw new AstFormatException("AST root must be an object");
        }
        JsonObject obj = root.getAsJsonObject();
        if (obj.has("error")) {
            JsonElement error = obj.get("error");
            throw new AstFormatException("Parser reported: "
                    + (error.isJsonPrimitive() ? error.getAsString() : error.toString()));
        }
        String type = typeOf(obj);
        if (!"Module".equals(type)) {
            throw new AstFormatException("AST root must be a Module, got " + type);
        }
        return new Stmt.Module(statements(obj, "body"));
    }

    private List<Stmt> statements(JsonObject parent, String field) {
        List<Stmt> result = new ArrayList<>();
        for (JsonElement e : array(parent, field)) {
            result.add(statement(e.getAsJsonObject()));
        }
        return result;
    }

    Stmt statement(JsonObject node) {
        String type = typeOf(node);
        int line = lineOf(node);

        return switch (type) {
            case "Assign" -> new Stmt.Assign(line, expressions(node, "targets"), expression(node.get("value")));
            case "AugAssign" -> new Stmt.AugAssign(line, expression(node.get("target")),
                    operator(node.get("op")), expression(node.get("value")));
            case "Expr" -> new Stmt.ExprStmt(line, expression(node.get("value")));
            case "For" -> new Stmt.For(line, expression(node.get("target")), expression(node.get("iter")),
                    statements(node, "body"));
            case "While" -> new Stmt.While(line, expression(node.get("test")), statements(node, "body"));
            case "If" -> new Stmt.If(line, expression(node.get("test")), statements(node, "body"),
                    statements(node, "orelse"));
            case "Break" -> new Stmt.Simple(line, Stmt.SimpleKind.BREAK);
            case "Continue" -> new Stmt.Simple(line, Stmt.SimpleKind.CONTINUE);
            case "Pass" -> new Stmt.Simple(line, Stmt.SimpleKind.PASS);
            case "Import" -> new Stmt.Simple(line, Stmt.SimpleKind.IMPORT);
            case "ImportFrom" -> new Stmt.Simple(line, Stmt.SimpleKind.IMPORT_FROM);
            case "FunctionDef" -> new Stmt.FunctionDef(line, string(node, "name"), statements(node, "body"));
            default -> new Stmt.Unsupported(line, type);
        };
    }

    private List<Expr> expressions(JsonObject parent, String field) {
        List<Expr> result = new ArrayList<>();
        for (JsonElement e : array(parent, field)) {
            result.add(expression(e));
        }
        return result;
    }

    Expr expression(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return new Expr.Other("None");
        }
        JsonObject node = element.getAsJsonObject();
        String type = typeOf(node);

        return switch (type) {
            case "Constant" -> new Expr.Constant(constantValue(node.get("value")));
            case "BinOp" -> new Expr.BinOp(expression(node.get("left")), operator(node.get("op")),
                    expression(node.get("right")));
            case "Compare" -> new Expr.Compare(expression(node.get("left")), operators(node, "ops"),
                    expressions(node, "comparators"));
            case "UnaryOp" -> new Expr.UnaryOp(operator(node.get("op")), expression(node.get("operand")));
            case "BoolOp" -> new Expr.BoolOp(operator(node.get("op")), expressions(node, "values"));
            case "Call" -> new Expr.Call(expression(node.get("func")), expressions(node, "args"));
            case "Name" -> new Expr.Name(string(node, "id"), context(node.get("ctx")));
            case "List" -> new Expr.Sequence(Expr.SequenceKind.LIST, expressions(node, "elts"));
            case "Tuple" -> new Expr.Sequence(Expr.SequenceKind.TUPLE, expressions(node, "elts"));
            case "Subscript" -> new Expr.Subscript(expression(node.get("value")), expression(node.get("slice")));
            // Python < 3.9 wraps plain subscripts in Index
            case "Index" -> expression(node.get("value"));
            default -> new Expr.Other(type);
        };
    }

    private List<Operator> operators(JsonObject parent, String field) {
        List<Operator> result = new ArrayList<>();
        for (JsonElement e : array(parent, field)) {
            result.add(operator(e));
        }
        return result;
    }

    private Operator operator(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new AstFormatException("Missing operator node");
        }
        try {
            return Operator.fromAstName(typeOf(element.getAsJsonObject()));
        } catch (IllegalArgumentException e) {
            throw new AstFormatException(e.getMessage(), e);
        }
    }

    private Expr.NameContext context(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return Expr.NameContext.LOAD;
        }
        return switch (typeOf(element.getAsJsonObject())) {
            case "Store" -> Expr.NameContext.STORE;
            case "Del" -> Expr.NameContext.DEL;
            default -> Expr.NameContext.LOAD;
        };
    }

    private Object constantValue(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (value.isJsonPrimitive()) {
            JsonPrimitive primitive = value.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                return primitive.getAsNumber();
            }
            return primitive.getAsString();
        }
        return value.toString();
    }

    private JsonArray array(JsonObject parent, String field) {
        JsonElement e = parent.get(field);
        if (e == null || e.isJsonNull()) {
            return new JsonArray();
        }
        if (!e.isJsonArray()) {
            throw new AstFormatException("Field '" + field + "' of " + typeOf(parent) + " must be an array");
        }
        return e.getAsJsonArray();
    }

    private String string(JsonObject node, String field) {
        JsonElement e = node.get(field);
        if (e == null || !e.isJsonPrimitive()) {
            throw new AstFormatException("Field '" + field + "' of " + typeOf(node) + " must be a string");
        }
        return e.getAsString();
    }

    private int lineOf(JsonObject node) {
        JsonElement lineno = node.get("lineno");
        if (lineno == null || lineno.isJsonNull()) {
            return -1;
        }
        if (!lineno.isJsonPrimitive() || !lineno.getAsJsonPrimitive().isNumber()) {
            throw new AstFormatException("Statement line number is not a number: " + lineno);
        }
        return lineno.getAsInt();
    }

    private String typeOf(JsonObject node) {
        JsonElement type = node.get(TYPE);
        if (type == null || !type.isJsonPrimitive()) {
            throw new AstFormatException("AST node without " + TYPE + ": " + node);
        }
        return type.getAsString();
    }
}
