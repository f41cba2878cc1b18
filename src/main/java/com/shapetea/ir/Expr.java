package com.shapetea.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression nodes of the analysed IR. Trees are built by the host frontend (or by {@link Ir}
 * in tests) and are never mutated by the engine.
 */
public class Expr {

    public interface ExprNode {
        CodeSource source();

        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitConst(Const expr);
        R visitObject(ObjectExpr expr);
        R visitTuple(Tuple expr);
        R visitCall(Call expr);
        R visitLibCall(LibCall expr);
        R visitBinOp(BinOp expr);
        R visitUnaryOp(UnaryOp expr);
        R visitName(Name expr);
        R visitAttr(Attr expr);
        R visitSubscr(Subscr expr);
    }

    public enum ConstType { INT, FLOAT, STRING, BOOL, NONE }

    public enum BinOpType {
        ADD("+"), SUB("-"), MUL("*"), POW("**"), TRUE_DIV("/"), FLOOR_DIV("//"), MOD("%"),
        LT("<"), LTE("<="), EQ("=="), NEQ("!="),
        AND("and"), OR("or"), IS("is"), IS_NOT("is not"),
        IN("in"), NOT_IN("not in");

        private final String symbol;

        BinOpType(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public boolean isNumeric() {
            switch (this) {
                case ADD:
                case SUB:
                case MUL:
                case POW:
                case TRUE_DIV:
                case FLOOR_DIV:
                case MOD:
                case LT:
                case LTE:
                    return true;
                default:
                    return false;
            }
        }
    }

    public enum UnaryOpType { NOT, NEG }

    private abstract static class Base implements ExprNode {
        public final CodeSource source;

        Base(CodeSource source) {
            this.source = source;
        }

        @Override
        public CodeSource source() {
            return source;
        }
    }

    // -------------------------
    // Literals and structure
    // -------------------------

    public static final class Const extends Base {
        public final ConstType constType;
        // Double for INT/FLOAT, String, Boolean, or null for NONE
        public final Object value;

        public Const(ConstType constType, Object value, CodeSource source) {
            super(source);
            this.constType = constType;
            this.value = value;
        }

        public double numValue() {
            return ((Number) value).doubleValue();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public String toString() {
            if (constType == ConstType.NONE) return "None";
            if (constType == ConstType.STRING) return "\"" + value + "\"";
            return String.valueOf(value);
        }
    }

    /** Allocates a fresh empty object on the heap. */
    public static final class ObjectExpr extends Base {
        public ObjectExpr(CodeSource source) {
            super(source);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitObject(this);
        }

        @Override
        public String toString() {
            return "OBJECT";
        }
    }

    public static final class Tuple extends Base {
        public final List<ExprNode> values;

        public Tuple(List<ExprNode> values, CodeSource source) {
            super(source);
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public String toString() {
            return "(" + join(values) + ")";
        }
    }

    public static final class Call extends Base {
        public final ExprNode func;
        public final List<ExprNode> params;

        public Call(ExprNode func, List<ExprNode> params, CodeSource source) {
            super(source);
            this.func = func;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return func + "(" + join(params) + ")";
        }
    }

    /** One named argument of a library call. */
    public static final class LibParam {
        public final String name;
        public final ExprNode value;

        public LibParam(String name, ExprNode value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }

    /** Call into a named engine intrinsic. */
    public static final class LibCall extends Base {
        public final String name;
        public final List<LibParam> params;

        public LibCall(String name, List<LibParam> params, CodeSource source) {
            super(source);
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLibCall(this);
        }

        @Override
        public String toString() {
            return "LIBCALL(" + name + ", " + join(params) + ")";
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class BinOp extends Base {
        public final BinOpType op;
        public final ExprNode left;
        public final ExprNode right;

        public BinOp(BinOpType op, ExprNode left, ExprNode right, CodeSource source) {
            super(source);
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    public static final class UnaryOp extends Base {
        public final UnaryOpType op;
        public final ExprNode base;

        public UnaryOp(UnaryOpType op, ExprNode base, CodeSource source) {
            super(source);
            this.op = op;
            this.base = base;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public String toString() {
            return (op == UnaryOpType.NOT ? "not " : "-") + base;
        }
    }

    // -------------------------
    // Left-hand expressions
    // -------------------------

    public static final class Name extends Base {
        public final String ident;

        public Name(String ident, CodeSource source) {
            super(source);
            this.ident = ident;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitName(this);
        }

        @Override
        public String toString() {
            return ident;
        }
    }

    public static final class Attr extends Base {
        public final ExprNode left;
        public final String right;

        public Attr(ExprNode left, String right, CodeSource source) {
            super(source);
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAttr(this);
        }

        @Override
        public String toString() {
            return left + "." + right;
        }
    }

    public static final class Subscr extends Base {
        public final ExprNode left;
        public final ExprNode right;

        public Subscr(ExprNode left, ExprNode right, CodeSource source) {
            super(source);
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscr(this);
        }

        @Override
        public String toString() {
            return left + "[" + right + "]";
        }
    }

    private static String join(List<?> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
        return sb.toString();
    }
}
