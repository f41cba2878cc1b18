package com.shapetea.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.shapetea.ir.Expr.ExprNode;
import com.shapetea.ir.Statement.Stmt;

/**
 * Terse builders for IR trees without position information. Frontends that track sources
 * construct the node classes directly.
 */
public final class Ir {

    private Ir() {}

    // ===================== EXPRESSIONS =====================

    public static Expr.Const intConst(long value) {
        return new Expr.Const(Expr.ConstType.INT, (double) value, null);
    }

    public static Expr.Const floatConst(double value) {
        return new Expr.Const(Expr.ConstType.FLOAT, value, null);
    }

    public static Expr.Const str(String value) {
        return new Expr.Const(Expr.ConstType.STRING, value, null);
    }

    public static Expr.Const bool(boolean value) {
        return new Expr.Const(Expr.ConstType.BOOL, value, null);
    }

    public static Expr.Const none() {
        return new Expr.Const(Expr.ConstType.NONE, null, null);
    }

    public static Expr.ObjectExpr object() {
        return new Expr.ObjectExpr(null);
    }

    public static Expr.Tuple tuple(ExprNode... values) {
        return new Expr.Tuple(Arrays.asList(values), null);
    }

    public static Expr.Name name(String ident) {
        return new Expr.Name(ident, null);
    }

    public static Expr.Attr attr(ExprNode left, String right) {
        return new Expr.Attr(left, right, null);
    }

    public static Expr.Subscr subscr(ExprNode left, ExprNode right) {
        return new Expr.Subscr(left, right, null);
    }

    public static Expr.Call call(ExprNode func, ExprNode... params) {
        return new Expr.Call(func, Arrays.asList(params), null);
    }

    public static Expr.LibParam param(String name, ExprNode value) {
        return new Expr.LibParam(name, value);
    }

    public static Expr.LibCall libCall(String name, Expr.LibParam... params) {
        return new Expr.LibCall(name, Arrays.asList(params), null);
    }

    public static Expr.BinOp binOp(Expr.BinOpType op, ExprNode left, ExprNode right) {
        return new Expr.BinOp(op, left, right, null);
    }

    public static Expr.BinOp add(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.ADD, left, right); }
    public static Expr.BinOp sub(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.SUB, left, right); }
    public static Expr.BinOp mul(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.MUL, left, right); }
    public static Expr.BinOp lt(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.LT, left, right); }
    public static Expr.BinOp lte(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.LTE, left, right); }
    public static Expr.BinOp eq(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.EQ, left, right); }
    public static Expr.BinOp and(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.AND, left, right); }
    public static Expr.BinOp or(ExprNode left, ExprNode right) { return binOp(Expr.BinOpType.OR, left, right); }

    public static Expr.UnaryOp not(ExprNode base) {
        return new Expr.UnaryOp(Expr.UnaryOpType.NOT, base, null);
    }

    public static Expr.UnaryOp neg(ExprNode base) {
        return new Expr.UnaryOp(Expr.UnaryOpType.NEG, base, null);
    }

    // ===================== STATEMENTS =====================

    public static Statement.Pass pass() {
        return Statement.Pass.INSTANCE;
    }

    public static Statement.ExprStmt expr(ExprNode expr) {
        return new Statement.ExprStmt(expr);
    }

    /** Right-nested sequence of the given statements; a single statement is returned as is. */
    public static Stmt seq(Stmt... stmts) {
        return seq(Arrays.asList(stmts));
    }

    public static Stmt seq(List<Stmt> stmts) {
        if (stmts.isEmpty()) return pass();
        List<Stmt> list = new ArrayList<>(stmts);
        Stmt tail = list.get(list.size() - 1);
        for (int i = list.size() - 2; i >= 0; i--) {
            tail = new Statement.Seq(list.get(i), tail, null);
        }
        return tail;
    }

    public static Statement.Assign assign(ExprNode left, ExprNode right) {
        return new Statement.Assign(left, right, null);
    }

    public static Statement.Assign assign(String name, ExprNode right) {
        return assign(name(name), right);
    }

    public static Statement.If ifThen(ExprNode cond, Stmt thenStmt, Stmt elseStmt) {
        return new Statement.If(cond, thenStmt, elseStmt, null);
    }

    public static Statement.ForIn forIn(String ident, ExprNode loopVal, Stmt body) {
        return new Statement.ForIn(ident, loopVal, body, null);
    }

    public static Statement.Return ret(ExprNode expr) {
        return new Statement.Return(expr, null);
    }

    public static Statement.Continue cont() {
        return new Statement.Continue(null);
    }

    public static Statement.Break brk() {
        return new Statement.Break(null);
    }

    public static Statement.Let let(String name, ExprNode expr, Stmt scope) {
        return new Statement.Let(name, expr, scope, null);
    }

    public static Statement.FunDef funDef(String name, List<String> params, Stmt body, Stmt scope) {
        return new Statement.FunDef(name, params, body, scope, null);
    }
}
