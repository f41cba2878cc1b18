package com.shapetea.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.shapetea.ir.Expr.ExprNode;

public class Statement {

    public interface Stmt {
        CodeSource source();

        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitPass(Pass stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitSeq(Seq stmt);
        R visitAssign(Assign stmt);
        R visitIf(If stmt);
        R visitForIn(ForIn stmt);
        R visitReturn(Return stmt);
        R visitContinue(Continue stmt);
        R visitBreak(Break stmt);
        R visitLet(Let stmt);
        R visitFunDef(FunDef stmt);
    }

    private abstract static class Base implements Stmt {
        public final CodeSource source;

        Base(CodeSource source) {
            this.source = source;
        }

        @Override
        public CodeSource source() {
            return source;
        }
    }

    public static final class Pass extends Base {
        public static final Pass INSTANCE = new Pass(null);

        public Pass(CodeSource source) { super(source); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPass(this); }

        @Override public String toString() { return "pass"; }
    }

    public static final class ExprStmt extends Base {
        public final ExprNode expr;

        public ExprStmt(ExprNode expr) {
            super(expr.source());
            this.expr = expr;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }

        @Override public String toString() { return expr.toString(); }
    }

    public static final class Seq extends Base {
        public final Stmt left;
        public final Stmt right;

        public Seq(Stmt left, Stmt right, CodeSource source) {
            super(source);
            this.left = left;
            this.right = right;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSeq(this); }

        @Override public String toString() { return left + ";\n" + right; }
    }

    /** {@code left} is a Name, Attr or Subscr expression. */
    public static final class Assign extends Base {
        public final ExprNode left;
        public final ExprNode right;

        public Assign(ExprNode left, ExprNode right, CodeSource source) {
            super(source);
            this.left = left;
            this.right = right;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssign(this); }

        @Override public String toString() { return left + " = " + right; }
    }

    public static final class If extends Base {
        public final ExprNode cond;
        public final Stmt thenStmt;
        public final Stmt elseStmt;

        public If(ExprNode cond, Stmt thenStmt, Stmt elseStmt, CodeSource source) {
            super(source);
            this.cond = cond;
            this.thenStmt = thenStmt;
            this.elseStmt = elseStmt;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIf(this); }

        @Override
        public String toString() {
            return "if " + cond + " then {\n" + thenStmt + "\n} else {\n" + elseStmt + "\n}";
        }
    }

    public static final class ForIn extends Base {
        public final String ident;
        public final ExprNode loopVal;
        public final Stmt loopBody;

        public ForIn(String ident, ExprNode loopVal, Stmt loopBody, CodeSource source) {
            super(source);
            this.ident = ident;
            this.loopVal = loopVal;
            this.loopBody = loopBody;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForIn(this); }

        @Override public String toString() { return "for " + ident + " in " + loopVal + " {\n" + loopBody + "\n}"; }
    }

    public static final class Return extends Base {
        public final ExprNode expr;

        public Return(ExprNode expr, CodeSource source) {
            super(source);
            this.expr = expr;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturn(this); }

        @Override public String toString() { return "return " + expr; }
    }

    public static final class Continue extends Base {
        public Continue(CodeSource source) { super(source); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinue(this); }

        @Override public String toString() { return "continue"; }
    }

    public static final class Break extends Base {
        public Break(CodeSource source) { super(source); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreak(this); }

        @Override public String toString() { return "break"; }
    }

    /** Binds {@code name} for the duration of {@code scope}; {@code expr} may be null (undefined). */
    public static final class Let extends Base {
        public final String name;
        public final ExprNode expr;
        public final Stmt scope;

        public Let(String name, ExprNode expr, Stmt scope, CodeSource source) {
            super(source);
            this.name = name;
            this.expr = expr;
            this.scope = scope;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLet(this); }

        @Override
        public String toString() {
            return name + " := " + (expr == null ? "undef" : expr.toString()) + " in\n" + scope;
        }
    }

    public static final class FunDef extends Base {
        public final String name;
        public final List<String> params;
        public final Stmt body;
        public final Stmt scope;
        public final boolean hasClosure;

        public FunDef(String name, List<String> params, Stmt body, Stmt scope, CodeSource source) {
            super(source);
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.body = body;
            this.scope = scope;
            this.hasClosure = findClosure(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunDef(this); }

        /** True when {@code stmt} defines a nested function anywhere outside of expressions. */
        public static boolean findClosure(Stmt stmt) {
            if (stmt instanceof FunDef) {
                return true;
            } else if (stmt instanceof Seq) {
                Seq s = (Seq) stmt;
                return findClosure(s.left) || findClosure(s.right);
            } else if (stmt instanceof Let) {
                return findClosure(((Let) stmt).scope);
            } else if (stmt instanceof If) {
                If s = (If) stmt;
                return findClosure(s.thenStmt) || findClosure(s.elseStmt);
            } else if (stmt instanceof ForIn) {
                return findClosure(((ForIn) stmt).loopBody);
            }
            return false;
        }

        @Override
        public String toString() {
            return "def " + name + "(" + String.join(", ", params) + ") {\n" + body + "\n}\n" + scope;
        }
    }
}
