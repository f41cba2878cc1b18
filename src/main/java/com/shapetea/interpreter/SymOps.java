package com.shapetea.interpreter;

import com.shapetea.constraint.Constraint;
import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.ConstraintType;
import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.Context;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVBool;
import com.shapetea.context.ShValue.SVError;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVString;
import com.shapetea.ir.CodeSource;
import com.shapetea.ir.Expr.BinOpType;
import com.shapetea.ir.Expr.UnaryOpType;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpString;
import com.shapetea.symbolic.NumRange;

/**
 * Operator semantics over symbolic primitive values.
 *
 * Numeric helpers expect booleans to be cast to integers beforehand, see
 * {@link ConstraintSet#castBoolToInt}.
 */
public final class SymOps {

    private SymOps() {}

    // ===================== TRUTHINESS =====================

    /** Either a decided truth value or the constraint that holds exactly when the value is truthy. */
    public static final class Truthiness {
        public final Boolean decided;
        public final Constraint constraint;

        private Truthiness(Boolean decided, Constraint constraint) {
            this.decided = decided;
            this.constraint = constraint;
        }

        static Truthiness of(boolean value) {
            return new Truthiness(value, null);
        }

        static Truthiness unknown(Constraint constraint) {
            return new Truthiness(null, constraint);
        }

        public boolean isDecided() {
            return decided != null;
        }

        @Override
        public String toString() {
            return decided != null ? decided.toString() : String.valueOf(constraint);
        }
    }

    public static Truthiness isTruthy(Context<?> ctx, ShValue value, CodeSource source) {
        ConstraintSet ctrSet = ctx.ctrSet;
        switch (value.type()) {
            case ADDR: {
                ShValue obj = ctx.heap.getValRecur((SVAddr) value);
                if (obj == null) return Truthiness.of(false);
                return isTruthy(ctx, obj, source);
            }
            case BOOL: {
                ExpBool exp = ((SVBool) value).value;
                ExpBool simpl = ExpSimplifier.simplifyBool(ctrSet, exp);
                if (simpl instanceof ExpBool.Const) {
                    return Truthiness.of(((ExpBool.Const) simpl).value);
                }
                Boolean checked = ctrSet.checkImmediate(simpl);
                if (checked != null) return Truthiness.of(checked);
                return Truthiness.unknown(ctrSet.genFromBool(exp, source));
            }
            case INT:
            case FLOAT: {
                ExpNum num = value instanceof SVInt ? ((SVInt) value).value : ((SVFloat) value).value;
                if (num.isConst()) return Truthiness.of(num.constValue() != 0);
                NumRange range = ctrSet.getCachedRange(num);
                if (range != null) {
                    if (range.isTruthy()) return Truthiness.of(true);
                    if (range.isFalsy()) return Truthiness.of(false);
                }
                return Truthiness.unknown(
                        ctrSet.genEquality(ConstraintType.NOT_EQUAL, num, ExpNum.fromConst(0, source), source));
            }
            case OBJECT:
            case SIZE: {
                ShValue length = ((ObjectLike) value).getAttr("$length");
                if (length != null) return isTruthy(ctx, length, source);
                return Truthiness.of(true);
            }
            case STRING: {
                SVString str = (SVString) value;
                if (str.isConst()) return Truthiness.of(!str.constValue().isEmpty());
                return Truthiness.unknown(ctrSet.genEquality(ConstraintType.NOT_EQUAL, str.value,
                        ExpString.fromConst("", source), source));
            }
            case NONE:
            case UNDEF:
                return Truthiness.of(false);
            default:
                return Truthiness.of(true);
        }
    }

    // ===================== NUMERIC =====================

    public static boolean isNumeric(ShValue value) {
        return value != null && value.isNumeric();
    }

    public static boolean isConstant(ShValue value) {
        if (value instanceof SVInt) return ((SVInt) value).isConst();
        if (value instanceof SVFloat) return ((SVFloat) value).isConst();
        if (value instanceof SVBool) return ((SVBool) value).isConst();
        if (value instanceof SVString) return ((SVString) value).isConst();
        return false;
    }

    static double literal(ShValue value) {
        if (value instanceof SVBool) return ((SVBool) value).constValue() ? 1 : 0;
        if (value instanceof SVInt) return ((SVInt) value).constValue();
        return ((SVFloat) value).constValue();
    }

    static ExpNum numExp(ShValue value) {
        if (value instanceof SVInt) return ((SVInt) value).value;
        return ((SVFloat) value).value;
    }

    /** Bool < Int < Float; anything else has no numeric upper bound. */
    static ShValue.Type upperBound(ShValue.Type left, ShValue.Type right) {
        if (left == ShValue.Type.FLOAT || right == ShValue.Type.FLOAT) return ShValue.Type.FLOAT;
        if (left == ShValue.Type.INT || right == ShValue.Type.INT) return ShValue.Type.INT;
        return ShValue.Type.BOOL;
    }

    private static ShValue numResult(ShValue.Type type, double value, CodeSource source) {
        if (type == ShValue.Type.FLOAT) return SVFloat.of(value, source);
        return SVInt.of(value, source);
    }

    private static ShValue numResult(ShValue.Type type, ExpNum value, CodeSource source) {
        if (type == ShValue.Type.FLOAT) return SVFloat.of(value, source);
        return SVInt.of(value, source);
    }

    /** Both operands are constants. Division follows Python: floor division and modulo round toward -inf. */
    public static ShValue binOpLiteral(ShValue left, ShValue right, BinOpType bop, CodeSource source) {
        double l = literal(left);
        double r = literal(right);
        // arithmetic on bools yields int
        ShValue.Type arith = upperBound(upperBound(left.type(), right.type()), ShValue.Type.INT);

        switch (bop) {
            case ADD:
                return numResult(arith, l + r, source);
            case SUB:
                return numResult(arith, l - r, source);
            case MUL:
                return numResult(arith, l * r, source);
            case POW:
                if (arith == ShValue.Type.INT && r < 0) {
                    return SVFloat.of(Math.pow(l, r), source);
                }
                return numResult(arith, Math.pow(l, r), source);
            case TRUE_DIV:
                if (r == 0) return SVError.error("ZeroDivisionError: division by zero", source);
                return SVFloat.of(l / r, source);
            case FLOOR_DIV:
                if (r == 0) return SVError.error("ZeroDivisionError: integer division or modulo by zero", source);
                return numResult(arith, Math.floor(l / r), source);
            case MOD:
                if (r == 0) return SVError.error("ZeroDivisionError: integer division or modulo by zero", source);
                return numResult(arith, l - r * Math.floor(l / r), source);
            case LT:
                return SVBool.of(l < r, source);
            case LTE:
                return SVBool.of(l <= r, source);
            case EQ:
                return SVBool.of(l == r, source);
            case NEQ:
                return SVBool.of(l != r, source);
            case IS:
                return SVBool.of(left.type() == right.type() && l == r, source);
            case IS_NOT:
                return SVBool.of(left.type() != right.type() || l != r, source);
            default:
                return SVError.warn("value is not iterable", source);
        }
    }

    /**
     * Operands are Int or Float (bools already cast). Pow is not handled here, see
     * {@link #powUnrolled}.
     */
    public static ShValue binOpNum(ShValue left, ShValue right, BinOpType bop, CodeSource source) {
        if (isConstant(left) && isConstant(right)) {
            return binOpLiteral(left, right, bop, source);
        }

        ExpNum l = numExp(left);
        ExpNum r = numExp(right);
        ShValue.Type arith = upperBound(upperBound(left.type(), right.type()), ShValue.Type.INT);

        switch (bop) {
            case ADD:
                return numResult(arith, ExpNum.bop(ExpNum.BopType.ADD, l, r, source), source);
            case SUB:
                return numResult(arith, ExpNum.bop(ExpNum.BopType.SUB, l, r, source), source);
            case MUL:
                return numResult(arith, ExpNum.bop(ExpNum.BopType.MUL, l, r, source), source);
            case FLOOR_DIV:
                return numResult(arith, ExpNum.bop(ExpNum.BopType.FLOORDIV, l, r, source), source);
            case TRUE_DIV:
                return SVFloat.of(ExpNum.bop(ExpNum.BopType.TRUEDIV, l, r, source), source);
            case MOD:
                return numResult(arith, ExpNum.bop(ExpNum.BopType.MOD, l, r, source), source);
            case LT:
                return SVBool.of(ExpBool.lt(l, r, source), source);
            case LTE:
                return SVBool.of(ExpBool.lte(l, r, source), source);
            case EQ:
                return SVBool.of(ExpBool.eq(l, r, source), source);
            case NEQ:
                return SVBool.of(ExpBool.neq(l, r, source), source);
            case IS:
                return SVBool.of(left.type() == right.type() ? ExpBool.eq(l, r, source)
                        : ExpBool.fromConst(false, source), source);
            case IS_NOT:
                return SVBool.of(left.type() == right.type() ? ExpBool.neq(l, r, source)
                        : ExpBool.fromConst(true, source), source);
            default:
                return SVError.warn("invalid operation for numeric values: got (" + bop.symbol() + ")", source);
        }
    }

    /**
     * {@code base ** exponent} as repeated multiplication when the exponent is a constant
     * non-negative integer. Returns null when the exponent is not such a constant.
     */
    public static ShValue powUnrolled(ConstraintSet ctrSet, ShValue base, ShValue exponent, CodeSource source) {
        NumRange expRange = ctrSet.getCachedRange(numExp(exponent));
        if (expRange == null || !expRange.isConst() || expRange.start < 0 || !NumRange.isInteger(expRange.start)) {
            return null;
        }
        int n = (int) expRange.start;
        ShValue.Type arith = upperBound(upperBound(base.type(), exponent.type()), ShValue.Type.INT);
        if (n == 0) {
            return numResult(arith, 1, source);
        }
        ExpNum b = numExp(base);
        ExpNum acc = b;
        for (int i = 1; i < n; i++) {
            acc = ExpNum.bop(ExpNum.BopType.MUL, acc, b, source);
        }
        return numResult(arith, ExpSimplifier.simplifyNum(ctrSet, acc), source);
    }

    // ===================== STRINGS =====================

    private static ShValue binOpStrLiteral(ConstraintSet ctrSet, String left, String right, BinOpType bop,
                                           CodeSource source) {
        switch (bop) {
            case ADD:
                return SVString.of(left + right, source);
            case LT:
                return SVBool.of(left.compareTo(right) < 0, source);
            case LTE:
                return SVBool.of(left.compareTo(right) <= 0, source);
            case EQ:
            case IS:
                return SVBool.of(left.equals(right), source);
            case NEQ:
            case IS_NOT:
                return SVBool.of(!left.equals(right), source);
            case IN:
                return SVBool.of(right.contains(left), source);
            case NOT_IN:
                return SVBool.of(!right.contains(left), source);
            case MOD:
                // formatting is not modelled
                return SVString.of(ExpString.fromSymbol(ctrSet.genSymString("str_format", source)), source);
            default:
                return null;
        }
    }

    /** String (op) string. Null when the operation is not supported on strings. */
    public static ShValue binOpStr(ConstraintSet ctrSet, SVString left, SVString right, BinOpType bop,
                                   CodeSource source) {
        if (left.isConst() && right.isConst()) {
            return binOpStrLiteral(ctrSet, left.constValue(), right.constValue(), bop, source);
        }

        switch (bop) {
            case ADD:
                return SVString.of(ExpString.concat(left.value, right.value, source), source);
            case EQ:
            case IS:
                return SVBool.of(ExpBool.eq(left.value, right.value, source), source);
            case NEQ:
            case IS_NOT:
                return SVBool.of(ExpBool.neq(left.value, right.value, source), source);
            case MOD:
                return SVString.of(ExpString.fromSymbol(ctrSet.genSymString("str_format", source)), source);
            case LT:
                return SVBool.of(ExpBool.fromSymbol(ctrSet.genSymBool("bop_lt", source)), source);
            case LTE:
                return SVBool.of(ExpBool.fromSymbol(ctrSet.genSymBool("bop_lte", source)), source);
            case IN:
            case NOT_IN:
                return SVBool.of(ExpBool.fromSymbol(ctrSet.genSymBool("bop_in", source)), source);
            default:
                return null;
        }
    }

    /** String (op) number, in either operand order. Null when unsupported. */
    public static ShValue binOpStrNum(ConstraintSet ctrSet, SVString str, ShValue num, BinOpType bop,
                                      CodeSource source) {
        switch (bop) {
            case MUL: {
                if (!(num instanceof SVInt)) return null;
                NumRange numRng = ctrSet.getCachedRange(((SVInt) num).value);
                if (numRng == null || !numRng.isConst() || numRng.start < 0) {
                    return SVString.of(ExpString.fromSymbol(ctrSet.genSymString("str_mul", source)), source);
                }
                int repeat = (int) numRng.start;
                if (str.isConst()) {
                    StringBuilder sb = new StringBuilder();
                    for (int i = 0; i < repeat; i++) sb.append(str.constValue());
                    return SVString.of(sb.toString(), source);
                }
                if (repeat == 0) return SVString.of("", source);
                ExpString acc = str.value;
                for (int i = 1; i < repeat; i++) {
                    acc = ExpString.concat(acc, str.value, source);
                }
                return SVString.of(acc, source);
            }
            case EQ:
            case IS:
                return SVBool.of(false, source);
            case NEQ:
            case IS_NOT:
                return SVBool.of(true, source);
            default:
                return null;
        }
    }

    // ===================== UNARY =====================

    /** NEG expects Int/Float or a constant Bool; NOT expects a Bool or a constant. */
    public static ShValue unaryOp(ShValue base, UnaryOpType uop, CodeSource source) {
        switch (uop) {
            case NEG:
                if (isConstant(base)) {
                    double v = literal(base);
                    return base instanceof SVFloat ? SVFloat.of(-v, source) : SVInt.of(-v, source);
                }
                if (base instanceof SVBool) {
                    return SVError.warn("do bool2int cast before calling unaryOp Neg", source);
                }
                ExpNum neg = ExpNum.uop(ExpNum.UopType.NEG, numExp(base), source);
                return base instanceof SVFloat ? SVFloat.of(neg, source) : SVInt.of(neg, source);
            case NOT:
            default:
                if (isConstant(base)) {
                    return SVBool.of(literal(base) == 0, source);
                }
                if (base instanceof SVBool) {
                    return SVBool.of(ExpBool.not(((SVBool) base).value, source), source);
                }
                return SVError.warn("do bool2int cast before calling unaryOp Not", source);
        }
    }

    // ===================== DUNDER =====================

    /** Method names tried on the left operand and, failing that, on the right operand. */
    public static String[] dunderNames(BinOpType bop) {
        switch (bop) {
            case ADD: return new String[] { "__add__", "__radd__" };
            case SUB: return new String[] { "__sub__", "__rsub__" };
            case MUL: return new String[] { "__mul__", "__rmul__" };
            case FLOOR_DIV: return new String[] { "__floordiv__", "__rfloordiv__" };
            case TRUE_DIV: return new String[] { "__truediv__", "__rtruediv__" };
            case MOD: return new String[] { "__mod__", "__rmod__" };
            case POW: return new String[] { "__pow__", "__rpow__" };
            case AND: return new String[] { "__and__", "__rand__" };
            case OR: return new String[] { "__or__", "__ror__" };
            case LT: return new String[] { "__lt__", "__gt__" };
            case LTE: return new String[] { "__le__", "__ge__" };
            case EQ:
            case IS:
                return new String[] { "__eq__", "__eq__" };
            case NEQ:
            case IS_NOT:
                return new String[] { "__ne__", "__ne__" };
            case IN:
            case NOT_IN:
            default:
                return new String[] { "__contains__", "__contains__" };
        }
    }
}
