package com.shapetea.symbolic;

/**
 * Conservative numeric interval.
 *
 * Bounds may be infinite; hasStart / hasEnd tell whether the bound itself is included.
 * Instances are immutable. Every operation that cannot decide returns {@code null}
 * (comparisons) or a wider range (arithmetic), never a narrower one.
 */
public final class NumRange {

    public final double start;
    public final double end;
    /** is start inclusive? */
    public final boolean hasStart;
    /** is end inclusive? */
    public final boolean hasEnd;

    public NumRange(double start, double end, boolean hasStart, boolean hasEnd) {
        // -0.0 and 0.0 must behave as the same bound
        this.start = start + 0.0;
        this.end = end + 0.0;
        this.hasStart = hasStart;
        this.hasEnd = hasEnd;
    }

    // ===================== FACTORIES =====================

    public static NumRange fromConst(double num) { return new NumRange(num, num, true, true); }
    public static NumRange genClosed(double start, double end) { return new NumRange(start, end, true, true); }
    public static NumRange genTop() { return new NumRange(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false, false); }
    public static NumRange genFalse() { return new NumRange(1, -1, true, true); }
    public static NumRange genLt(double num) { return new NumRange(Double.NEGATIVE_INFINITY, num, false, false); }
    public static NumRange genLte(double num) { return new NumRange(Double.NEGATIVE_INFINITY, num, false, true); }
    public static NumRange genGt(double num) { return new NumRange(num, Double.POSITIVE_INFINITY, false, false); }
    public static NumRange genGte(double num) { return new NumRange(num, Double.POSITIVE_INFINITY, true, false); }

    // ===================== QUERIES =====================

    public boolean valid() {
        if (start == end) return hasStart && hasEnd;
        return start < end;
    }

    public boolean isConst() {
        return start == end && hasStart && hasEnd;
    }

    /** false does not mean falsy. */
    public boolean isTruthy() {
        return Boolean.TRUE.equals(gt(0)) || Boolean.TRUE.equals(lt(0));
    }

    /** false does not mean truthy. */
    public boolean isFalsy() {
        return isConst() && start == 0;
    }

    /** Tightest integer range inside this one, or null if there is none. */
    public NumRange toIntRange() {
        if (!valid()) return null;

        double s = start;
        double e = end;

        if (s != Double.NEGATIVE_INFINITY) {
            if (isInteger(s)) {
                s = hasStart ? s : s + 1;
            } else {
                s = Math.floor(s) + 1;
            }
        }

        if (e != Double.POSITIVE_INFINITY) {
            if (isInteger(e)) {
                e = hasEnd ? e : e - 1;
            } else {
                e = Math.floor(e);
            }
        }

        NumRange range = new NumRange(s, e, s != Double.NEGATIVE_INFINITY, e != Double.POSITIVE_INFINITY);
        return range.valid() ? range : null;
    }

    public boolean contains(double num) {
        if (!valid()) return false;
        if (start <= num && num <= end) {
            if (start == num) return hasStart;
            if (end == num) return hasEnd;
            return true;
        }
        return false;
    }

    // ===================== COMPARISONS =====================
    // null: cannot decide

    public Boolean lt(double num) {
        if (!valid()) return null;
        if (isConst()) return start < num;
        if (end < num) return true;
        if (end == num) return hasEnd ? null : Boolean.TRUE;
        if (start >= num) return false;
        return null;
    }

    public Boolean lte(double num) {
        if (!valid()) return null;
        if (isConst()) return start <= num;
        if (end <= num) return true;
        if (start > num) return false;
        if (start == num) return hasStart ? null : Boolean.FALSE;
        return null;
    }

    public Boolean gt(double num) {
        if (!valid()) return null;
        if (isConst()) return start > num;
        if (end <= num) return false;
        if (start > num) return true;
        if (start == num) return hasStart ? null : Boolean.TRUE;
        return null;
    }

    public Boolean gte(double num) {
        if (!valid()) return null;
        if (isConst()) return start >= num;
        if (end < num) return false;
        if (end == num) return hasEnd ? null : Boolean.FALSE;
        if (start >= num) return true;
        return null;
    }

    public Boolean eq(double num) {
        if (!isConst()) return null;
        return start == num;
    }

    public Boolean ltRange(NumRange that) {
        if (!valid() || !that.valid()) return null;
        if (end < that.start) return true;
        if (end == that.start && !(hasEnd && that.hasStart)) return true;
        if (that.end <= start) return false;
        return null;
    }

    public Boolean lteRange(NumRange that) {
        if (!valid() || !that.valid()) return null;
        if (end <= that.start) return true;
        if (that.end < start) return false;
        if (that.end == start && !(that.hasEnd && hasStart)) return false;
        return null;
    }

    public Boolean gtRange(NumRange that) {
        return that.ltRange(this);
    }

    public Boolean gteRange(NumRange that) {
        return that.lteRange(this);
    }

    // ===================== SET OPERATIONS =====================

    public NumRange intersect(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        double s;
        double e;
        boolean hs;
        boolean he;

        if (start == that.start) {
            s = start;
            hs = hasStart && that.hasStart;
        } else if (start < that.start) {
            s = that.start;
            hs = that.hasStart;
        } else {
            s = start;
            hs = hasStart;
        }

        if (end == that.end) {
            e = end;
            he = hasEnd && that.hasEnd;
        } else if (end < that.end) {
            e = end;
            he = hasEnd;
        } else {
            e = that.end;
            he = that.hasEnd;
        }

        return new NumRange(s, e, hs, he);
    }

    public NumRange union(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        double s;
        double e;
        boolean hs;
        boolean he;

        if (start == that.start) {
            s = start;
            hs = hasStart || that.hasStart;
        } else if (start < that.start) {
            s = start;
            hs = hasStart;
        } else {
            s = that.start;
            hs = that.hasStart;
        }

        if (end == that.end) {
            e = end;
            he = hasEnd || that.hasEnd;
        } else if (end < that.end) {
            e = that.end;
            he = that.hasEnd;
        } else {
            e = end;
            he = hasEnd;
        }

        return new NumRange(s, e, hs, he);
    }

    // ===================== ARITHMETIC =====================

    public NumRange neg() {
        if (!valid()) return this;
        return new NumRange(-end, -start, hasEnd, hasStart);
    }

    public NumRange abs() {
        if (!valid()) return this;
        if (start > 0) return this;
        if (end <= 0) return neg();
        if (-start < end) {
            return new NumRange(0, end, true, hasEnd);
        } else if (-start == end) {
            return new NumRange(0, end, true, hasEnd || hasStart);
        } else {
            return new NumRange(0, -start, true, hasStart);
        }
    }

    public NumRange ceil() {
        if (!valid()) return null;

        double s;
        boolean hs = true;
        double e;
        boolean he = true;

        if (start == Double.NEGATIVE_INFINITY) {
            s = start;
            hs = false;
        } else if (isInteger(start)) {
            s = hasStart ? start : start + 1;
        } else {
            s = Math.ceil(start);
        }

        if (end == Double.POSITIVE_INFINITY) {
            e = end;
            he = false;
        } else {
            e = Math.ceil(end);
        }

        return new NumRange(s, e, hs, he);
    }

    public NumRange floor() {
        if (!valid()) return null;

        double s;
        boolean hs = true;
        double e;
        boolean he = true;

        if (start == Double.NEGATIVE_INFINITY) {
            s = start;
            hs = false;
        } else {
            s = Math.floor(start);
        }

        if (end == Double.POSITIVE_INFINITY) {
            e = end;
            he = false;
        } else if (isInteger(end)) {
            e = hasEnd ? end : end - 1;
        } else {
            e = Math.floor(end);
        }

        return new NumRange(s, e, hs, he);
    }

    public NumRange add(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;
        return new NumRange(start + that.start, end + that.end, hasStart && that.hasStart, hasEnd && that.hasEnd);
    }

    public NumRange sub(NumRange that) {
        return add(that.neg());
    }

    public NumRange mul(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        if (isConst()) return scale(start, that);
        if (that.isConst()) return scale(that.start, this);

        double a = start * that.start;
        double b = start * that.end;
        double c = end * that.start;
        double d = end * that.end;

        // 0 * inf must not become NaN
        if (start == 0) {
            a = 0;
            b = 0;
        }
        if (that.start == 0) {
            a = 0;
            c = 0;
        }
        if (end == 0) {
            c = 0;
            d = 0;
        }
        if (that.end == 0) {
            b = 0;
            d = 0;
        }

        int minPos = min4(a, b, c, d);
        int maxPos = max4(a, b, c, d);
        return new NumRange(
                pick(minPos, a, b, c, d, Double.POSITIVE_INFINITY),
                pick(maxPos, a, b, c, d, Double.NEGATIVE_INFINITY),
                flagByPos(minPos, this, that),
                flagByPos(maxPos, this, that));
    }

    public NumRange truediv(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        if (isConst() && that.isConst()) {
            if (that.start == 0) return genTop();
            return fromConst(start / that.start);
        }

        if (that.contains(0)) return genTop();

        double a = start / that.start;
        double b = start / that.end;
        double c = end / that.start;
        double d = end / that.end;

        return cornerRange(a, b, c, d, that, false);
    }

    public NumRange floordiv(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        if (isConst() && that.isConst()) {
            if (that.start == 0) return genTop();
            return fromConst(Math.floor(start / that.start));
        }

        if (that.contains(0)) return genTop();

        double a = Math.floor(start / that.start);
        double b = Math.floor(start / that.end);
        double c = Math.floor(end / that.start);
        double d = Math.floor(end / that.end);

        return cornerRange(a, b, c, d, that, true);
    }

    public NumRange mod(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        if (isConst()) {
            if (that.isConst()) {
                if (that.start == 0) return genTop();
                return fromConst(pyMod(start, that.start));
            } else if (Boolean.TRUE.equals(that.gt(Math.abs(start))) && start >= 0) {
                return this;
            }
        }

        if (that.contains(0)) return genTop();

        double bound = Math.max(Math.abs(that.start), Math.abs(that.end));
        if (Boolean.TRUE.equals(that.gt(0))) {
            return new NumRange(0, bound, true, false);
        }
        if (Boolean.TRUE.equals(that.lt(0))) {
            return new NumRange(-bound, 0, false, true);
        }
        return new NumRange(-bound, bound, false, false);
    }

    public NumRange max(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        double s;
        double e;
        boolean hs;
        boolean he;

        if (start < that.start) {
            s = that.start;
            hs = that.hasStart;
        } else if (start == that.start) {
            s = start;
            hs = hasStart && that.hasStart;
        } else {
            s = start;
            hs = hasStart;
        }

        if (end < that.end) {
            e = that.end;
            he = that.hasEnd;
        } else if (end == that.end) {
            e = end;
            he = hasEnd || that.hasEnd;
        } else {
            e = end;
            he = hasEnd;
        }

        return new NumRange(s, e, hs, he);
    }

    public NumRange min(NumRange that) {
        if (!valid()) return this;
        if (!that.valid()) return that;

        double s;
        double e;
        boolean hs;
        boolean he;

        if (start < that.start) {
            s = start;
            hs = hasStart;
        } else if (start == that.start) {
            s = start;
            hs = hasStart || that.hasStart;
        } else {
            s = that.start;
            hs = that.hasStart;
        }

        if (end < that.end) {
            e = end;
            he = hasEnd;
        } else if (end == that.end) {
            e = end;
            he = hasEnd && that.hasEnd;
        } else {
            e = that.end;
            he = that.hasEnd;
        }

        return new NumRange(s, e, hs, he);
    }

    // ===================== HELPERS =====================

    public static boolean isInteger(double v) {
        return !Double.isInfinite(v) && !Double.isNaN(v) && Math.floor(v) == v;
    }

    /** Python-style modulo: the result takes the sign of the divisor. */
    public static double pyMod(double a, double b) {
        double r = a % b;
        if (r != 0 && ((r < 0) != (b < 0))) r += b;
        return r + 0.0;
    }

    private static NumRange scale(double k, NumRange r) {
        if (k == 0) return fromConst(0);
        if (k > 0) return new NumRange(k * r.start, k * r.end, r.hasStart, r.hasEnd);
        return new NumRange(k * r.end, k * r.start, r.hasEnd, r.hasStart);
    }

    private NumRange cornerRange(double a, double b, double c, double d, NumRange that, boolean floored) {
        int minPos = min4(a, b, c, d);
        int maxPos = max4(a, b, c, d);
        double min = pick(minPos, a, b, c, d, Double.POSITIVE_INFINITY);
        double max = pick(maxPos, a, b, c, d, Double.NEGATIVE_INFINITY);

        // a floored corner is always reachable or bounds from outside, so keep it closed
        boolean hs = min != Double.NEGATIVE_INFINITY && (floored || flagByPos(minPos, this, that));
        boolean he = max != Double.POSITIVE_INFINITY && (floored || flagByPos(maxPos, this, that));
        return new NumRange(min, max, hs, he);
    }

    private static double nanTo(double v, double fallback) {
        return Double.isNaN(v) ? fallback : v;
    }

    private static double pick(int pos, double a, double b, double c, double d, double nanFallback) {
        switch (pos) {
            case 0: return nanTo(a, nanFallback);
            case 1: return nanTo(b, nanFallback);
            case 2: return nanTo(c, nanFallback);
            default: return nanTo(d, nanFallback);
        }
    }

    private static int min4(double a, double b, double c, double d) {
        a = nanTo(a, Double.POSITIVE_INFINITY);
        b = nanTo(b, Double.POSITIVE_INFINITY);
        c = nanTo(c, Double.POSITIVE_INFINITY);
        d = nanTo(d, Double.POSITIVE_INFINITY);
        int ab = a < b ? 0 : 1;
        int cd = c < d ? 2 : 3;
        double abv = ab == 0 ? a : b;
        double cdv = cd == 2 ? c : d;
        return abv < cdv ? ab : cd;
    }

    private static int max4(double a, double b, double c, double d) {
        a = nanTo(a, Double.NEGATIVE_INFINITY);
        b = nanTo(b, Double.NEGATIVE_INFINITY);
        c = nanTo(c, Double.NEGATIVE_INFINITY);
        d = nanTo(d, Double.NEGATIVE_INFINITY);
        int ab = a > b ? 0 : 1;
        int cd = c > d ? 2 : 3;
        double abv = ab == 0 ? a : b;
        double cdv = cd == 2 ? c : d;
        return abv > cdv ? ab : cd;
    }

    // pos 0 -> (this.start, that.start), 1 -> (this.start, that.end),
    // pos 2 -> (this.end, that.start), 3 -> (this.end, that.end)
    private static boolean flagByPos(int pos, NumRange left, NumRange right) {
        switch (pos) {
            case 0: return left.hasStart && right.hasStart;
            case 1: return left.hasStart && right.hasEnd;
            case 2: return left.hasEnd && right.hasStart;
            default: return left.hasEnd && right.hasEnd;
        }
    }

    public static String formatNum(double v) {
        if (isInteger(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumRange)) return false;
        NumRange r = (NumRange) o;
        return start == r.start && end == r.end && hasStart == r.hasStart && hasEnd == r.hasEnd;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(start);
        h = 31 * h + Double.hashCode(end);
        h = 31 * h + (hasStart ? 1 : 0);
        return 31 * h + (hasEnd ? 1 : 0);
    }

    @Override
    public String toString() {
        return (hasStart ? "[" : "(") + formatNum(start) + ", " + formatNum(end) + (hasEnd ? "]" : ")");
    }
}
