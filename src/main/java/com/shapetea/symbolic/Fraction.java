package com.shapetea.symbolic;

/**
 * Exact-ish rational coefficient used by the linear normaliser.
 * Numerator and denominator are doubles so non-integer constants still pass through;
 * gcd reduction only applies when both parts are integral.
 */
public final class Fraction {

    public static final Fraction ZERO = new Fraction(0, 1);
    public static final Fraction ONE = new Fraction(1, 1);

    public final double up;
    public final double down;

    public Fraction(double up, double down) {
        this.up = up;
        this.down = down;
    }

    public static Fraction of(double value) {
        return new Fraction(value, 1);
    }

    static double gcd(double a, double b) {
        if (a == 0 || b == 0) return 1;
        if (!NumRange.isInteger(a) || !NumRange.isInteger(b)) return 1;
        a = Math.abs(a);
        b = Math.abs(b);
        while (a != 0 && b != 0) {
            double tmp = a % b;
            a = b;
            b = tmp;
        }
        return a == 0 ? b : a;
    }

    public Fraction add(Fraction that) {
        return new Fraction(up * that.down + down * that.up, down * that.down);
    }

    public Fraction addN(double n) {
        return new Fraction(up + n * down, down);
    }

    public Fraction sub(Fraction that) {
        return new Fraction(up * that.down - down * that.up, down * that.down);
    }

    public Fraction subN(double n) {
        return new Fraction(up - n * down, down);
    }

    public Fraction mul(Fraction that) {
        return new Fraction(up * that.up, down * that.down);
    }

    public Fraction mulN(double n) {
        return new Fraction(up * n, down);
    }

    public Fraction div(Fraction that) {
        if (that.up == 0) {
            return new Fraction(up * that.down * down >= 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY, 1);
        }
        return new Fraction(up * that.down, down * that.up);
    }

    public Fraction divN(double n) {
        if (n == 0) {
            return new Fraction(up * down >= 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY, 1);
        }
        if (NumRange.isInteger(n)) {
            return new Fraction(up, n * down);
        }
        return new Fraction(up / n, down);
    }

    public Fraction floor() {
        return new Fraction(Math.floor(up / down) * down, down);
    }

    public Fraction neg() {
        return new Fraction(-up, down);
    }

    public boolean isZero() {
        return up == 0;
    }

    public double toNum() {
        return up / down;
    }

    /** Sign moved to the numerator, common factors removed. */
    public Fraction norm() {
        double g = gcd(up, down);
        double u = up;
        double d = down;
        if (d < 0) {
            u = -u;
            d = -d;
        }
        return new Fraction(u / g + 0.0, d / g);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fraction)) return false;
        Fraction a = norm();
        Fraction b = ((Fraction) o).norm();
        return a.up == b.up && a.down == b.down;
    }

    @Override
    public int hashCode() {
        Fraction n = norm();
        return Double.hashCode(n.up) * 31 + Double.hashCode(n.down);
    }

    @Override
    public String toString() {
        return NumRange.formatNum(up) + "/" + NumRange.formatNum(down);
    }
}
