import com.shapetea.symbolic.NumRange;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumRangeTest {

    @Test
    public void const_range_is_closed_point() {
        NumRange r = NumRange.fromConst(3);
        assertTrue(r.isConst());
        assertTrue(r.valid());
        assertFalse(NumRange.genGte(3).isConst());
        assertFalse(new NumRange(3, 3, true, false).isConst());
        assertFalse(new NumRange(3, 3, true, false).valid());
        assertFalse(NumRange.genFalse().valid());
    }

    @Test
    public void add_and_sub_keep_flags() {
        NumRange a = NumRange.genClosed(1, 2);
        NumRange b = new NumRange(3, 4, true, false);
        assertEquals(new NumRange(4, 6, true, false), a.add(b));
        assertEquals(new NumRange(-3, -1, false, true), a.sub(b));
    }

    @Test
    public void mul_picks_corner_extrema() {
        NumRange r = NumRange.genClosed(-1, 2).mul(NumRange.genClosed(3, 4));
        assertEquals(NumRange.genClosed(-4, 8), r);
    }

    @Test
    public void mul_by_const_zero_is_zero_even_for_unbounded() {
        NumRange r = NumRange.genTop().mul(NumRange.fromConst(0));
        assertEquals(NumRange.fromConst(0), r);
    }

    @Test
    public void mul_with_zero_bound_and_infinity_has_no_nan() {
        NumRange r = NumRange.genGte(0).mul(NumRange.genClosed(2, 3));
        assertFalse(Double.isNaN(r.start));
        assertFalse(Double.isNaN(r.end));
        assertEquals(0.0, r.start);
        assertTrue(r.hasStart);
        assertEquals(Double.POSITIVE_INFINITY, r.end);
    }

    @Test
    public void division_by_range_containing_zero_is_top() {
        NumRange top = NumRange.genTop();
        assertEquals(top, NumRange.genClosed(1, 2).truediv(NumRange.genClosed(-1, 1)));
        assertEquals(top, NumRange.genClosed(1, 2).floordiv(NumRange.genClosed(0, 1)));
        assertEquals(top, NumRange.genClosed(1, 2).mod(NumRange.genClosed(-2, 2)));
        assertEquals(top, NumRange.fromConst(5).truediv(NumRange.fromConst(0)));
    }

    @Test
    public void floordiv_and_mod_of_consts_follow_python() {
        assertEquals(NumRange.fromConst(-4), NumRange.fromConst(-7).floordiv(NumRange.fromConst(2)));
        assertEquals(NumRange.fromConst(1), NumRange.fromConst(-7).mod(NumRange.fromConst(2)));
        assertEquals(NumRange.fromConst(-1), NumRange.fromConst(7).mod(NumRange.fromConst(-2)));
    }

    @Test
    public void mod_by_positive_range_is_bounded_below_divisor() {
        NumRange r = NumRange.genGte(0).mod(NumRange.genClosed(2, 5));
        assertEquals(new NumRange(0, 5, true, false), r);
    }

    @Test
    public void to_int_range_rounds_inward() {
        assertEquals(NumRange.genClosed(1, 3), new NumRange(0.5, 3.5, true, true).toIntRange());
        assertEquals(NumRange.genClosed(1, 1), new NumRange(1, 2, true, false).toIntRange());
        assertEquals(NumRange.genClosed(2, 4), new NumRange(1, 5, false, false).toIntRange());
        assertNull(new NumRange(1, 2, false, false).toIntRange());
        assertNull(new NumRange(0.2, 0.8, true, true).toIntRange());
    }

    @Test
    public void to_int_range_keeps_infinite_bounds_open() {
        NumRange r = NumRange.genGt(0.5).toIntRange();
        assertEquals(1.0, r.start);
        assertTrue(r.hasStart);
        assertEquals(Double.POSITIVE_INFINITY, r.end);
        assertFalse(r.hasEnd);
    }

    @Test
    public void comparisons_are_three_valued() {
        NumRange r = NumRange.genClosed(0, 10);
        assertEquals(Boolean.TRUE, r.lt(11));
        assertNull(r.lt(10));
        assertEquals(Boolean.TRUE, r.lte(10));
        assertEquals(Boolean.FALSE, r.gt(10));
        assertEquals(Boolean.TRUE, r.gte(0));
        assertNull(r.gt(5));
        assertNull(r.eq(5));
        assertEquals(Boolean.TRUE, NumRange.fromConst(5).eq(5));
        assertEquals(Boolean.TRUE, new NumRange(0, 10, true, false).lt(10));
    }

    @Test
    public void intersect_and_union_compare_like_bounds() {
        NumRange a = new NumRange(0, 5, true, false);
        NumRange b = NumRange.genClosed(3, 8);
        assertEquals(new NumRange(3, 5, true, false), a.intersect(b));
        assertEquals(NumRange.genClosed(0, 8), a.union(b));
        assertEquals(NumRange.genClosed(5, 5), NumRange.genClosed(0, 5).intersect(NumRange.genClosed(5, 9)));
        assertFalse(a.intersect(NumRange.genClosed(6, 7)).valid());
    }

    @Test
    public void neg_swaps_bounds_and_flags() {
        assertEquals(new NumRange(-5, 2, false, true), new NumRange(-2, 5, true, false).neg());
    }

    @Test
    public void contains_respects_open_bounds() {
        NumRange r = new NumRange(0, 1, false, true);
        assertFalse(r.contains(0));
        assertTrue(r.contains(1));
        assertTrue(r.contains(0.5));
        assertFalse(r.contains(2));
    }

    @Test
    public void truthiness() {
        assertTrue(NumRange.genGt(0).isTruthy());
        assertTrue(NumRange.genLt(0).isTruthy());
        assertFalse(NumRange.genGte(0).isTruthy());
        assertTrue(NumRange.fromConst(0).isFalsy());
        assertFalse(NumRange.genGte(0).isFalsy());
    }

    @Test
    public void mul_of_point_by_open_range_keeps_open_flags() {
        NumRange r = NumRange.genClosed(2, 2).mul(new NumRange(1, 5, false, false));
        assertEquals(new NumRange(2, 10, false, false), r);
    }

    @Test
    public void double_negation_is_identity() {
        NumRange[] samples = {
                new NumRange(-2, 5, true, false),
                NumRange.genGt(3),
                NumRange.genLte(-1),
                NumRange.fromConst(0),
                NumRange.genTop()
        };
        for (NumRange a : samples) {
            assertEquals(a, a.neg().neg());
        }
    }

    @Test
    public void top_contains_every_finite_value() {
        NumRange top = NumRange.genTop();
        for (double x : new double[] {-1e12, -1, 0, 0.25, 7, 1e12}) {
            assertTrue(top.contains(x), "top should contain " + x);
        }
    }

    @Test
    public void to_int_range_is_idempotent() {
        NumRange[] samples = {
                new NumRange(0.5, 3.5, true, true),
                new NumRange(1, 5, false, false),
                NumRange.genGt(0.5),
                NumRange.genLt(-2.5),
                NumRange.genTop()
        };
        for (NumRange a : samples) {
            NumRange once = a.toIntRange();
            assertEquals(once, once.toIntRange());
        }
    }
}
