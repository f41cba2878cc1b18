import com.shapetea.constraint.BroadcastResult;
import com.shapetea.constraint.Constraint;
import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.ConstraintType;
import com.shapetea.constraint.IdManager;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.NumRange;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ConstraintSetTest {

    private static ExpNum c(double v) {
        return ExpNum.fromConst(v, null);
    }

    private static Constraint lte(ConstraintSet cs, ExpNum l, ExpNum r) {
        return cs.genNumCompare(ConstraintType.LESS_THAN_OR_EQUAL, l, r, null);
    }

    private static Constraint lt(ConstraintSet cs, ExpNum l, ExpNum r) {
        return cs.genNumCompare(ConstraintType.LESS_THAN, l, r, null);
    }

    @Test
    public void guarantee_refines_symbol_range() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        assertEquals(NumRange.genTop(), cs.getCachedRange(x));

        cs = cs.guarantee(lte(cs, c(2), x));
        NumRange r = cs.getCachedRange(x);
        assertEquals(2.0, r.start);
        assertTrue(r.hasStart);
        assertEquals(Double.POSITIVE_INFINITY, r.end);

        NumRange shifted = cs.getCachedRange(ExpNum.bop(ExpNum.BopType.ADD, x, 3, null));
        assertEquals(5.0, shifted.start);
        assertTrue(cs.isValid());
        assertEquals(1, cs.getHardIds().size());
    }

    @Test
    public void check_immediate_is_three_valued() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        cs = cs.guarantee(lte(cs, c(2), x));

        assertEquals(Boolean.TRUE, cs.checkImmediate(lt(cs, c(1), x)));
        assertEquals(Boolean.FALSE, cs.checkImmediate(lt(cs, x, c(1))));
        assertNull(cs.checkImmediate(lt(cs, x, c(5))));
    }

    @Test
    public void linear_difference_decides_without_ranges() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum y = ExpNum.fromSymbol(cs.genSymInt("y", null));
        ExpNum y1 = ExpNum.bop(ExpNum.BopType.ADD, y, 1, null);
        assertEquals(Boolean.TRUE, cs.checkImmediate(lt(cs, y, y1)));
        assertEquals(Boolean.FALSE, cs.checkImmediate(cs.genEquality(ConstraintType.EQUAL, y, y1, null)));
    }

    @Test
    public void logic_short_circuits() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        Constraint undecided = lt(cs, x, c(5));
        Constraint no = lt(cs, c(3), c(1));
        Constraint yes = lt(cs, c(1), c(3));

        assertEquals(Boolean.FALSE, cs.checkImmediate(cs.genAnd(no, undecided, null)));
        assertEquals(Boolean.FALSE, cs.checkImmediate(cs.genAnd(undecided, no, null)));
        assertNull(cs.checkImmediate(cs.genAnd(yes, undecided, null)));
        assertEquals(Boolean.TRUE, cs.checkImmediate(cs.genOr(yes, undecided, null)));
        assertEquals(Boolean.TRUE, cs.checkImmediate(cs.genOr(undecided, yes, null)));
        assertNull(cs.checkImmediate(cs.genOr(no, undecided, null)));
        assertNull(cs.checkImmediate(cs.genNot(undecided, null)));
        assertEquals(Boolean.TRUE, cs.checkImmediate(cs.genNot(no, null)));
        assertEquals(Boolean.FALSE, cs.checkImmediate(cs.genFail("boom", null)));
    }

    @Test
    public void false_require_invalidates_but_is_kept() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        int before = cs.count();
        ConstraintSet bad = cs.require(lt(cs, c(3), c(1)));
        assertFalse(bad.isValid());
        assertEquals(before + 1, bad.count());
        assertEquals(1, bad.getSoftIds().size());
        assertTrue(cs.isValid());
    }

    @Test
    public void true_require_is_dropped() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ConstraintSet same = cs.require(lt(cs, c(1), c(3)));
        assertEquals(cs.count(), same.count());
        assertTrue(same.isValid());
    }

    @Test
    public void disabled_immediate_check_appends_everything() {
        ConstraintSet cs = ConstraintSet.create(new IdManager(), false);
        ConstraintSet after = cs.require(lt(cs, c(3), c(1))).require(lt(cs, c(1), c(3)));
        assertTrue(after.isValid());
        assertEquals(2, after.getSoftIds().size());
    }

    @Test
    public void path_constraints_are_tracked_separately() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        cs = cs.addIf(lt(cs, x, c(10)));
        assertEquals(1, cs.getPathIds().size());
        assertTrue(cs.getHardIds().isEmpty());
        assertEquals(Boolean.TRUE, cs.checkImmediate(lt(cs, x, c(11))));
    }

    @Test
    public void select_broadcastable_rules() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        ExpNum y = ExpNum.fromSymbol(cs.genSymInt("y", null));

        BroadcastResult one = cs.selectBroadcastable(c(1), x);
        assertTrue(one.isSelected());
        assertSame(x, one.dim);

        assertTrue(cs.selectBroadcastable(c(3), c(4)).isImpossible());
        assertTrue(cs.selectBroadcastable(c(3), c(3)).isSelected());
        assertTrue(cs.selectBroadcastable(x, x).isSelected());
        assertTrue(cs.selectBroadcastable(x, y).isUndecided());

        ConstraintSet big = cs.guarantee(lte(cs, c(5), x));
        assertTrue(big.selectBroadcastable(x, c(3)).isImpossible());
        assertTrue(big.selectBroadcastable(x, c(1)).isSelected());
    }

    @Test
    public void max_range_composes() {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        cs = cs.guarantee(lte(cs, c(-4), x)).guarantee(lte(cs, x, c(3)));
        NumRange r = cs.getCachedRange(ExpNum.max(Arrays.asList(c(0), x), null));
        assertEquals(NumRange.genClosed(0, 3), r);
    }

    @Test
    public void symbol_ids_are_shared_through_the_id_manager() {
        IdManager ids = new IdManager();
        ConstraintSet a = ConstraintSet.create(ids);
        ConstraintSet b = ConstraintSet.create(ids);
        int first = a.genSymInt("a", null).id;
        int second = b.genSymInt("b", null).id;
        assertTrue(second > first);
        assertEquals(second, ids.symIdMax());
    }
}
