import com.shapetea.context.AnalysisSession;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.PathGovernor;
import com.shapetea.context.ShValue;
import com.shapetea.symbolic.ExpNum;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContextSetTest {

    private static Context<ShValue> root(AnalysisSession session) {
        return session.newContext("test.py");
    }

    private static ExpNum sym(Context<?> ctx, String name) {
        return ExpNum.fromSymbol(ctx.genSymInt(name, null));
    }

    @Test
    public void false_require_without_path_condition_fails() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ContextSet<ShValue> set = ctx.require(ctx.genLt(3, ExpNum.fromConst(1, null), null), "three is small", null);

        assertTrue(set.getList().isEmpty());
        assertEquals(1, set.getFailed().size());
        assertTrue(set.getStopped().isEmpty());
        Context<ShValue> dead = set.getFailed().get(0);
        assertTrue(dead.failed.reason.startsWith("three is small"));
        assertSame(dead.failed, dead.retVal);
        assertTrue(dead.failId > 0);
    }

    @Test
    public void failure_under_path_condition_is_stopped() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ExpNum x = sym(ctx, "x");
        ContextSet.Branches<ShValue> br = ctx.toSet().ifThenElse(ctx.genLt(x, 5, null), null);

        assertEquals(1, br.thenSet.getList().size());
        assertEquals(1, br.elseSet.getList().size());

        ContextSet<ShValue> dead = br.thenSet.fail("boom", null);
        assertTrue(dead.getList().isEmpty());
        assertTrue(dead.getFailed().isEmpty());
        assertEquals(1, dead.getStopped().size());
        assertTrue(dead.getStopped().get(0).hasPathCtr());
    }

    @Test
    public void decided_fork_drops_the_impossible_branch() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ContextSet.Branches<ShValue> br = ctx.toSet().ifThenElse(ctx.genLt(1, ExpNum.fromConst(3, null), null), null);
        assertEquals(1, br.thenSet.getList().size());
        assertTrue(br.elseSet.getList().isEmpty());
        assertTrue(br.elseSet.getFailed().isEmpty());
        assertTrue(br.elseSet.getStopped().isEmpty());
    }

    @Test
    public void fork_is_exhaustive_and_exclusive() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ExpNum x = sym(ctx, "x");
        Context<ShValue> bounded = ctx.guarantee(ctx.genLte(0, x, null)).guarantee(ctx.genLte(x, 9, null));
        ContextSet.Branches<ShValue> br = bounded.toSet().ifThenElse(bounded.genLt(x, 5, null), null);

        Context<ShValue> low = br.thenSet.getList().get(0);
        Context<ShValue> high = br.elseSet.getList().get(0);
        assertEquals(Boolean.TRUE, low.checkImmediate(low.genLt(x, 5, null)));
        assertEquals(Boolean.FALSE, low.checkImmediate(low.genLte(5, x, null)));
        assertEquals(Boolean.TRUE, high.checkImmediate(high.genLte(5, x, null)));
        assertEquals(Boolean.FALSE, high.checkImmediate(high.genLt(x, 5, null)));
    }

    @Test
    public void join_concatenates_live_and_dedups_dead_by_fail_id() {
        AnalysisSession session = new AnalysisSession();
        Context<ShValue> ctx = root(session);
        ContextSet<ShValue> dead = ctx.failToSet("first", null);
        ContextSet<ShValue> live = ctx.toSet();

        ContextSet<ShValue> joined = dead.join(live).join(dead);
        assertEquals(1, joined.getList().size());
        assertEquals(1, joined.getFailed().size());

        ContextSet<ShValue> other = ctx.failToSet("second", null);
        assertEquals(2, joined.join(other).getFailed().size());
    }

    @Test
    public void map_repartitions_failed_results() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ContextSet<ShValue> set = ctx.toSet().map(c -> c.failWithMsg("mapped failure", null));
        assertTrue(set.getList().isEmpty());
        assertEquals("mapped failure", set.getFailed().get(0).failed.reason);
    }

    @Test
    public void path_count_governor_cancels_all_live_paths() {
        AnalysisSession session = new AnalysisSession();
        session.setGovernor(new PathGovernor(1, 0));
        Context<ShValue> ctx = root(session);
        ExpNum x = sym(ctx, "x");

        ContextSet.Branches<ShValue> br = ctx.toSet().ifThenElse(ctx.genLt(x, 5, null), null);
        ContextSet<ShValue> joined = br.thenSet.join(br.elseSet);

        assertTrue(joined.getList().isEmpty());
        assertEquals(2, joined.getStopped().size());
        for (Context<ShValue> c : joined.getStopped()) {
            assertEquals("path count exceeded (1)", c.failed.reason);
        }
    }

    @Test
    public void timeout_governor_fails_live_paths() throws InterruptedException {
        AnalysisSession session = new AnalysisSession();
        PathGovernor governor = new PathGovernor(0, 1);
        session.setGovernor(governor);
        Context<ShValue> ctx = root(session);
        governor.start();
        Thread.sleep(20);

        ContextSet<ShValue> set = ctx.toSet();
        assertTrue(set.getList().isEmpty());
        assertEquals(1, set.getFailed().size());
        assertEquals("timeout expired (1ms)", set.getFailed().get(0).failed.reason);
    }

    @Test
    public void fail_ids_come_from_the_session() {
        AnalysisSession a = new AnalysisSession();
        AnalysisSession b = new AnalysisSession();
        int fromA = root(a).failToSet("x", null).getFailed().get(0).failId;
        int fromB = root(b).failToSet("x", null).getFailed().get(0).failId;
        assertEquals(fromA, fromB);
    }

    @Test
    public void return_value_replaces_live_results_only() {
        Context<ShValue> ctx = root(new AnalysisSession());
        ContextSet<ShValue> set = ctx.toSet().join(ctx.failToSet("dead", null));
        ContextSet<String> mapped = set.returnValue("done");
        assertEquals("done", mapped.getList().get(0).retVal);
        assertEquals(1, mapped.getFailed().size());
    }
}
