import com.shapetea.context.Context;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.ir.Expr;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.service.AnalysisResult;
import com.shapetea.service.ShapeTeaService;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.shapetea.ir.Ir.*;
import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {

    private static AnalysisResult run(Stmt entry) {
        return new ShapeTeaService().analyze("test", entry);
    }

    private static double onlyIntResult(AnalysisResult result) {
        assertEquals(1, result.getSuccess().size(), "expected a single live path");
        Context<Object> ctx = result.getSuccess().get(0);
        assertTrue(ctx.retVal instanceof SVInt, "expected an int, got " + ctx.retVal);
        SVInt value = (SVInt) ctx.retVal;
        assertTrue(value.isConst(), "expected a constant, got " + value);
        return value.constValue();
    }

    private static Expr.LibCall range(long stop) {
        return libCall("range", param(null, intConst(stop)));
    }

    private static Expr.LibCall randInt(long lo, long hi, String prefix) {
        return libCall("randInt", param(null, intConst(lo)), param(null, intConst(hi)), param(null, str(prefix)));
    }

    @Test
    public void arithmetic_on_constants_folds() {
        assertEquals(7.0, onlyIntResult(run(ret(add(intConst(3), mul(intConst(2), intConst(2)))))));
    }

    @Test
    public void own_dunder_attribute_handles_binary_operator() {
        Stmt entry = let("o", object(),
                funDef("plus", Collections.singletonList("other"), ret(add(name("other"), intConst(40))),
                        seq(assign(attr(name("o"), "__add__"), name("plus")),
                                ret(add(name("o"), intConst(2))))));
        assertEquals(42.0, onlyIntResult(run(entry)));
    }

    @Test
    public void constant_range_loop_accumulates() {
        Stmt entry = let("s", intConst(0),
                seq(forIn("i", range(3), assign("s", add(name("s"), name("i")))),
                        ret(name("s"))));
        assertEquals(3.0, onlyIntResult(run(entry)));
    }

    @Test
    public void break_leaves_the_loop() {
        Stmt body = seq(ifThen(eq(name("i"), intConst(2)), brk(), pass()),
                assign("s", add(name("s"), name("i"))));
        Stmt entry = let("s", intConst(0),
                seq(forIn("i", range(10), body), ret(name("s"))));
        assertEquals(1.0, onlyIntResult(run(entry)));
    }

    @Test
    public void continue_skips_the_rest_of_the_body() {
        Stmt body = seq(ifThen(eq(name("i"), intConst(1)), cont(), pass()),
                assign("s", add(name("s"), name("i"))));
        Stmt entry = let("s", intConst(0),
                seq(forIn("i", range(4), body), ret(name("s"))));
        assertEquals(5.0, onlyIntResult(run(entry)));
    }

    @Test
    public void unknown_name_fails() {
        AnalysisResult result = run(ret(name("zz")));
        assertTrue(result.getSuccess().isEmpty());
        assertEquals(1, result.getFailed().size());
        assertEquals("name 'zz' does not exist.", result.getFailed().get(0).failed.reason);
    }

    @Test
    public void symbolic_condition_forks_two_paths() {
        Stmt entry = let("x", randInt(0, 10, "x"),
                ifThen(lt(name("x"), intConst(5)), ret(intConst(1)), ret(intConst(2))));
        AnalysisResult result = run(entry);
        assertEquals(2, result.getSuccess().size());
        for (Context<Object> ctx : result.getSuccess()) {
            assertEquals(1, ctx.ctrSet.getPathIds().size());
        }
    }

    @Test
    public void decided_condition_does_not_fork() {
        Stmt entry = let("x", randInt(6, 10, "x"),
                ifThen(lt(name("x"), intConst(5)), ret(intConst(1)), ret(intConst(2))));
        assertEquals(2.0, onlyIntResult(run(entry)));
    }

    @Test
    public void pure_call_with_equal_results_is_merged() {
        Stmt body = let("r", randInt(0, 10, "r"),
                ifThen(lt(name("r"), intConst(5)), ret(intConst(1)), ret(intConst(1))));
        Stmt entry = funDef("f", Collections.<String>emptyList(), body, ret(call(name("f"))));
        AnalysisResult result = run(entry);
        assertEquals(1.0, onlyIntResult(result));
        assertTrue(result.getSuccess().get(0).ctrSet.getPathIds().isEmpty());
    }

    @Test
    public void pure_call_forking_on_caller_symbol_leaves_pool_unchanged() {
        Stmt helper = ifThen(lt(name("v"), intConst(0)), ret(intConst(1)), ret(intConst(1)));
        Stmt entry = funDef("f", Collections.singletonList("v"), helper,
                let("y", randInt(-10, 10, "y"), ret(call(name("f"), name("y")))));
        Stmt withoutCall = let("y", randInt(-10, 10, "y"), ret(intConst(1)));

        AnalysisResult result = run(entry);
        assertEquals(1.0, onlyIntResult(result));
        Context<Object> merged = result.getSuccess().get(0);
        Context<Object> baseline = run(withoutCall).getSuccess().get(0);
        assertEquals(baseline.ctrSet.count(), merged.ctrSet.count());
        assertTrue(merged.ctrSet.getPathIds().isEmpty());
    }

    @Test
    public void pure_call_with_different_results_keeps_both_paths() {
        Stmt body = let("r", randInt(0, 10, "r"),
                ifThen(lt(name("r"), intConst(5)), ret(intConst(1)), ret(intConst(2))));
        Stmt entry = funDef("f", Collections.<String>emptyList(), body, ret(call(name("f"))));
        assertEquals(2, run(entry).getSuccess().size());
    }

    @Test
    public void function_parameters_bind_positionally() {
        Stmt entry = funDef("sub2", Arrays.asList("a", "b"), ret(sub(name("a"), name("b"))),
                ret(call(name("sub2"), intConst(10), intConst(4))));
        assertEquals(6.0, onlyIntResult(run(entry)));
    }

    @Test
    public void dict_lookup_by_string_key() {
        Stmt entry = let("d", libCall("genDict", param(null, tuple(str("a"), intConst(7)))),
                ret(subscr(name("d"), str("a"))));
        assertEquals(7.0, onlyIntResult(run(entry)));
    }

    @Test
    public void list_length_and_negative_index() {
        Expr.LibCall list = libCall("genList",
                param(null, intConst(4)), param(null, intConst(5)), param(null, intConst(6)));
        assertEquals(3.0, onlyIntResult(run(let("l", list, ret(libCall("len", param(null, name("l"))))))));
        assertEquals(6.0, onlyIntResult(run(let("l", list, ret(subscr(name("l"), intConst(-1)))))));
    }

    @Test
    public void attribute_assignment_is_visible_through_aliases() {
        Stmt entry = let("o", object(),
                let("p", name("o"),
                        seq(assign(attr(name("p"), "v"), intConst(9)),
                                ret(attr(name("o"), "v")))));
        assertEquals(9.0, onlyIntResult(run(entry)));
    }

    @Test
    public void size_intrinsics_read_tensor_shape() {
        Expr.LibCall zeros = libCall("zeros", param(null, intConst(3)), param(null, intConst(4)));
        Stmt last = let("t", zeros,
                let("s", libCall("shape", param(null, name("t"))),
                        ret(libCall("size_getitem", param(null, name("s")), param(null, intConst(-1))))));
        assertEquals(4.0, onlyIntResult(run(last)));

        Stmt rank = let("t", zeros,
                ret(libCall("size_len", param(null, libCall("shape", param(null, name("t")))))));
        assertEquals(2.0, onlyIntResult(run(rank)));
    }

    @Test
    public void size_index_out_of_range_fails() {
        Expr.LibCall zeros = libCall("zeros", param(null, intConst(3)), param(null, intConst(4)));
        Stmt entry = let("t", zeros,
                ret(libCall("size_getitem", param(null, libCall("shape", param(null, name("t")))),
                        param(null, intConst(2)))));
        AnalysisResult result = run(entry);
        assertTrue(result.getSuccess().isEmpty());
        assertTrue(result.getFailed().get(0).failed.reason.startsWith("from 'LibCall.shape.size_getitem'"));
    }

    @Test
    public void zero_step_range_fails() {
        Stmt entry = expr(libCall("range", param(null, intConst(0)), param(null, intConst(5)),
                param(null, intConst(0))));
        AnalysisResult result = run(entry);
        assertEquals("ValueError: range() arg 3 must not be zero", result.getFailed().get(0).failed.reason);
    }

    @Test
    public void division_by_zero_fails_the_path() {
        AnalysisResult result = run(ret(binOp(Expr.BinOpType.TRUE_DIV, intConst(1), intConst(0))));
        assertTrue(result.getSuccess().isEmpty());
        assertEquals(1, result.getFailed().size());
        assertEquals("ZeroDivisionError: division by zero", result.getFailed().get(0).failed.reason);
    }

    @Test
    public void warning_keeps_the_path_alive() {
        AnalysisResult result = run(seq(expr(libCall("warn", param(null, str("careful")))), ret(intConst(1))));
        assertEquals(1.0, onlyIntResult(result));
        ShValue log = result.getSuccess().get(0).logs.get(0);
        assertTrue(log.toString().contains("careful"));
    }
}
