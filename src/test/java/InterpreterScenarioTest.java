import com.shapetea.constraint.Constraint;
import com.shapetea.context.Context;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.ir.Expr;
import com.shapetea.ir.Ir;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.plugins.VariableRange;
import com.shapetea.service.AnalysisOptions;
import com.shapetea.service.AnalysisResult;
import com.shapetea.service.ShapeTeaService;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.NumRange;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static com.shapetea.ir.Ir.*;
import static org.junit.jupiter.api.Assertions.*;

public class InterpreterScenarioTest {

    private static Expr.LibCall randInt(long lo, long hi, String prefix) {
        return libCall("randInt", param(null, intConst(lo)), param(null, intConst(hi)), param(null, str(prefix)));
    }

    private static Expr.LibCall zeros(long... dims) {
        Expr.LibParam[] params = new Expr.LibParam[dims.length];
        for (int i = 0; i < dims.length; i++) {
            params[i] = param(null, intConst(dims[i]));
        }
        return libCall("zeros", params);
    }

    private static AnalysisResult analyze(Stmt entry) {
        return new ShapeTeaService().analyze("main", entry);
    }

    @Test
    public void rand_int_bounds_satisfy_assert() {
        Stmt entry = let("x", randInt(1, 10, "x"),
                expr(libCall("assert", param(null,
                        and(lte(intConst(1), name("x")), lte(name("x"), intConst(10)))))));

        AnalysisResult result = analyze(entry);
        assertEquals(1, result.getSuccess().size());
        assertTrue(result.getFailed().isEmpty());
        assertTrue(result.getStopped().isEmpty());
        assertTrue(result.hasNoImmediateFailure());
    }

    @Test
    public void matmul_of_constant_shapes_is_constant() {
        Stmt entry = let("a", zeros(3, 4),
                let("b", zeros(4, 5),
                        ret(libCall("matmul", param(null, name("a")), param(null, name("b"))))));

        AnalysisResult result = analyze(entry);
        assertEquals(1, result.getSuccess().size());
        Context<Object> ctx = result.getSuccess().get(0);

        ShValue tensor = ctx.heap.fetchAddr((ShValue) ctx.retVal);
        assertTrue(tensor instanceof SVObject);
        List<ExpNum> dims = ctx.ctrSet.getCachedShape(((SVObject) tensor).shape());
        assertNotNull(dims);
        assertEquals(2, dims.size());
        assertEquals(NumRange.fromConst(3), ctx.getCachedRange(dims.get(0)));
        assertEquals(NumRange.fromConst(5), ctx.getCachedRange(dims.get(1)));
    }

    @Test
    public void matmul_dimension_mismatch_fails_immediately() {
        Stmt entry = let("a", zeros(3, 4),
                let("b", zeros(5, 6),
                        ret(libCall("matmul", param(null, name("a")), param(null, name("b"))))));

        AnalysisResult result = analyze(entry);
        assertTrue(result.getSuccess().isEmpty());
        assertEquals(1, result.getFailed().size());
        assertTrue(result.getFailed().get(0).failed.reason.contains("dimension mismatch"));
        assertFalse(result.hasNoImmediateFailure());
    }

    @Test
    public void loop_over_symbolic_range_runs_once_with_fresh_index() {
        Stmt entry = let("n", randInt(1, 100, "n"),
                forIn("i", libCall("range", param(null, name("n"))), pass()));

        AnalysisResult result = analyze(entry);
        assertEquals(1, result.getSuccess().size());
        assertTrue(result.getFailed().isEmpty());

        Context<Object> ctx = result.getSuccess().get(0);
        assertFalse(ctx.ctrSet.getHardIds().isEmpty());
        assertTrue(ctx.ctrSet.toString().contains("for$i"));

        Pattern upper = Pattern.compile("\\(for\\$i_I\\d+ <= \\(n_I\\d+ - 1\\)\\)");
        List<Constraint> simplified = ctx.ctrSet.getConstraints();
        boolean bounded = false;
        for (int id : ctx.ctrSet.getHardIds()) {
            bounded |= upper.matcher(simplified.get(id).toString()).find();
        }
        assertTrue(bounded, "missing hard bound for$i <= n - 1 in " + ctx.ctrSet);
    }

    @Test
    public void path_limit_stops_every_path() {
        Stmt entry = let("x", randInt(0, 10, "x"),
                ifThen(lt(name("x"), intConst(5)), pass(), pass()));

        ShapeTeaService service = new ShapeTeaService(AnalysisOptions.defaults().withMaxPath(1));
        AnalysisResult result = service.analyze("main", entry);

        assertTrue(result.getSuccess().isEmpty());
        assertFalse(result.getStopped().isEmpty());
        for (Context<ShValue> c : result.getStopped()) {
            assertEquals("path count exceeded (1)", c.failed.reason);
        }
    }

    @Test
    public void ignore_assert_skips_false_assertions() {
        Stmt entry = expr(libCall("assert", param(null, bool(false))));

        AnalysisResult strict = analyze(entry);
        assertEquals(1, strict.getFailed().size());
        assertEquals("assertion failed", strict.getFailed().get(0).failed.reason);

        ShapeTeaService lenient = new ShapeTeaService(AnalysisOptions.defaults().withIgnoreAssert(true));
        AnalysisResult ignored = lenient.analyze("main", entry);
        assertEquals(1, ignored.getSuccess().size());
        assertTrue(ignored.getFailed().isEmpty());
    }

    @Test
    public void fixed_variable_range_replaces_random_value() {
        Stmt entry = let("x", randInt(0, 10, "x"),
                ifThen(lt(name("x"), intConst(2)), expr(libCall("exit")), pass()));

        AnalysisOptions options = AnalysisOptions.defaults()
                .withVariableRanges(Collections.singletonMap("x", VariableRange.fixed(3)));
        AnalysisResult fixed = new ShapeTeaService(options).analyze("main", entry);
        assertEquals(1, fixed.getSuccess().size());
        assertTrue(fixed.getStopped().isEmpty());
        assertTrue(fixed.getFailed().isEmpty());

        AnalysisResult free = analyze(entry);
        assertEquals(1, free.getSuccess().size());
        assertEquals(1, free.getStopped().size());
    }

    @Test
    public void exit_fails_the_path() {
        AnalysisResult result = analyze(Ir.seq(expr(libCall("exit")), ret(intConst(1))));
        assertTrue(result.getSuccess().isEmpty());
        assertEquals(1, result.getFailed().size());
        assertEquals("explicit process exit function call", result.getFailed().get(0).failed.reason);
    }

    @Test
    public void constraint_export_lists_live_paths() {
        Stmt entry = let("x", randInt(0, 10, "x"),
                ifThen(lt(name("x"), intConst(5)), pass(), pass()));
        AnalysisResult result = analyze(entry);
        assertEquals(2, result.getSuccess().size());

        String json = result.exportConstraintJson();
        assertTrue(json.startsWith("["));
        assertTrue(json.contains("\"pathCtr\""));
    }
}
