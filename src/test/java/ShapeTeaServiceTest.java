import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.ir.Statement;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.service.AnalysisOptions;
import com.shapetea.service.AnalysisOptions.LogLevel;
import com.shapetea.service.AnalysisResult;
import com.shapetea.service.ResultLogPrinter;
import com.shapetea.service.ShapeTeaException;
import com.shapetea.service.ShapeTeaService;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.shapetea.ir.Ir.*;
import static org.junit.jupiter.api.Assertions.*;

public class ShapeTeaServiceTest {

    // let $builtins = object in $builtins.answer = 41
    private static Statement.Let builtinModule() {
        return let("$builtins", object(), assign(attr(name("$builtins"), "answer"), intConst(41)));
    }

    @Test
    public void builtin_module_names_are_visible_to_the_entry() {
        ShapeTeaService service = new ShapeTeaService();
        AnalysisResult result = service.analyze("main", builtinModule(), ret(add(name("answer"), intConst(1))));

        assertEquals(1, result.getSuccess().size());
        Object ret = result.getSuccess().get(0).retVal;
        assertTrue(ret instanceof SVInt);
        assertEquals(42.0, ((SVInt) ret).constValue());
    }

    @Test
    public void entry_allocations_start_above_the_builtins() {
        ShapeTeaService service = new ShapeTeaService();
        Stmt entry = let("o", object(), ret(name("o")));
        AnalysisResult result = service.analyze("main", builtinModule(), entry);

        ShValue ret = (ShValue) result.getSuccess().get(0).retVal;
        assertTrue(ret instanceof ShValue.SVAddr);
        assertTrue(((ShValue.SVAddr) ret).addr >= 0);
        assertTrue(result.getSuccess().get(0).env.getId("answer").addr < 0);
    }

    @Test
    public void host_registered_intrinsic_is_callable() {
        ShapeTeaService service = new ShapeTeaService();
        service.registry().register("seven", (interp, ctx, source) -> ctx.toSetWith((ShValue) SVInt.of(7, source)));
        AnalysisResult result = service.analyze("main", ret(libCall("seven")));
        assertEquals(7.0, ((SVInt) result.getSuccess().get(0).retVal).constValue());
    }

    @Test
    public void unknown_intrinsic_fails_the_path() {
        AnalysisResult result = new ShapeTeaService().analyze("main", expr(libCall("nope")));
        assertEquals("invalid libcall type: nope", result.getFailed().get(0).failed.reason);
    }

    @Test
    public void engine_exception_goes_to_reporter() {
        ShapeTeaService service = new ShapeTeaService();
        service.registry().register("boom", (interp, ctx, source) -> {
            throw new IllegalStateException("broken intrinsic");
        });
        List<String> reported = new ArrayList<>();
        service.setErrorReporter((entry, error) -> reported.add(entry + ": " + error.getMessage()));

        AnalysisResult result = service.analyze("main", expr(libCall("boom")));
        assertTrue(result.isAborted());
        assertTrue(result.getSuccess().isEmpty());
        assertFalse(result.hasNoImmediateFailure());
        assertEquals(1, reported.size());
        assertEquals("main: broken intrinsic", reported.get(0));
    }

    @Test
    public void engine_exception_without_reporter_propagates() {
        ShapeTeaService service = new ShapeTeaService();
        service.registry().register("boom", (interp, ctx, source) -> {
            throw new IllegalStateException("broken intrinsic");
        });
        assertThrows(IllegalStateException.class, () -> service.analyze("main", expr(libCall("boom"))));
    }

    @Test
    public void null_entry_is_rejected() {
        assertThrows(ShapeTeaException.class, () -> new ShapeTeaService().analyze("main", null));
    }

    @Test
    public void result_only_log_lists_failures_and_summary() {
        ShapeTeaService service = new ShapeTeaService(AnalysisOptions.defaults().withLogLevel(LogLevel.RESULT_ONLY));
        AnalysisResult result = service.analyze("main", expr(libCall("exit")));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        service.printLog(result, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String text = bytes.toString(StandardCharsets.UTF_8);

        assertTrue(text.contains("failed path #1: explicit process exit function call"));
        assertTrue(text.contains("potential success path #: 0"));
        assertTrue(text.contains("immediate failed path #: 1"));
        assertFalse(text.contains("RUNNING TIME"));
    }

    @Test
    public void reduced_log_shows_tensor_shapes() {
        Stmt entry = let("t", libCall("zeros", param(null, intConst(2)), param(null, intConst(3))),
                expr(libCall("DEBUG", param(null, name("t")))));
        AnalysisResult result = new ShapeTeaService().analyze("main", entry);

        String text = new ResultLogPrinter(LogLevel.REDUCED).render(result);
        assertTrue(text.contains("success path #1"));
        assertTrue(text.contains("tensor: "));
        assertTrue(text.contains("RUNNING TIME"));
    }

    @Test
    public void none_level_prints_nothing() {
        AnalysisResult result = new ShapeTeaService().analyze("main", ret(intConst(1)));
        assertEquals("", new ResultLogPrinter(LogLevel.NONE).render(result));
    }
}
