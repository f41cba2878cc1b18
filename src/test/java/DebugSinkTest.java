import com.shapetea.debug.Debug;
import com.shapetea.debug.DebugLevel;
import com.shapetea.debug.DebugSink;
import com.shapetea.debug.StdoutDebugSink;
import com.shapetea.ir.Ir;
import com.shapetea.service.AnalysisResult;
import com.shapetea.service.ShapeTeaService;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class DebugSinkTest {

    @Test
    public void default_hub_is_silent_and_never_null() {
        assertNotNull(Debug.get().getSink());
        Debug.get().log(DebugLevel.INFO, Debug.TAG_SERVICE, "no sink installed", null);
        AnalysisResult result = new ShapeTeaService().analyze("main", Ir.ret(Ir.intConst(1)));
        assertEquals(1, result.getSuccess().size());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void cleared_sink_reference_falls_back_to_noop() throws Exception {
        Field field = Debug.class.getDeclaredField("sinkRef");
        field.setAccessible(true);
        AtomicReference<DebugSink> ref = (AtomicReference<DebugSink>) field.get(Debug.get());
        DebugSink previous = ref.get();
        ref.set(null);
        try {
            assertFalse(Debug.get().enabled());
            Debug.get().w(Debug.TAG_SOLVER, "still routed");
            AnalysisResult result = new ShapeTeaService().analyze("main", Ir.ret(Ir.intConst(2)));
            assertEquals(1, result.getSuccess().size());
        } finally {
            ref.set(previous);
        }
    }

    @Test
    public void service_logs_through_installed_sink() {
        DebugSink previous = Debug.get().getSink();
        List<String> tags = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> tags.add(tag));
        try {
            assertTrue(Debug.get().enabled());
            new ShapeTeaService().analyze("main", Ir.ret(Ir.intConst(1)));
        } finally {
            Debug.get().setSink(previous);
        }
        assertTrue(tags.contains(Debug.TAG_SERVICE));
    }

    @Test
    public void null_sink_restores_silence() {
        DebugSink previous = Debug.get().getSink();
        try {
            Debug.get().setSink(null);
            assertFalse(Debug.get().enabled());
        } finally {
            Debug.get().setSink(previous);
        }
    }

    @Test
    public void stdout_sink_filters_below_min_level() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        StdoutDebugSink sink = new StdoutDebugSink(DebugLevel.WARN, out);

        sink.log(DebugLevel.DEBUG, Debug.TAG_SOLVER, "hidden", null);
        sink.log(DebugLevel.WARN, Debug.TAG_SOLVER, "shown", null);
        sink.log(DebugLevel.ERROR, Debug.TAG_CTX, "failed", new IllegalStateException("cause"));

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("[WARN] shapetea.solver: shown"));
        assertTrue(text.contains("[ERROR] shapetea.ctx: failed"));
        assertTrue(text.contains("IllegalStateException"));
    }

    @Test
    public void level_ordering() {
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertTrue(DebugLevel.INFO.atLeast(DebugLevel.INFO));
        assertFalse(DebugLevel.TRACE.atLeast(DebugLevel.DEBUG));
    }
}
