import com.shapetea.plugins.VariableRange;
import com.shapetea.service.AnalysisOptions;
import com.shapetea.service.AnalysisOptions.LogLevel;
import com.shapetea.service.ShapeTeaException;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisOptionsTest {

    @Test
    public void defaults_are_unlimited_and_reduced() {
        AnalysisOptions o = AnalysisOptions.defaults();
        assertEquals(0, o.timeoutMs());
        assertEquals(0, o.maxPath());
        assertEquals(LogLevel.REDUCED, o.logLevel());
        assertTrue(o.immediateConstraintCheck());
        assertFalse(o.ignoreAssert());
        assertTrue(o.variableRanges().isEmpty());
    }

    @Test
    public void parses_every_key() {
        String json = "{ \"timeout\": 5000, \"maxPath\": 12, \"logLevel\": \"result-only\","
                + " \"immediateConstraintCheck\": false, \"ignoreAssert\": true }";
        AnalysisOptions o = AnalysisOptions.fromJson(json);
        assertEquals(5000, o.timeoutMs());
        assertEquals(12, o.maxPath());
        assertEquals(LogLevel.RESULT_ONLY, o.logLevel());
        assertFalse(o.immediateConstraintCheck());
        assertTrue(o.ignoreAssert());
    }

    @Test
    public void variable_range_forms() {
        String json = "{ \"variableRange\": { \"seed\": null, \"lr\": 0.5, \"batch\": [1, 64], \"len\": [null, 8] } }";
        Map<String, VariableRange> ranges = AnalysisOptions.fromJson(json).variableRanges();
        assertEquals(4, ranges.size());

        VariableRange seed = ranges.get("seed");
        assertFalse(seed.isFixed());
        assertNull(seed.lower());
        assertNull(seed.upper());

        assertTrue(ranges.get("lr").isFixed());
        assertEquals(0.5, ranges.get("lr").fixedValue());

        assertEquals(1.0, ranges.get("batch").lower());
        assertEquals(64.0, ranges.get("batch").upper());

        assertNull(ranges.get("len").lower());
        assertEquals(8.0, ranges.get("len").upper());
    }

    @Test
    public void log_level_keys_round_trip() {
        for (LogLevel level : LogLevel.values()) {
            assertSame(level, LogLevel.fromKey(level.key()));
        }
        assertThrows(ShapeTeaException.class, () -> LogLevel.fromKey("verbose"));
    }

    @Test
    public void rejects_bad_documents() {
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("{ \"colour\": 1 }"));
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("{ \"timeout\": \"soon\" }"));
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("{ \"maxPath\": -1 }"));
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("{ \"ignoreAssert\": 1 }"));
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("[1, 2]"));
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson("{ \"timeout\": "));
        assertThrows(ShapeTeaException.class,
                () -> AnalysisOptions.fromJson("{ \"variableRange\": { \"x\": [1, 2, 3] } }"));
        assertThrows(ShapeTeaException.class,
                () -> AnalysisOptions.fromJson("{ \"variableRange\": { \"x\": [\"a\", 2] } }"));
    }

    @Test
    public void with_methods_copy() {
        AnalysisOptions base = AnalysisOptions.defaults();
        AnalysisOptions changed = base.withMaxPath(3).withTimeout(10).withLogLevel(LogLevel.FULL);
        assertEquals(0, base.maxPath());
        assertEquals(3, changed.maxPath());
        assertEquals(10, changed.timeoutMs());
        assertEquals(LogLevel.FULL, changed.logLevel());
    }

    @Test
    public void reads_options_file() throws Exception {
        Path file = Files.createTempFile("shapetea-options", ".json");
        try {
            Files.write(file, "{ \"maxPath\": 7 }".getBytes(StandardCharsets.UTF_8));
            assertEquals(7, AnalysisOptions.fromJson(file).maxPath());
        } finally {
            Files.deleteIfExists(file);
        }
        assertThrows(ShapeTeaException.class, () -> AnalysisOptions.fromJson(file));
    }
}
