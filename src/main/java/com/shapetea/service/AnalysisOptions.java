package com.shapetea.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shapetea.plugins.VariableRange;

/**
 * Knobs of one analysis run. Instances are immutable; {@code with*} returns a modified copy.
 *
 * <pre>
 * {
 *   "timeout": 60000,
 *   "maxPath": 1000,
 *   "logLevel": "reduced",
 *   "immediateConstraintCheck": true,
 *   "ignoreAssert": false,
 *   "variableRange": { "batch": [1, 64], "seed": null, "lr": 0.1 }
 * }
 * </pre>
 */
public final class AnalysisOptions {

    public enum LogLevel {
        NONE("none"), RESULT_ONLY("result-only"), REDUCED("reduced"), FULL("full");

        private final String key;

        LogLevel(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static LogLevel fromKey(String key) {
            for (LogLevel l : values()) {
                if (l.key.equals(key)) return l;
            }
            throw new ShapeTeaException("unknown logLevel '" + key + "' (expected none, result-only, reduced or full)");
        }
    }

    private static final ObjectMapper om = new ObjectMapper();

    private final long timeoutMs;
    private final int maxPath;
    private final LogLevel logLevel;
    private final boolean immediateConstraintCheck;
    private final boolean ignoreAssert;
    private final Map<String, VariableRange> variableRanges;

    private AnalysisOptions(long timeoutMs, int maxPath, LogLevel logLevel, boolean immediateConstraintCheck,
                            boolean ignoreAssert, Map<String, VariableRange> variableRanges) {
        if (timeoutMs < 0) throw new ShapeTeaException("timeout must not be negative: " + timeoutMs);
        if (maxPath < 0) throw new ShapeTeaException("maxPath must not be negative: " + maxPath);
        if (logLevel == null) throw new ShapeTeaException("logLevel is null");
        this.timeoutMs = timeoutMs;
        this.maxPath = maxPath;
        this.logLevel = logLevel;
        this.immediateConstraintCheck = immediateConstraintCheck;
        this.ignoreAssert = ignoreAssert;
        this.variableRanges = Collections.unmodifiableMap(new LinkedHashMap<>(variableRanges));
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(0, 0, LogLevel.REDUCED, true, false, Collections.emptyMap());
    }

    // ===================== JSON =====================

    public static AnalysisOptions fromJson(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ShapeTeaException("malformed options JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ShapeTeaException("options JSON must be an object");
        }

        AnalysisOptions opts = defaults();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode v = e.getValue();
            switch (key) {
                case "timeout":
                    opts = opts.withTimeout(requireNumber(key, v).asLong());
                    break;
                case "maxPath":
                    opts = opts.withMaxPath(requireNumber(key, v).asInt());
                    break;
                case "logLevel":
                    if (!v.isTextual()) throw new ShapeTeaException("logLevel must be a string");
                    opts = opts.withLogLevel(LogLevel.fromKey(v.asText()));
                    break;
                case "immediateConstraintCheck":
                    opts = opts.withImmediateConstraintCheck(requireBoolean(key, v));
                    break;
                case "ignoreAssert":
                    opts = opts.withIgnoreAssert(requireBoolean(key, v));
                    break;
                case "variableRange":
                    opts = opts.withVariableRanges(parseVariableRanges(v));
                    break;
                default:
                    throw new ShapeTeaException("unknown option key '" + key + "'");
            }
        }
        return opts;
    }

    public static AnalysisOptions fromJson(Path path) {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ShapeTeaException("cannot read options file " + path, e);
        }
    }

    private static JsonNode requireNumber(String key, JsonNode v) {
        if (!v.isNumber()) throw new ShapeTeaException(key + " must be a number");
        return v;
    }

    private static boolean requireBoolean(String key, JsonNode v) {
        if (!v.isBoolean()) throw new ShapeTeaException(key + " must be a boolean");
        return v.asBoolean();
    }

    // prefix -> null | number | [lo|null, hi|null]
    private static Map<String, VariableRange> parseVariableRanges(JsonNode node) {
        if (!node.isObject()) throw new ShapeTeaException("variableRange must be an object");
        Map<String, VariableRange> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isNull()) {
                out.put(e.getKey(), VariableRange.unbounded());
            } else if (v.isNumber()) {
                out.put(e.getKey(), VariableRange.fixed(v.asDouble()));
            } else if (v.isArray() && v.size() == 2) {
                out.put(e.getKey(), VariableRange.between(bound(e.getKey(), v.get(0)), bound(e.getKey(), v.get(1))));
            } else {
                throw new ShapeTeaException("variableRange." + e.getKey() + " must be null, a number or [lo, hi]");
            }
        }
        return out;
    }

    private static Double bound(String key, JsonNode v) {
        if (v.isNull()) return null;
        if (!v.isNumber()) throw new ShapeTeaException("variableRange." + key + " bound must be a number or null");
        return v.asDouble();
    }

    // ===================== ACCESSORS =====================

    public long timeoutMs() { return timeoutMs; }
    public int maxPath() { return maxPath; }
    public LogLevel logLevel() { return logLevel; }
    public boolean immediateConstraintCheck() { return immediateConstraintCheck; }
    public boolean ignoreAssert() { return ignoreAssert; }
    public Map<String, VariableRange> variableRanges() { return variableRanges; }

    public AnalysisOptions withTimeout(long ms) {
        return new AnalysisOptions(ms, maxPath, logLevel, immediateConstraintCheck, ignoreAssert, variableRanges);
    }

    public AnalysisOptions withMaxPath(int n) {
        return new AnalysisOptions(timeoutMs, n, logLevel, immediateConstraintCheck, ignoreAssert, variableRanges);
    }

    public AnalysisOptions withLogLevel(LogLevel level) {
        return new AnalysisOptions(timeoutMs, maxPath, level, immediateConstraintCheck, ignoreAssert, variableRanges);
    }

    public AnalysisOptions withImmediateConstraintCheck(boolean on) {
        return new AnalysisOptions(timeoutMs, maxPath, logLevel, on, ignoreAssert, variableRanges);
    }

    public AnalysisOptions withIgnoreAssert(boolean on) {
        return new AnalysisOptions(timeoutMs, maxPath, logLevel, immediateConstraintCheck, on, variableRanges);
    }

    public AnalysisOptions withVariableRanges(Map<String, VariableRange> ranges) {
        return new AnalysisOptions(timeoutMs, maxPath, logLevel, immediateConstraintCheck, ignoreAssert,
                ranges == null ? Collections.emptyMap() : ranges);
    }

    @Override
    public String toString() {
        return "AnalysisOptions{timeout=" + timeoutMs + "ms, maxPath=" + maxPath + ", logLevel=" + logLevel.key()
                + ", immediateConstraintCheck=" + immediateConstraintCheck + ", ignoreAssert=" + ignoreAssert
                + ", variableRange=" + variableRanges + "}";
    }
}
