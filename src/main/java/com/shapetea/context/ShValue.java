package com.shapetea.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.shapetea.ir.CodeSource;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.symbolic.ExpBool;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpShape;
import com.shapetea.symbolic.ExpString;
import com.shapetea.symbolic.NumRange;
import com.shapetea.util.PMap;

/**
 * Values of the analysed program. Every variant is immutable; "mutating" an object means
 * storing a new value at the same heap address.
 */
public abstract class ShValue {

    public enum Type { ADDR, INT, FLOAT, STRING, BOOL, OBJECT, SIZE, FUNC, NONE, NOT_IMPL, UNDEF, ERROR }

    public enum ErrorLevel { ERROR, WARNING, LOG }

    public final CodeSource source;

    ShValue(CodeSource source) {
        this.source = source;
    }

    public abstract Type type();

    /** Shifts every non-negative address reachable without the heap. */
    public ShValue addOffset(int offset) {
        return this;
    }

    public boolean isNumeric() {
        Type t = type();
        return t == Type.INT || t == Type.FLOAT || t == Type.BOOL;
    }

    public boolean isObjectLike() {
        return this instanceof ObjectLike;
    }

    public static String typeName(ShValue value) {
        if (value == null) return "undefined";
        switch (value.type()) {
            case ADDR: return "Addr";
            case INT: return "Int";
            case FLOAT: return "Float";
            case STRING: return "String";
            case BOOL: return "Bool";
            case OBJECT: return "Object";
            case SIZE: return "Size";
            case FUNC: return "Func";
            case NONE: return "None";
            case NOT_IMPL: return "NotImpl";
            case UNDEF: return "Undef";
            default: return "Error";
        }
    }

    static <K extends Comparable<K>> String mapToString(PMap<K, ShValue> map) {
        if (map.isEmpty()) return "{}";
        List<K> keys = new ArrayList<>(map.keySet());
        Collections.sort(keys);
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(keys.get(i)).append(" => ").append(map.get(keys.get(i)));
        }
        return sb.append(" }").toString();
    }

    private static <K> PMap<K, ShValue> offsetMap(PMap<K, ShValue> map, int offset) {
        if (map.isEmpty()) return map;
        Map<K, ShValue> out = new LinkedHashMap<>();
        for (Map.Entry<K, ShValue> e : map.entrySet()) {
            out.put(e.getKey(), e.getValue().addOffset(offset));
        }
        return PMap.of(out);
    }

    // ===================== ADDRESS =====================

    public static final class SVAddr extends ShValue {
        public final int addr;

        public SVAddr(int addr, CodeSource source) {
            super(source);
            this.addr = addr;
        }

        @Override public Type type() { return Type.ADDR; }

        @Override
        public SVAddr addOffset(int offset) {
            return addr >= 0 ? new SVAddr(addr + offset, source) : this;
        }

        @Override public boolean equals(Object o) { return o instanceof SVAddr && ((SVAddr) o).addr == addr; }
        @Override public int hashCode() { return addr; }
        @Override public String toString() { return "Loc(" + addr + ")"; }
    }

    // ===================== PRIMITIVES =====================

    public static final class SVInt extends ShValue {
        public final ExpNum value;

        private SVInt(ExpNum value, CodeSource source) {
            super(source);
            this.value = Objects.requireNonNull(value, "value");
        }

        public static SVInt of(double value, CodeSource source) {
            return new SVInt(ExpNum.fromConst(value, source), source);
        }

        public static SVInt of(ExpNum value, CodeSource source) {
            return new SVInt(value, source);
        }

        public boolean isConst() { return value instanceof ExpNum.Const; }

        public double constValue() { return ((ExpNum.Const) value).value; }

        @Override public Type type() { return Type.INT; }
        @Override public boolean equals(Object o) { return o instanceof SVInt && ((SVInt) o).value.equals(value); }
        @Override public int hashCode() { return 3 + value.hashCode(); }
        @Override public String toString() { return value.toString(); }
    }

    public static final class SVFloat extends ShValue {
        public final ExpNum value;

        private SVFloat(ExpNum value, CodeSource source) {
            super(source);
            this.value = Objects.requireNonNull(value, "value");
        }

        public static SVFloat of(double value, CodeSource source) {
            return new SVFloat(ExpNum.fromConst(value, source), source);
        }

        public static SVFloat of(ExpNum value, CodeSource source) {
            return new SVFloat(value, source);
        }

        public boolean isConst() { return value instanceof ExpNum.Const; }

        public double constValue() { return ((ExpNum.Const) value).value; }

        @Override public Type type() { return Type.FLOAT; }
        @Override public boolean equals(Object o) { return o instanceof SVFloat && ((SVFloat) o).value.equals(value); }
        @Override public int hashCode() { return 5 + value.hashCode(); }

        @Override
        public String toString() {
            if (isConst()) {
                double v = constValue();
                return NumRange.isInteger(v) ? NumRange.formatNum(v) + ".0" : Double.toString(v);
            }
            return value.toString();
        }
    }

    public static final class SVString extends ShValue {
        public final ExpString value;

        private SVString(ExpString value, CodeSource source) {
            super(source);
            this.value = Objects.requireNonNull(value, "value");
        }

        public static SVString of(String value, CodeSource source) {
            return new SVString(ExpString.fromConst(value, source), source);
        }

        public static SVString of(ExpString value, CodeSource source) {
            return new SVString(value, source);
        }

        public boolean isConst() { return value instanceof ExpString.Const; }

        public String constValue() { return ((ExpString.Const) value).value; }

        @Override public Type type() { return Type.STRING; }
        @Override public boolean equals(Object o) { return o instanceof SVString && ((SVString) o).value.equals(value); }
        @Override public int hashCode() { return 7 + value.hashCode(); }
        @Override public String toString() { return isConst() ? "\"" + constValue() + "\"" : value.toString(); }
    }

    public static final class SVBool extends ShValue {
        public final ExpBool value;

        private SVBool(ExpBool value, CodeSource source) {
            super(source);
            this.value = Objects.requireNonNull(value, "value");
        }

        public static SVBool of(boolean value, CodeSource source) {
            return new SVBool(ExpBool.fromConst(value, source), source);
        }

        public static SVBool of(ExpBool value, CodeSource source) {
            return new SVBool(value, source);
        }

        public boolean isConst() { return value instanceof ExpBool.Const; }

        public boolean constValue() { return ((ExpBool.Const) value).value; }

        @Override public Type type() { return Type.BOOL; }
        @Override public boolean equals(Object o) { return o instanceof SVBool && ((SVBool) o).value.equals(value); }
        @Override public int hashCode() { return 11 + value.hashCode(); }
        @Override public String toString() { return value.toString(); }
    }

    // ===================== OBJECTS =====================

    /** Attribute, index and key storage shared by plain objects and Size wrappers. */
    public interface ObjectLike {
        SVAddr addr();

        SVObject object();

        ExpShape shape();

        ShValue getAttr(String attr);

        ShValue getIndice(int index);

        ShValue getKeyVal(String key);

        ObjectLike setAttr(String attr, ShValue value);

        ObjectLike setIndice(int index, ShValue value);

        ObjectLike setKeyVal(String key, ShValue value);

        ObjectLike withAddr(SVAddr addr);
    }

    public static final class SVObject extends ShValue implements ObjectLike {
        public final PMap<String, ShValue> attrs;
        public final PMap<Integer, ShValue> indices;
        public final PMap<String, ShValue> keyValues;
        public final SVAddr addr;
        // tensor shape, null for plain objects
        public final ExpShape shape;

        SVObject(PMap<String, ShValue> attrs, PMap<Integer, ShValue> indices, PMap<String, ShValue> keyValues,
                 SVAddr addr, ExpShape shape, CodeSource source) {
            super(source);
            this.attrs = attrs;
            this.indices = indices;
            this.keyValues = keyValues;
            this.addr = addr;
            this.shape = shape;
        }

        public static SVObject create(SVAddr addr, CodeSource source) {
            return new SVObject(PMap.empty(), PMap.empty(), PMap.empty(), addr, null, source);
        }

        @Override public Type type() { return Type.OBJECT; }
        @Override public SVAddr addr() { return addr; }
        @Override public SVObject object() { return this; }
        @Override public ExpShape shape() { return shape; }

        @Override public ShValue getAttr(String attr) { return attrs.get(attr); }
        @Override public ShValue getIndice(int index) { return indices.get(index); }
        @Override public ShValue getKeyVal(String key) { return keyValues.get(key); }

        @Override
        public SVObject setAttr(String attr, ShValue value) {
            return new SVObject(attrs.put(attr, value), indices, keyValues, addr, shape, source);
        }

        @Override
        public SVObject setIndice(int index, ShValue value) {
            return new SVObject(attrs, indices.put(index, value), keyValues, addr, shape, source);
        }

        @Override
        public SVObject setKeyVal(String key, ShValue value) {
            return new SVObject(attrs, indices, keyValues.put(key, value), addr, shape, source);
        }

        @Override
        public SVObject withAddr(SVAddr newAddr) {
            return new SVObject(attrs, indices, keyValues, newAddr, shape, source);
        }

        public SVObject withShape(ExpShape newShape) {
            return new SVObject(attrs, indices, keyValues, addr, newShape, source);
        }

        public SVObject withSource(CodeSource newSource) {
            return new SVObject(attrs, indices, keyValues, addr, shape, newSource);
        }

        /** Numeric values stored at integer indices, keyed by index. Non-numeric entries are skipped. */
        public Map<Integer, ExpNum> extractIndexedNumber(ShHeap heap) {
            Map<Integer, ExpNum> out = new LinkedHashMap<>();
            for (Map.Entry<Integer, ShValue> e : indices.entrySet()) {
                ShValue v = heap.fetchAddr(e.getValue());
                if (v instanceof SVInt) {
                    out.put(e.getKey(), ((SVInt) v).value);
                } else if (v instanceof SVFloat) {
                    out.put(e.getKey(), ((SVFloat) v).value);
                }
            }
            return out;
        }

        @Override
        public SVObject addOffset(int offset) {
            return new SVObject(offsetMap(attrs, offset), offsetMap(indices, offset), offsetMap(keyValues, offset),
                    addr.addOffset(offset), shape, source);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SVObject)) return false;
            SVObject v = (SVObject) o;
            return addr.equals(v.addr) && attrs.equals(v.attrs) && indices.equals(v.indices)
                    && keyValues.equals(v.keyValues) && Objects.equals(shape, v.shape);
        }

        @Override
        public int hashCode() {
            return Objects.hash(addr, attrs, indices, keyValues);
        }

        @Override
        public String toString() {
            String shapeStr = shape == null ? "" : ", " + shape;
            return "[" + addr.addr + "]{ " + mapToString(attrs) + ", " + mapToString(indices) + ", "
                    + mapToString(keyValues) + shapeStr + " }";
        }
    }

    /**
     * Tuple-like shape value. Wraps the object that holds its attributes and reports the shape
     * rank as {@code $length} and {@code index(shape, i)} at every index.
     */
    public static final class SVSize extends ShValue implements ObjectLike {
        public final SVObject object;
        public final ExpShape shape;

        public SVSize(SVObject object, ExpShape shape) {
            super(object.source);
            this.object = object;
            this.shape = shape;
        }

        public ExpNum rank() {
            return ExpShape.getRank(shape);
        }

        @Override public Type type() { return Type.SIZE; }
        @Override public SVAddr addr() { return object.addr; }
        @Override public SVObject object() { return object; }
        @Override public ExpShape shape() { return shape; }

        @Override
        public ShValue getAttr(String attr) {
            if ("$length".equals(attr)) {
                return SVInt.of(rank(), shape.source);
            }
            return object.getAttr(attr);
        }

        @Override
        public ShValue getIndice(int index) {
            return SVInt.of(ExpNum.index(shape, index, shape.source), shape.source);
        }

        @Override public ShValue getKeyVal(String key) { return object.getKeyVal(key); }

        @Override public SVSize setAttr(String attr, ShValue value) { return new SVSize(object.setAttr(attr, value), shape); }
        @Override public SVSize setIndice(int index, ShValue value) { return new SVSize(object.setIndice(index, value), shape); }
        @Override public SVSize setKeyVal(String key, ShValue value) { return new SVSize(object.setKeyVal(key, value), shape); }
        @Override public SVSize withAddr(SVAddr addr) { return new SVSize(object.withAddr(addr), shape); }

        @Override
        public SVSize addOffset(int offset) {
            return new SVSize(object.addOffset(offset), shape);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SVSize && ((SVSize) o).object.equals(object) && ((SVSize) o).shape.equals(shape);
        }

        @Override public int hashCode() { return object.hashCode() * 31 + shape.hashCode(); }
        @Override public String toString() { return "Size(" + shape + ")"; }
    }

    // ===================== FUNCTIONS =====================

    public static final class SVFunc extends ShValue {
        public final String name;
        public final List<String> params;
        public final PMap<String, ShValue> defaults;
        public final Stmt funcBody;
        public final boolean hasClosure;
        public final ShEnv funcEnv;
        // null when absent
        public final String varargsParam;
        public final String kwargsParam;
        // number of keyword-only parameters at the end of params
        public final int keyOnlyNum;

        private SVFunc(String name, List<String> params, PMap<String, ShValue> defaults, Stmt funcBody,
                       boolean hasClosure, ShEnv funcEnv, String varargsParam, String kwargsParam, int keyOnlyNum,
                       CodeSource source) {
            super(source);
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.defaults = defaults;
            this.funcBody = funcBody;
            this.hasClosure = hasClosure;
            this.funcEnv = funcEnv;
            this.varargsParam = varargsParam;
            this.kwargsParam = kwargsParam;
            this.keyOnlyNum = keyOnlyNum;
        }

        public static SVFunc create(String name, List<String> params, Stmt funcBody, boolean hasClosure, ShEnv funcEnv,
                                    CodeSource source) {
            return new SVFunc(name, params, PMap.empty(), funcBody, hasClosure, funcEnv, null, null, 0, source);
        }

        public SVFunc setDefaults(PMap<String, ShValue> newDefaults) {
            return new SVFunc(name, params, newDefaults, funcBody, hasClosure, funcEnv, varargsParam, kwargsParam,
                    keyOnlyNum, source);
        }

        /** Null arguments keep the current setting. */
        public SVFunc setVKParam(String varargs, String kwargs, Integer keyOnly) {
            return new SVFunc(name, params, defaults, funcBody, hasClosure, funcEnv,
                    varargs != null ? varargs : varargsParam,
                    kwargs != null ? kwargs : kwargsParam,
                    keyOnly != null ? keyOnly : keyOnlyNum, source);
        }

        public SVFunc withEnv(ShEnv env) {
            return new SVFunc(name, params, defaults, funcBody, hasClosure, env, varargsParam, kwargsParam,
                    keyOnlyNum, source);
        }

        /** Method bound to {@code selfAddr}: the first parameter is dropped and bound in the captured env. */
        public SVFunc bound(SVAddr selfAddr) {
            if (params.isEmpty()) {
                return this;
            }
            String selfName = params.get(0);
            ShEnv newEnv = funcEnv == null ? null : funcEnv.setId(selfName, selfAddr);
            return new SVFunc(name, params.subList(1, params.size()), defaults, funcBody, hasClosure, newEnv,
                    varargsParam, kwargsParam, keyOnlyNum, source);
        }

        @Override public Type type() { return Type.FUNC; }

        @Override
        public SVFunc addOffset(int offset) {
            return new SVFunc(name, params, offsetMap(defaults, offset), funcBody, hasClosure,
                    funcEnv == null ? null : funcEnv.addOffset(offset), varargsParam, kwargsParam, keyOnlyNum, source);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SVFunc)) return false;
            SVFunc f = (SVFunc) o;
            return name.equals(f.name) && params.equals(f.params) && funcBody == f.funcBody
                    && defaults.equals(f.defaults) && Objects.equals(funcEnv, f.funcEnv)
                    && Objects.equals(varargsParam, f.varargsParam) && Objects.equals(kwargsParam, f.kwargsParam)
                    && keyOnlyNum == f.keyOnlyNum;
        }

        @Override public int hashCode() { return Objects.hash(name, params); }
        @Override public String toString() { return name + "(" + String.join(", ", params) + ")"; }
    }

    // ===================== MARKERS =====================

    public static final class SVNone extends ShValue {
        private static final SVNone NONE = new SVNone(null);

        private SVNone(CodeSource source) { super(source); }

        public static SVNone create(CodeSource source) {
            return source == null ? NONE : new SVNone(source);
        }

        @Override public Type type() { return Type.NONE; }
        @Override public boolean equals(Object o) { return o instanceof SVNone; }
        @Override public int hashCode() { return 13; }
        @Override public String toString() { return "None"; }
    }

    public static final class SVNotImpl extends ShValue {
        public final String reason;

        private SVNotImpl(String reason, CodeSource source) {
            super(source);
            this.reason = reason;
        }

        public static SVNotImpl create(String reason, CodeSource source) {
            return new SVNotImpl(reason, source);
        }

        @Override public Type type() { return Type.NOT_IMPL; }
        @Override public boolean equals(Object o) { return o instanceof SVNotImpl && Objects.equals(((SVNotImpl) o).reason, reason); }
        @Override public int hashCode() { return 17; }
        @Override public String toString() { return "NotImpl(" + (reason == null ? "" : reason) + ")"; }
    }

    public static final class SVUndef extends ShValue {
        private static final SVUndef UNDEF = new SVUndef(null);

        private SVUndef(CodeSource source) { super(source); }

        public static SVUndef create(CodeSource source) {
            return source == null ? UNDEF : new SVUndef(source);
        }

        @Override public Type type() { return Type.UNDEF; }
        @Override public boolean equals(Object o) { return o instanceof SVUndef; }
        @Override public int hashCode() { return 19; }
        @Override public String toString() { return "UNDEF"; }
    }

    /** Error value. ERROR terminates a path when passed to fail; WARNING and LOG are only recorded. */
    public static final class SVError extends ShValue {
        public final String reason;
        public final ErrorLevel level;

        private SVError(String reason, ErrorLevel level, CodeSource source) {
            super(source);
            this.reason = reason;
            this.level = level;
        }

        public static SVError create(String reason, ErrorLevel level, CodeSource source) {
            return new SVError(reason, level, source);
        }

        public static SVError error(String reason, CodeSource source) {
            return new SVError(reason, ErrorLevel.ERROR, source);
        }

        public static SVError warn(String reason, CodeSource source) {
            return new SVError(reason, ErrorLevel.WARNING, source);
        }

        public static SVError log(String reason, CodeSource source) {
            return new SVError(reason, ErrorLevel.LOG, source);
        }

        @Override public Type type() { return Type.ERROR; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SVError)) return false;
            SVError e = (SVError) o;
            return reason.equals(e.reason) && level == e.level && Objects.equals(source, e.source);
        }

        @Override public int hashCode() { return reason.hashCode() * 3 + level.ordinal(); }

        @Override
        public String toString() {
            String lv = level == ErrorLevel.ERROR ? "Error" : level == ErrorLevel.WARNING ? "Warning" : "Log";
            return "SVError<" + lv + ": \"" + reason + "\">";
        }
    }
}
