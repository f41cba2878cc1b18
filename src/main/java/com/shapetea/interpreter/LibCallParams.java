package com.shapetea.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.shapetea.context.ShValue;

/**
 * Evaluated arguments of one intrinsic call, in source order. Positional arguments carry an
 * empty name.
 */
public final class LibCallParams {

    private final List<String> names;
    private final List<ShValue> values;

    public LibCallParams(List<String> names, List<ShValue> values) {
        if (names.size() != values.size()) {
            throw new IllegalArgumentException("names and values differ in length");
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static LibCallParams positional(List<ShValue> values) {
        return new LibCallParams(Collections.nCopies(values.size(), ""), values);
    }

    public int size() {
        return values.size();
    }

    public List<String> names() {
        return names;
    }

    public List<ShValue> values() {
        return values;
    }

    public String name(int index) {
        return names.get(index);
    }

    /** Null when out of range. */
    public ShValue get(int index) {
        return index >= 0 && index < values.size() ? values.get(index) : null;
    }

    /** First argument passed under {@code name}, or null. */
    public ShValue get(String name) {
        int idx = names.indexOf(name);
        return idx < 0 ? null : values.get(idx);
    }

    public boolean has(String name) {
        return names.contains(name);
    }

    public LibCallParams dropFirst() {
        if (values.isEmpty()) return this;
        return new LibCallParams(names.subList(1, names.size()), values.subList(1, values.size()));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            if (!names.get(i).isEmpty()) sb.append(names.get(i)).append('=');
            sb.append(values.get(i));
        }
        return sb.append(')').toString();
    }
}
