package com.shapetea.util;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent append-only list. Instances share one backing array and only see their own
 * prefix of it; appending to the newest instance extends the array in place, appending to
 * an older one copies its prefix first.
 */
public final class PList<T> extends AbstractList<T> {

    private final ArrayList<T> backing;
    private final int size;

    private PList(ArrayList<T> backing, int size) {
        this.backing = backing;
        this.size = size;
    }

    public static <T> PList<T> empty() {
        return new PList<>(new ArrayList<>(), 0);
    }

    public PList<T> append(T value) {
        synchronized (backing) {
            if (backing.size() == size) {
                backing.add(value);
                return new PList<>(backing, size + 1);
            }
        }
        ArrayList<T> copy = new ArrayList<>(Math.max(16, size * 2));
        copy.addAll(backing.subList(0, size));
        copy.add(value);
        return new PList<>(copy, size + 1);
    }

    @Override
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " of " + size);
        }
        return backing.get(index);
    }

    @Override
    public int size() {
        return size;
    }

    public List<T> toList() {
        return new ArrayList<>(backing.subList(0, size));
    }
}
