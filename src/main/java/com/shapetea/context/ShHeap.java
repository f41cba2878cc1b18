package com.shapetea.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVFunc;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.ir.CodeSource;
import com.shapetea.util.PMap;

/**
 * Address to value store. Fresh addresses come from a monotonic {@code addrMax}; negative
 * addresses belong to a builtin layer shifted down by {@link #addOffset(int)}.
 */
public final class ShHeap {

    private static final ShHeap EMPTY = new ShHeap(PMap.empty(), -1);

    public final PMap<Integer, ShValue> valMap;
    public final int addrMax;

    private ShHeap(PMap<Integer, ShValue> valMap, int addrMax) {
        this.valMap = valMap;
        this.addrMax = addrMax;
    }

    public static ShHeap empty() {
        return EMPTY;
    }

    /** Result of a fresh allocation. */
    public static final class Allocated {
        public final SVAddr addr;
        public final ShHeap heap;

        Allocated(SVAddr addr, ShHeap heap) {
            this.addr = addr;
            this.heap = heap;
        }
    }

    public ShValue getVal(SVAddr addr) {
        return valMap.get(addr.addr);
    }

    public ShValue getVal(int addr) {
        return valMap.get(addr);
    }

    /** Follows address chains; null when a link is dangling. */
    public ShValue getValRecur(SVAddr addr) {
        ShValue value = valMap.get(addr.addr);
        int guard = 0;
        while (value instanceof SVAddr && guard++ < valMap.size() + 1) {
            value = valMap.get(((SVAddr) value).addr);
        }
        return value;
    }

    /** The value behind {@code value} if it is an address chain, otherwise {@code value} itself. */
    public ShValue fetchAddr(ShValue value) {
        if (value instanceof SVAddr) {
            return getValRecur((SVAddr) value);
        }
        return value;
    }

    /**
     * Resolves an address chain to its end value unless that value is an object, in which case
     * the last address is kept. Null when the chain dangles.
     */
    public ShValue sanitizeAddr(ShValue value) {
        if (!(value instanceof SVAddr)) {
            return value;
        }
        SVAddr addr = (SVAddr) value;
        ShValue fetched = valMap.get(addr.addr);
        while (fetched instanceof SVAddr) {
            addr = (SVAddr) fetched;
            fetched = valMap.get(addr.addr);
        }
        if (fetched == null) {
            return null;
        }
        return fetched instanceof ObjectLike ? addr : fetched;
    }

    public ShHeap setVal(SVAddr addr, ShValue value) {
        return setVal(addr.addr, value);
    }

    public ShHeap setVal(int addr, ShValue value) {
        return new ShHeap(valMap.put(addr, value), Math.max(addrMax, addr));
    }

    public Allocated malloc(CodeSource source) {
        int addr = addrMax + 1;
        return new Allocated(new SVAddr(addr, source), new ShHeap(valMap, addr));
    }

    public Allocated allocNew(ShValue value, CodeSource source) {
        Allocated alloc = malloc(source);
        return new Allocated(alloc.addr, alloc.heap.setVal(alloc.addr, value));
    }

    /** Drops {@code addr}; freeing the top address also gives it back to the allocator. */
    public ShHeap free(SVAddr addr) {
        PMap<Integer, ShValue> next = valMap.remove(addr.addr);
        int max = addr.addr == addrMax ? addrMax - 1 : addrMax;
        return new ShHeap(next, max);
    }

    /** Shifts every non-negative address (keys and stored addresses) by {@code offset}. */
    public ShHeap addOffset(int offset) {
        Map<Integer, ShValue> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, ShValue> e : valMap.entrySet()) {
            int key = e.getKey() >= 0 ? e.getKey() + offset : e.getKey();
            out.put(key, e.getValue().addOffset(offset));
        }
        return new ShHeap(PMap.of(out), addrMax + offset);
    }

    public ShHeap filter(BiPredicate<Integer, ShValue> predicate) {
        Map<Integer, ShValue> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, ShValue> e : valMap.entrySet()) {
            if (predicate.test(e.getKey(), e.getValue())) out.put(e.getKey(), e.getValue());
        }
        return new ShHeap(PMap.of(out), addrMax);
    }

    /** Entries at addresses {@code <= limit}. */
    public Map<Integer, ShValue> entriesUpTo(int limit) {
        Map<Integer, ShValue> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, ShValue> e : valMap.entrySet()) {
            if (e.getKey() <= limit) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    /**
     * Mark and sweep with the given environments as roots. Negative (builtin) addresses are
     * always kept. Never run this while an interpreter still holds addresses outside those envs.
     */
    public ShHeap runGC(List<ShEnv> roots) {
        Set<Integer> marked = new HashSet<>();
        List<ShValue> work = new ArrayList<>();
        for (ShEnv env : roots) {
            work.addAll(env.addrMap.asMap().values());
        }
        while (!work.isEmpty()) {
            ShValue value = work.remove(work.size() - 1);
            if (value instanceof SVAddr) {
                int addr = ((SVAddr) value).addr;
                if (!marked.add(addr)) continue;
                ShValue target = valMap.get(addr);
                if (target != null) work.add(target);
            } else if (value instanceof ObjectLike) {
                ShValue.SVObject obj = ((ObjectLike) value).object();
                work.addAll(obj.attrs.asMap().values());
                work.addAll(obj.indices.asMap().values());
                work.addAll(obj.keyValues.asMap().values());
            } else if (value instanceof SVFunc) {
                SVFunc f = (SVFunc) value;
                work.addAll(f.defaults.asMap().values());
                if (f.funcEnv != null) work.addAll(f.funcEnv.addrMap.asMap().values());
            }
        }
        return filter((k, v) -> k < 0 || marked.contains(k));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ShHeap && ((ShHeap) o).addrMax == addrMax && ((ShHeap) o).valMap.equals(valMap);
    }

    @Override
    public int hashCode() {
        return valMap.hashCode() * 31 + addrMax;
    }

    @Override
    public String toString() {
        List<Integer> keys = new ArrayList<>(valMap.keySet());
        Collections.sort(keys);
        StringBuilder sb = new StringBuilder("{\n");
        for (Integer k : keys) {
            sb.append("  ").append(k).append(" => ").append(valMap.get(k)).append(",\n");
        }
        return sb.append("}").toString();
    }
}
