package com.shapetea.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.util.PMap;

/** Name to address mapping of one scope snapshot. */
public final class ShEnv {

    private static final ShEnv EMPTY = new ShEnv(PMap.empty());

    public final PMap<String, SVAddr> addrMap;

    private ShEnv(PMap<String, SVAddr> addrMap) {
        this.addrMap = addrMap;
    }

    public static ShEnv empty() {
        return EMPTY;
    }

    public boolean hasId(String id) {
        return addrMap.containsKey(id);
    }

    public SVAddr getId(String id) {
        return addrMap.get(id);
    }

    public ShEnv setId(String id, SVAddr addr) {
        PMap<String, SVAddr> next = addrMap.put(id, addr);
        return next == addrMap ? this : new ShEnv(next);
    }

    public ShEnv removeId(String id) {
        PMap<String, SVAddr> next = addrMap.remove(id);
        return next == addrMap ? this : new ShEnv(next);
    }

    public ShEnv addOffset(int offset) {
        return new ShEnv(addrMap.mapEntries((k, v) -> Map.entry(k, v.addOffset(offset))));
    }

    /** Entries of {@code other} override ours. */
    public ShEnv mergeAddr(ShEnv other) {
        return new ShEnv(addrMap.putAll(other.addrMap.asMap()));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ShEnv && ((ShEnv) o).addrMap.equals(addrMap);
    }

    @Override
    public int hashCode() {
        return addrMap.hashCode();
    }

    @Override
    public String toString() {
        List<String> keys = new ArrayList<>(addrMap.keySet());
        Collections.sort(keys);
        StringBuilder sb = new StringBuilder("{\n");
        for (String k : keys) {
            sb.append("  ").append(k).append(" => ").append(addrMap.get(k).addr).append(",\n");
        }
        return sb.append("}").toString();
    }
}
