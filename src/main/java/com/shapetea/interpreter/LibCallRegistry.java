package com.shapetea.interpreter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to intrinsic table consulted by LibCall expressions. Plugins fill it through their
 * static {@code register} methods; later registrations replace earlier ones.
 */
public final class LibCallRegistry {

    private final Map<String, LibCallImpl> impls = new LinkedHashMap<>();

    public LibCallRegistry register(String name, LibCallImpl impl) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("libcall name is empty");
        if (impl == null) throw new IllegalArgumentException("libcall " + name + " has no implementation");
        impls.put(name, impl);
        return this;
    }

    public LibCallImpl get(String name) {
        return impls.get(name);
    }

    public boolean has(String name) {
        return impls.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(impls.keySet());
    }
}
