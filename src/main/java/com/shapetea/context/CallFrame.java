package com.shapetea.context;

import com.shapetea.context.ShValue.SVFunc;
import com.shapetea.ir.CodeSource;

/** One call stack entry: a user function or the name of a library intrinsic. */
public final class CallFrame {
    // SVFunc or String
    public final Object callee;
    public final CodeSource source;

    public CallFrame(SVFunc func, CodeSource source) {
        this.callee = func;
        this.source = source;
    }

    public CallFrame(String libCallName, CodeSource source) {
        this.callee = libCallName;
        this.source = source;
    }

    public String name() {
        return callee instanceof SVFunc ? ((SVFunc) callee).name : (String) callee;
    }

    @Override
    public String toString() {
        return name() + (source == null ? "" : " - " + source);
    }
}
