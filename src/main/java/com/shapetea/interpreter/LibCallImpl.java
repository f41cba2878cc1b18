package com.shapetea.interpreter;

import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.ShValue;
import com.shapetea.ir.CodeSource;

/** Functional interface for library intrinsics reachable through a LibCall expression. */
@FunctionalInterface
public interface LibCallImpl {
    ContextSet<ShValue> call(Interpreter interp, Context<LibCallParams> ctx, CodeSource source);
}
