package com.shapetea.context;

import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.IdManager;
import com.shapetea.context.ShValue.SVNone;

/**
 * Per-run shared state: the symbol/constraint id source, the fail id counter and the path
 * governor. Every context forked from one root refers to the same session, so two analyses
 * in one process never share counters.
 */
public final class AnalysisSession {

    private final IdManager idManager = new IdManager();
    private final boolean immediateCheck;
    private PathGovernor governor = PathGovernor.UNLIMITED;
    private int failIdMax;

    public AnalysisSession() {
        this(true);
    }

    public AnalysisSession(boolean immediateCheck) {
        this.immediateCheck = immediateCheck;
    }

    public IdManager idManager() {
        return idManager;
    }

    public PathGovernor governor() {
        return governor;
    }

    public void setGovernor(PathGovernor governor) {
        this.governor = governor == null ? PathGovernor.UNLIMITED : governor;
    }

    public int nextFailId() {
        return ++failIdMax;
    }

    /** Empty root context: no bindings, empty heap, empty constraint set, None as result. */
    public Context<ShValue> newContext(String relPath) {
        return Context.root(this, ConstraintSet.create(idManager, immediateCheck), relPath)
                .setRetVal((ShValue) SVNone.create(null));
    }
}
