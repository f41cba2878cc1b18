package com.shapetea.service;

import java.io.PrintStream;

import com.shapetea.context.AnalysisSession;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.PathGovernor;
import com.shapetea.context.ShValue;
import com.shapetea.debug.Debug;
import com.shapetea.interpreter.Interpreter;
import com.shapetea.interpreter.LibCallRegistry;
import com.shapetea.ir.Statement;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.plugins.BuiltinsPlugin;
import com.shapetea.plugins.ShapePlugin;

/**
 * Drives one analysis: sets up a session with the path governor, optionally runs a builtin
 * module underneath the entry, runs the entry statement and collects the resulting paths.
 *
 * <pre>
 * ShapeTeaService service = new ShapeTeaService(AnalysisOptions.fromJson(json));
 * AnalysisResult result = service.analyze("main", builtins, entry);
 * service.printLog(result, System.out);
 * </pre>
 */
public final class ShapeTeaService {

    private final AnalysisOptions options;
    private final LibCallRegistry registry;
    private final Interpreter interpreter;
    private AnalysisErrorReporter errorReporter;

    public ShapeTeaService() {
        this(AnalysisOptions.defaults());
    }

    public ShapeTeaService(AnalysisOptions options) {
        if (options == null) throw new ShapeTeaException("options are null");
        this.options = options;
        this.registry = new LibCallRegistry();
        BuiltinsPlugin.register(registry, options.ignoreAssert(), options.variableRanges());
        ShapePlugin.register(registry);
        this.interpreter = new Interpreter(registry);
    }

    public AnalysisOptions options() {
        return options;
    }

    /** Intrinsic table; hosts may register more before analysing. */
    public LibCallRegistry registry() {
        return registry;
    }

    public Interpreter interpreter() {
        return interpreter;
    }

    public void setErrorReporter(AnalysisErrorReporter reporter) {
        this.errorReporter = reporter;
    }

    public AnalysisResult analyze(String entryName, Stmt entry) {
        return analyze(entryName, null, entry);
    }

    /**
     * @param builtin module run first and shifted below user addresses; may be null
     */
    public AnalysisResult analyze(String entryName, Statement.Let builtin, Stmt entry) {
        if (entry == null) throw new ShapeTeaException("entry statement is null");
        String name = entryName == null ? "<entry>" : entryName;

        AnalysisSession session = new AnalysisSession(options.immediateConstraintCheck());
        PathGovernor governor = new PathGovernor(options.maxPath(), options.timeoutMs());
        session.setGovernor(governor);
        governor.start();

        long started = System.currentTimeMillis();
        Debug.get().i(Debug.TAG_SERVICE, "analysing " + name + " with " + options);
        try {
            Context<ShValue> root = session.newContext(name);
            ContextSet<ShValue> start = builtin == null ? root.toSet() : interpreter.runBuiltin(root, builtin);
            if (builtin != null) {
                Debug.get().d(Debug.TAG_SERVICE, "builtin module ready: " + start);
            }
            ContextSet<Object> result = interpreter.run(start, entry);
            AnalysisResult out = new AnalysisResult(name, result, System.currentTimeMillis() - started);
            Debug.get().i(Debug.TAG_SERVICE, out.toString());
            return out;
        } catch (RuntimeException e) {
            if (errorReporter == null) throw e;
            Debug.get().e(Debug.TAG_SERVICE, "analysis of " + name + " aborted", e);
            errorReporter.report(name, e);
            return AnalysisResult.aborted(name, System.currentTimeMillis() - started);
        }
    }

    public void printLog(AnalysisResult result, PrintStream out) {
        new ResultLogPrinter(options.logLevel()).print(result, out);
    }
}
