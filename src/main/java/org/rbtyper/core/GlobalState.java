package org.rbtyper.core;

import org.rbtyper.core.errors.ErrorQueue;
import org.rbtyper.symbols.NameTable;

/**
 * State shared by every pass of one analyzer run: the name table, the
 * diagnostic sink and the options the run was started with.
 */
public class GlobalState {
    public final NameTable names;
    public final ErrorQueue errorQueue;
    public final RewriterOptions options;

    public GlobalState(RewriterOptions options) {
        this.names = new NameTable();
        this.errorQueue = new ErrorQueue();
        this.options = options.clone();
    }

    public GlobalState() {
        this(new RewriterOptions());
    }

    public boolean shouldReport(int errorCode) {
        return !options.suppressedErrorClasses.contains(errorCode);
    }

    /**
     * Creates the context for rewriting one file.
     */
    public MutableContext contextFor(SourceFile file) {
        return new MutableContext(this, file, options.runningUnderAutogen);
    }
}
