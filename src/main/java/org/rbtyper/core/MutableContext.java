package org.rbtyper.core;

import org.rbtyper.core.errors.ErrorBuilder;
import org.rbtyper.core.errors.ErrorClass;

/**
 * Per-invocation context handed to a rewriter pass: the shared
 * {@link GlobalState}, the file being rewritten, and whether the run is in
 * signature-autogeneration mode.
 */
public class MutableContext {
    public final GlobalState state;
    public final SourceFile file;
    private final boolean runningUnderAutogen;

    public MutableContext(GlobalState state, SourceFile file, boolean runningUnderAutogen) {
        this.state = state;
        this.file = file;
        this.runningUnderAutogen = runningUnderAutogen;
    }

    public boolean runningUnderAutogen() {
        return runningUnderAutogen;
    }

    public MutableContext withAutogen(boolean autogen) {
        return new MutableContext(state, file, autogen);
    }

    public Loc locAt(LocOffsets offsets) {
        return new Loc(file, offsets);
    }

    public String enterName(String text) {
        return state.names.enterName(text);
    }

    /**
     * Opens a diagnostic at {@code loc}. The builder is inactive when the
     * error class is suppressed.
     */
    public ErrorBuilder beginError(LocOffsets loc, ErrorClass errorClass) {
        return new ErrorBuilder(state.errorQueue, errorClass, locAt(loc), state.shouldReport(errorClass.code));
    }
}
