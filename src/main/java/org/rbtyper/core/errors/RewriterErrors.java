package org.rbtyper.core.errors;

/**
 * Diagnostics raised by the rewriter passes (35xx).
 */
public final class RewriterErrors {
    public static final ErrorClass PROP_FOREIGN_STRICT = new ErrorClass(3506, "PropForeignStrict");
    public static final ErrorClass COMPUTED_BY_SYMBOL = new ErrorClass(3508, "ComputedBySymbol");

    private RewriterErrors() {
    }
}
