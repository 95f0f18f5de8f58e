package org.rbtyper.core.errors;

import java.io.Serial;

/**
 * Thrown when the rewriter reaches a state its own invariants rule out.
 * These are programmer errors and never a response to user input, which is
 * reported through diagnostics instead.
 */
public class RewriterException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public RewriterException(String message) {
        super(message);
    }

    public RewriterException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Throws a RewriterException with {@code message} unless {@code condition} holds.
     *
     * @param condition the invariant
     * @param message   the detail message describing the violation
     */
    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new RewriterException(message);
        }
    }
}
