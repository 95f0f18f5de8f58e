package org.rbtyper.core.errors;

import org.rbtyper.core.Loc;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the parts of one diagnostic and pushes it to the queue when
 * closed. Builders for suppressed error classes are inactive: every setter
 * is a no-op and nothing is pushed.
 * <pre>
 * try (ErrorBuilder e = ctx.beginError(loc, RewriterErrors.COMPUTED_BY_SYMBOL)) {
 *     e.setHeader("...");
 * }
 * </pre>
 */
public class ErrorBuilder implements AutoCloseable {
    private final ErrorQueue queue;
    private final ErrorClass errorClass;
    private final Loc loc;
    private final boolean active;
    private final List<AutocorrectSuggestion> suggestions = new ArrayList<>();
    private String header;
    private boolean closed;

    public ErrorBuilder(ErrorQueue queue, ErrorClass errorClass, Loc loc, boolean active) {
        this.queue = queue;
        this.errorClass = errorClass;
        this.loc = loc;
        this.active = active;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Sets the message. {@code {}} placeholders are filled with
     * {@code args} in order.
     */
    public ErrorBuilder setHeader(String format, Object... args) {
        if (active) {
            this.header = ErrorMessageUtil.substitute(format, args);
        }
        return this;
    }

    /**
     * Attaches a suggested replacement of the text at {@code replaceLoc}.
     */
    public ErrorBuilder replaceWith(String title, Loc replaceLoc, String format, Object... args) {
        if (active) {
            suggestions.add(new AutocorrectSuggestion(title, replaceLoc,
                    ErrorMessageUtil.substitute(format, args)));
        }
        return this;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!active) {
            return;
        }
        if (header == null) {
            throw new RewriterException("diagnostic " + errorClass + " closed without a header");
        }
        queue.push(new Diagnostic(errorClass, loc, header, suggestions));
    }
}
