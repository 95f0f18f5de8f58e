package org.rbtyper.core.errors;

import org.rbtyper.core.Loc;

/**
 * A proposed source edit attached to a {@link Diagnostic}: replace the text
 * at {@code loc} with {@code replacement}.
 */
public final class AutocorrectSuggestion {
    public final String title;
    public final Loc loc;
    public final String replacement;

    public AutocorrectSuggestion(String title, Loc loc, String replacement) {
        this.title = title;
        this.loc = loc;
        this.replacement = replacement;
    }

    @Override
    public String toString() {
        return title + ": " + replacement;
    }
}
