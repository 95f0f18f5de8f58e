package org.rbtyper.core.errors;

import org.rbtyper.core.Loc;

import java.util.Collections;
import java.util.List;

/**
 * A finished diagnostic as stored in the {@link ErrorQueue}.
 */
public final class Diagnostic {
    public final ErrorClass errorClass;
    public final Loc loc;
    public final String header;
    public final List<AutocorrectSuggestion> suggestions;

    public Diagnostic(ErrorClass errorClass, Loc loc, String header, List<AutocorrectSuggestion> suggestions) {
        this.errorClass = errorClass;
        this.loc = loc;
        this.header = header;
        this.suggestions = Collections.unmodifiableList(suggestions);
    }

    @Override
    public String toString() {
        return ErrorMessageUtil.format(this);
    }
}
