package org.rbtyper.core.errors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only diagnostic sink shared by every rewriter invocation of a run.
 * Pushing is safe from several threads.
 */
public class ErrorQueue {
    private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    public void push(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * Returns a snapshot of everything pushed so far, in push order.
     */
    public List<Diagnostic> snapshot() {
        return new ArrayList<>(diagnostics);
    }

    /**
     * Removes and returns everything pushed so far.
     */
    public List<Diagnostic> drain() {
        List<Diagnostic> result = new ArrayList<>();
        Diagnostic d;
        while ((d = diagnostics.poll()) != null) {
            result.add(d);
        }
        return result;
    }
}
