package org.rbtyper.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options for one run of the rewriter passes.
 * <p>
 * {@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code rbtyper.autogen} - run in signature-autogeneration mode</li>
 *   <li>{@code rbtyper.suppressErrors} - comma-separated error codes to drop</li>
 * </ul>
 */
public class RewriterOptions implements Cloneable {
    public boolean runningUnderAutogen = false;
    public Set<Integer> suppressedErrorClasses = new LinkedHashSet<>();

    public static RewriterOptions fromSystemProperties() {
        RewriterOptions options = new RewriterOptions();
        options.runningUnderAutogen = Boolean.getBoolean("rbtyper.autogen");
        String suppressed = System.getProperty("rbtyper.suppressErrors");
        if (suppressed != null) {
            for (String code : suppressed.split(",")) {
                String trimmed = code.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    options.suppressedErrorClasses.add(Integer.parseInt(trimmed));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("rbtyper.suppressErrors: not an error code: " + trimmed, e);
                }
            }
        }
        return options;
    }

    @Override
    public RewriterOptions clone() {
        try {
            RewriterOptions copy = (RewriterOptions) super.clone();
            copy.suppressedErrorClasses = new LinkedHashSet<>(suppressedErrorClasses);
            return copy;
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "RewriterOptions{\n" +
                "    runningUnderAutogen=" + runningUnderAutogen + ",\n" +
                "    suppressedErrorClasses=" + suppressedErrorClasses + "\n" +
                "}";
    }
}
