package org.rbtyper.core.errors;

/**
 * A numbered family of diagnostics. Codes are stable so users can silence a
 * family through {@code RewriterOptions.suppressedErrorClasses}.
 */
public final class ErrorClass {
    public final int code;
    public final String name;

    public ErrorClass(int code, String name) {
        this.code = code;
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorClass other && other.code == code;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(code);
    }

    @Override
    public String toString() {
        return name + "(" + code + ")";
    }
}
