package org.rbtyper.frontend.astnode;

/**
 * The kinds of value a {@link LiteralNode} can hold.
 */
public enum LiteralKind {
    NIL,
    TRUE,
    FALSE,
    INTEGER,
    FLOAT,
    STRING,
    /** An interned identifier written {@code :name}. */
    SYMBOL
}
