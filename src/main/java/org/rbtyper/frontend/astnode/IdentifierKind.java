package org.rbtyper.frontend.astnode;

public enum IdentifierKind {
    LOCAL,
    INSTANCE,
    CLASS_VARIABLE,
    GLOBAL
}
