package org.rbtyper.symbols;

/**
 * A reference to a class or module the front end knows about before
 * resolution runs. Only the well-known entries in {@link Symbols} exist at
 * rewrite time.
 */
public final class SymbolRef {
    public final int id;
    public final String name;
    public final SymbolRef owner;

    SymbolRef(int id, String name, SymbolRef owner) {
        this.id = id;
        this.name = name;
        this.owner = owner;
    }

    public boolean isRoot() {
        return owner == null;
    }

    /**
     * Returns the fully-qualified name, e.g. {@code T::Struct}.
     */
    public String show() {
        if (isRoot()) {
            return "<root>";
        }
        if (owner.isRoot()) {
            return name;
        }
        return owner.show() + "::" + name;
    }

    @Override
    public String toString() {
        return show();
    }
}
