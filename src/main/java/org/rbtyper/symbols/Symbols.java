package org.rbtyper.symbols;

/**
 * Marker symbols the rewriter builds constant references to. They are
 * immutable and shared by all invocations.
 */
public final class Symbols {
    public static final SymbolRef ROOT = new SymbolRef(0, "<root>", null);
    public static final SymbolRef T = new SymbolRef(1, Names.CONSTANT_T, ROOT);
    public static final SymbolRef T_STRUCT = new SymbolRef(2, Names.CONSTANT_STRUCT, T);
    public static final SymbolRef STRING = new SymbolRef(3, "String", ROOT);
    public static final SymbolRef FLOAT = new SymbolRef(4, "Float", ROOT);
    public static final SymbolRef KERNEL = new SymbolRef(5, Names.CONSTANT_KERNEL, ROOT);
    public static final SymbolRef HASH = new SymbolRef(6, Names.CONSTANT_HASH, ROOT);
    public static final SymbolRef ARRAY = new SymbolRef(7, Names.CONSTANT_ARRAY, ROOT);
    public static final SymbolRef T_HASH = new SymbolRef(8, Names.CONSTANT_HASH, T);
    public static final SymbolRef T_ARRAY = new SymbolRef(9, Names.CONSTANT_ARRAY, T);

    private Symbols() {
    }
}
