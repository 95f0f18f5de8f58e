package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;
import org.rbtyper.symbols.SymbolRef;

/**
 * A constant that already points at a known symbol. Before resolution the
 * only ones in a tree are the root scope marker and constants the rewriters
 * synthesize themselves.
 */
public class ConstantNode extends AbstractNode {
    public final SymbolRef symbol;

    public ConstantNode(SymbolRef symbol, LocOffsets loc) {
        super(loc);
        this.symbol = symbol;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
