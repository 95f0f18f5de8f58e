package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.PrintVisitor;

/**
 * Abstract base class for AST nodes that includes the source range the node
 * was parsed from. Synthesized nodes carry the range of the declaration they
 * were derived from, so diagnostics on them still point at user code.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public LocOffsets loc;

    protected AbstractNode(LocOffsets loc) {
        this.loc = loc == null ? LocOffsets.none() : loc;
    }

    @Override
    public LocOffsets getLoc() {
        return loc;
    }

    @Override
    public void setLoc(LocOffsets loc) {
        this.loc = loc;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        return PrintVisitor.print(this);
    }
}
