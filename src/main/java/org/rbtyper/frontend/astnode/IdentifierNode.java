package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * The IdentifierNode class represents a variable reference: a local, an
 * instance variable ({@code @name}), a class variable or a global. Instance
 * variable names include their sigil.
 */
public class IdentifierNode extends AbstractNode {
    public final IdentifierKind kind;
    /**
     * The identifier name represented by this node.
     */
    public final String name;

    public IdentifierNode(IdentifierKind kind, String name, LocOffsets loc) {
        super(loc);
        this.kind = kind;
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
