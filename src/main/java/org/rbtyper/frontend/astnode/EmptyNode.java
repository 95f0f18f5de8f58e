package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * Placeholder for an absent expression: a constant with no explicit scope,
 * a method without a body.
 */
public class EmptyNode extends AbstractNode {

    public EmptyNode() {
        super(LocOffsets.none());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
