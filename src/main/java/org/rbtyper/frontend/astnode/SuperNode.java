package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * A bare {@code super}: calls the superclass method, implicitly forwarding
 * the current method's arguments.
 */
public class SuperNode extends AbstractNode {

    public SuperNode(LocOffsets loc) {
        super(loc);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
