package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * {@code self}, explicit or implied by a receiverless call.
 */
public class SelfNode extends AbstractNode {

    public SelfNode(LocOffsets loc) {
        super(loc);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
