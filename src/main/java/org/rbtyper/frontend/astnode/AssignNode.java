package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * {@code lhs = rhs}.
 */
public class AssignNode extends AbstractNode {
    public Node lhs;
    public Node rhs;

    public AssignNode(Node lhs, Node rhs, LocOffsets loc) {
        super(loc);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
