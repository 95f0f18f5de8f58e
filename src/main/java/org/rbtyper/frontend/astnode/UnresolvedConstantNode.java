package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * A constant reference as written in source, e.g. {@code Foo},
 * {@code ::Foo} or {@code A::B::Foo}. Nothing has been resolved yet, so
 * the rewriter can only reason about its spelling.
 */
public class UnresolvedConstantNode extends AbstractNode {
    /**
     * The enclosing scope: an {@link EmptyNode} for a bare constant, a
     * {@link ConstantNode} for the root scope ({@code ::Foo}), or another
     * constant.
     */
    public Node scope;
    /**
     * The constant's own name.
     */
    public final String cnst;

    public UnresolvedConstantNode(Node scope, String cnst, LocOffsets loc) {
        super(loc);
        this.scope = scope;
        this.cnst = cnst;
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
