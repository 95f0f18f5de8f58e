package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.List;

/**
 * A literal block attached to a call: {@code { |params| body }},
 * {@code do ... end}, or the body of {@code -> { }}.
 */
public class ClosureNode extends AbstractNode {
    /**
     * The block parameters, as argument nodes.
     */
    public final List<Node> params;
    public Node body;

    public ClosureNode(List<Node> params, Node body, LocOffsets loc) {
        super(loc);
        this.params = params;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
