package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * A splat parameter: {@code *args}, or {@code **opts} when it wraps a
 * {@link KeywordArgNode}.
 */
public class RestArgNode extends AbstractNode {
    public Node expr;

    public RestArgNode(Node expr, LocOffsets loc) {
        super(loc);
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
