package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * A parameter with a default value. Wraps the parameter itself, which may
 * be a {@link KeywordArgNode}.
 */
public class OptionalArgNode extends AbstractNode {
    public Node expr;
    public Node defaultValue;

    public OptionalArgNode(Node expr, Node defaultValue, LocOffsets loc) {
        super(loc);
        this.expr = expr;
        this.defaultValue = defaultValue;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
