package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * Marks a method parameter as a keyword parameter ({@code name:}).
 */
public class KeywordArgNode extends AbstractNode {
    public Node expr;

    public KeywordArgNode(Node expr, LocOffsets loc) {
        super(loc);
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
