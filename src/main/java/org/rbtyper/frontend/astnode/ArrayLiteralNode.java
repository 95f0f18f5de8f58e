package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.List;

/**
 * The ArrayLiteralNode class represents a node in the abstract syntax tree (AST) that holds
 * a list of other nodes surrounded by `[` `]`.
 */
public class ArrayLiteralNode extends AbstractNode {
    /**
     * The list of child nodes contained in this Node
     */
    public final List<Node> elements;

    public ArrayLiteralNode(List<Node> elements, LocOffsets loc) {
        super(loc);
        this.elements = elements;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
