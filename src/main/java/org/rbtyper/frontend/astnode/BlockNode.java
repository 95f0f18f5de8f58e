package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.List;

/**
 * The BlockNode class represents a sequence of statements evaluated in order.
 * The value of the block is the value of its last element.
 */
public class BlockNode extends AbstractNode {
    /**
     * The list of child nodes contained in this BlockNode.
     */
    public final List<Node> elements;

    public BlockNode(List<Node> elements, LocOffsets loc) {
        super(loc);
        this.elements = elements;
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the AST nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
