package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The HashLiteralNode class represents a node in the abstract syntax tree (AST) that holds
 * a map literal {@code {k1 => v1, k2: v2}}. Keys and values are kept in parallel lists.
 */
public class HashLiteralNode extends AbstractNode {
    public final List<Node> keys;
    public final List<Node> values;

    public HashLiteralNode(List<Node> keys, List<Node> values, LocOffsets loc) {
        super(loc);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("hash literal with " + keys.size() + " keys and "
                    + values.size() + " values");
        }
        this.keys = keys;
        this.values = values;
    }

    public HashLiteralNode(LocOffsets loc) {
        this(new ArrayList<>(), new ArrayList<>(), loc);
    }

    public int size() {
        return keys.size();
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
