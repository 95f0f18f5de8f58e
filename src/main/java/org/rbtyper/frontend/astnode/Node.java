package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.CloneVisitor;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * The Node interface represents a node in the abstract syntax tree (AST).
 * The set of node classes is closed: every implementation has a matching
 * {@code visit} method on {@link Visitor}, so a visitor that compiles covers
 * every kind of node.
 * <p>
 * A node has exactly one owner. Code that needs the same subtree in two
 * places must take a {@link #deepCopy()} for the second use.
 */
public interface Node {
    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    LocOffsets getLoc();

    void setLoc(LocOffsets loc);

    /**
     * Returns an independent copy of this subtree. No node of the copy is
     * shared with the original.
     */
    default Node deepCopy() {
        return CloneVisitor.clone(this);
    }
}
