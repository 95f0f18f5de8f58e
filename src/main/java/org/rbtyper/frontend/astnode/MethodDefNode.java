package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.List;

/**
 * The MethodDefNode class represents a method definition ({@code def name(args) body end}).
 */
public class MethodDefNode extends AbstractNode {
    /**
     * The range of the {@code def name(args)} header.
     */
    public final LocOffsets declLoc;
    public final String name;
    /**
     * The parameters: locals, possibly wrapped in keyword, optional or rest markers.
     */
    public final List<Node> args;
    public Node body;
    /**
     * {@code def self.name}.
     */
    public final boolean isSelfMethod;
    /**
     * True when a rewriter pass created this method rather than the user.
     */
    public final boolean isRewriterSynthesized;

    public MethodDefNode(LocOffsets declLoc, String name, List<Node> args, Node body,
                         boolean isSelfMethod, boolean isRewriterSynthesized, LocOffsets loc) {
        super(loc);
        this.declLoc = declLoc;
        this.name = name;
        this.args = args;
        this.body = body;
        this.isSelfMethod = isSelfMethod;
        this.isRewriterSynthesized = isRewriterSynthesized;
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
