package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The SendNode class represents a method call: {@code recv.fun(args) { block }}.
 * Receiverless calls have a {@link SelfNode} receiver. Keyword arguments are
 * passed as a trailing {@link HashLiteralNode}.
 */
public class SendNode extends AbstractNode {
    /**
     * The receiver of the call.
     */
    public Node recv;
    /**
     * The method name.
     */
    public final String fun;
    /**
     * The positional arguments.
     */
    public final List<Node> args;
    /**
     * The literal block passed to the call, or null.
     */
    public ClosureNode block;

    public SendNode(Node recv, String fun, List<Node> args, ClosureNode block, LocOffsets loc) {
        super(loc);
        this.recv = recv;
        this.fun = fun;
        this.args = args;
        this.block = block;
    }

    public SendNode(Node recv, String fun, List<Node> args, LocOffsets loc) {
        this(recv, fun, args, null, loc);
    }

    public SendNode(Node recv, String fun, LocOffsets loc) {
        this(recv, fun, new ArrayList<>(), null, loc);
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
