package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The ClassDefNode class represents a class or module body.
 * <p>
 * {@code rhs} is the statement list of the body. The constructor copies the
 * lists it is given, so rewriter passes can replace the contents of
 * {@code rhs} in place whatever kind of list the caller built.
 */
public class ClassDefNode extends AbstractNode {
    public enum Kind {
        CLASS,
        MODULE
    }

    public final Kind kind;
    /**
     * The range of the {@code class Name < Super} header.
     */
    public final LocOffsets declLoc;
    public Node name;
    /**
     * Superclass first, then any mixins.
     */
    public final List<Node> ancestors;
    public final List<Node> rhs;

    public ClassDefNode(Kind kind, LocOffsets declLoc, Node name, List<Node> ancestors, List<Node> rhs,
                        LocOffsets loc) {
        super(loc);
        this.kind = kind;
        this.declLoc = declLoc;
        this.name = name;
        this.ancestors = new ArrayList<>(ancestors);
        this.rhs = new ArrayList<>(rhs);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
