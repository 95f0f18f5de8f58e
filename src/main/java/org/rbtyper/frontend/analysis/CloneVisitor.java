package org.rbtyper.frontend.analysis;

import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Deep clones AST nodes. Every node of the result is a new instance, leaves
 * included, so the copy can be handed to a new owner while the original
 * stays where it is.
 */
public class CloneVisitor implements Visitor {
    private Node clonedNode;

    public static Node clone(Node node) {
        if (node == null) return null;
        CloneVisitor visitor = new CloneVisitor();
        node.accept(visitor);
        return visitor.clonedNode;
    }

    public static List<Node> cloneList(List<Node> nodes) {
        List<Node> cloned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            cloned.add(clone(node));
        }
        return cloned;
    }

    @Override
    public void visit(EmptyNode node) {
        clonedNode = new EmptyNode();
    }

    @Override
    public void visit(LiteralNode node) {
        clonedNode = new LiteralNode(node.kind, node.value, node.loc);
    }

    @Override
    public void visit(IdentifierNode node) {
        clonedNode = new IdentifierNode(node.kind, node.name, node.loc);
    }

    @Override
    public void visit(SelfNode node) {
        clonedNode = new SelfNode(node.loc);
    }

    @Override
    public void visit(UnresolvedConstantNode node) {
        clonedNode = new UnresolvedConstantNode(clone(node.scope), node.cnst, node.loc);
    }

    @Override
    public void visit(ConstantNode node) {
        clonedNode = new ConstantNode(node.symbol, node.loc);
    }

    @Override
    public void visit(SendNode node) {
        clonedNode = new SendNode(
                clone(node.recv),
                node.fun,
                cloneList(node.args),
                (ClosureNode) clone(node.block),
                node.loc
        );
    }

    @Override
    public void visit(ClosureNode node) {
        clonedNode = new ClosureNode(cloneList(node.params), clone(node.body), node.loc);
    }

    @Override
    public void visit(HashLiteralNode node) {
        clonedNode = new HashLiteralNode(cloneList(node.keys), cloneList(node.values), node.loc);
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        clonedNode = new ArrayLiteralNode(cloneList(node.elements), node.loc);
    }

    @Override
    public void visit(AssignNode node) {
        clonedNode = new AssignNode(clone(node.lhs), clone(node.rhs), node.loc);
    }

    @Override
    public void visit(BlockNode node) {
        clonedNode = new BlockNode(cloneList(node.elements), node.loc);
    }

    @Override
    public void visit(SuperNode node) {
        clonedNode = new SuperNode(node.loc);
    }

    @Override
    public void visit(KeywordArgNode node) {
        clonedNode = new KeywordArgNode(clone(node.expr), node.loc);
    }

    @Override
    public void visit(OptionalArgNode node) {
        clonedNode = new OptionalArgNode(clone(node.expr), clone(node.defaultValue), node.loc);
    }

    @Override
    public void visit(RestArgNode node) {
        clonedNode = new RestArgNode(clone(node.expr), node.loc);
    }

    @Override
    public void visit(MethodDefNode node) {
        clonedNode = new MethodDefNode(
                node.declLoc,
                node.name,
                cloneList(node.args),
                clone(node.body),
                node.isSelfMethod,
                node.isRewriterSynthesized,
                node.loc
        );
    }

    @Override
    public void visit(ClassDefNode node) {
        clonedNode = new ClassDefNode(
                node.kind,
                node.declLoc,
                clone(node.name),
                cloneList(node.ancestors),
                cloneList(node.rhs),
                node.loc
        );
    }
}
