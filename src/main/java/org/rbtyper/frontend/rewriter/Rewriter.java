package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.MutableContext;
import org.rbtyper.frontend.analysis.Visitor;
import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the class-body rewriters over a whole tree.
 * <p>
 * Class bodies are collected before any of them is rewritten, innermost
 * first. Classes that a rewrite creates (such as the {@code Mutator} classes
 * {@link Prop} emits) are therefore never rewritten themselves, and every
 * class body is processed exactly once.
 */
public class Rewriter {
    private static final boolean DEBUG_REWRITER = Boolean.getBoolean("debug.rewriter");

    public static void run(MutableContext ctx, Node tree) {
        if (tree == null) {
            return;
        }
        ClassCollector collector = new ClassCollector();
        tree.accept(collector);
        if (DEBUG_REWRITER) {
            System.err.println("DEBUG: Rewriter: " + collector.classes.size() + " class bodies in " + ctx.file);
        }
        for (ClassDefNode klass : collector.classes) {
            Prop.run(ctx, klass);
        }
    }

    /**
     * Collects class definitions in post-order.
     */
    private static class ClassCollector implements Visitor {
        final List<ClassDefNode> classes = new ArrayList<>();

        private void visitAll(List<Node> nodes) {
            for (Node node : nodes) {
                node.accept(this);
            }
        }

        private void visitNullable(Node node) {
            if (node != null) {
                node.accept(this);
            }
        }

        @Override
        public void visit(EmptyNode node) {
        }

        @Override
        public void visit(LiteralNode node) {
        }

        @Override
        public void visit(IdentifierNode node) {
        }

        @Override
        public void visit(SelfNode node) {
        }

        @Override
        public void visit(UnresolvedConstantNode node) {
        }

        @Override
        public void visit(ConstantNode node) {
        }

        @Override
        public void visit(SendNode node) {
            visitNullable(node.recv);
            visitAll(node.args);
            visitNullable(node.block);
        }

        @Override
        public void visit(ClosureNode node) {
            visitNullable(node.body);
        }

        @Override
        public void visit(HashLiteralNode node) {
            visitAll(node.values);
        }

        @Override
        public void visit(ArrayLiteralNode node) {
            visitAll(node.elements);
        }

        @Override
        public void visit(AssignNode node) {
            visitNullable(node.rhs);
        }

        @Override
        public void visit(BlockNode node) {
            visitAll(node.elements);
        }

        @Override
        public void visit(SuperNode node) {
        }

        @Override
        public void visit(KeywordArgNode node) {
        }

        @Override
        public void visit(OptionalArgNode node) {
            visitNullable(node.defaultValue);
        }

        @Override
        public void visit(RestArgNode node) {
        }

        @Override
        public void visit(MethodDefNode node) {
            visitAll(node.args);
            visitNullable(node.body);
        }

        @Override
        public void visit(ClassDefNode node) {
            visitAll(node.rhs);
            classes.add(node);
        }
    }
}
