package org.rbtyper.frontend.analysis;

import org.rbtyper.frontend.astnode.*;

/**
 * Visitor over the closed set of AST node classes. Adding a node class means
 * adding a method here, which makes every existing visitor fail to compile
 * until it handles the new case.
 */
public interface Visitor {
    void visit(EmptyNode node);

    void visit(LiteralNode node);

    void visit(IdentifierNode node);

    void visit(SelfNode node);

    void visit(UnresolvedConstantNode node);

    void visit(ConstantNode node);

    void visit(SendNode node);

    void visit(ClosureNode node);

    void visit(HashLiteralNode node);

    void visit(ArrayLiteralNode node);

    void visit(AssignNode node);

    void visit(BlockNode node);

    void visit(SuperNode node);

    void visit(KeywordArgNode node);

    void visit(OptionalArgNode node);

    void visit(RestArgNode node);

    void visit(MethodDefNode node);

    void visit(ClassDefNode node);
}
