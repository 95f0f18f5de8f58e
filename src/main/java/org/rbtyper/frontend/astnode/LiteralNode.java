package org.rbtyper.frontend.astnode;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.analysis.Visitor;

/**
 * The LiteralNode class represents a node in the abstract syntax tree (AST) that holds
 * a literal value. Numbers keep their source spelling; symbols hold the interned
 * name without the leading colon.
 */
public class LiteralNode extends AbstractNode {
    /**
     * The kind of literal.
     */
    public final LiteralKind kind;
    /**
     * The literal text, or null for nil, true and false.
     */
    public final String value;

    public LiteralNode(LiteralKind kind, String value, LocOffsets loc) {
        super(loc);
        this.kind = kind;
        this.value = value;
    }

    public static LiteralNode nil(LocOffsets loc) {
        return new LiteralNode(LiteralKind.NIL, null, loc);
    }

    public static LiteralNode symbol(String name, LocOffsets loc) {
        return new LiteralNode(LiteralKind.SYMBOL, name, loc);
    }

    public static LiteralNode string(String text, LocOffsets loc) {
        return new LiteralNode(LiteralKind.STRING, text, loc);
    }

    public boolean isSymbol() {
        return kind == LiteralKind.SYMBOL;
    }

    public boolean isNil() {
        return kind == LiteralKind.NIL;
    }

    public boolean isFalse() {
        return kind == LiteralKind.FALSE;
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
