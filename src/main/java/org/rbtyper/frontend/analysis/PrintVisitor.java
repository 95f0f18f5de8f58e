package org.rbtyper.frontend.analysis;

import org.rbtyper.frontend.astnode.*;
import org.rbtyper.symbols.NameTable;

import java.util.List;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private final boolean withLocations;
    private int indentLevel = 0;

    public PrintVisitor() {
        this(true);
    }

    public PrintVisitor(boolean withLocations) {
        this.withLocations = withLocations;
    }

    public static String print(Node node) {
        PrintVisitor printVisitor = new PrintVisitor();
        node.accept(printVisitor);
        return printVisitor.getResult();
    }

    /**
     * Prints the tree without source ranges, for comparing shapes.
     */
    public static String printShape(Node node) {
        PrintVisitor printVisitor = new PrintVisitor(false);
        node.accept(printVisitor);
        return printVisitor.getResult();
    }

    public String getResult() {
        return sb.toString();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    private void header(AbstractNode node, String text) {
        appendIndent();
        sb.append(text);
        if (withLocations) {
            sb.append("  pos:").append(node.loc);
        }
        sb.append("\n");
    }

    private void child(String label, Node node) {
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        if (node == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.accept(this);
        }
        indentLevel--;
    }

    private void children(String label, List<Node> nodes) {
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        for (Node node : nodes) {
            node.accept(this);
        }
        indentLevel--;
    }

    /**
     * Renders a symbol the way it is written in source: {@code :name}, or
     * {@code :"some name"} when the name is not a bare identifier.
     */
    static String showSymbol(String name) {
        if (NameTable.isIdentifier(name)) {
            return ":" + name;
        }
        return ":\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public void visit(EmptyNode node) {
        appendIndent();
        sb.append("EmptyNode\n");
    }

    @Override
    public void visit(LiteralNode node) {
        String value = switch (node.kind) {
            case NIL -> "nil";
            case TRUE -> "true";
            case FALSE -> "false";
            case STRING -> "\"" + node.value + "\"";
            case SYMBOL -> showSymbol(node.value);
            default -> node.value;
        };
        header(node, "LiteralNode: " + value);
    }

    @Override
    public void visit(IdentifierNode node) {
        header(node, "IdentifierNode: " + node.kind + " " + node.name);
    }

    @Override
    public void visit(SelfNode node) {
        header(node, "SelfNode");
    }

    @Override
    public void visit(UnresolvedConstantNode node) {
        header(node, "UnresolvedConstantNode: " + node.cnst);
        indentLevel++;
        child("scope", node.scope);
        indentLevel--;
    }

    @Override
    public void visit(ConstantNode node) {
        header(node, "ConstantNode: " + node.symbol.show());
    }

    @Override
    public void visit(SendNode node) {
        header(node, "SendNode: " + node.fun);
        indentLevel++;
        child("recv", node.recv);
        children("args", node.args);
        if (node.block != null) {
            child("block", node.block);
        }
        indentLevel--;
    }

    @Override
    public void visit(ClosureNode node) {
        header(node, "ClosureNode");
        indentLevel++;
        children("params", node.params);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(HashLiteralNode node) {
        header(node, "HashLiteralNode");
        indentLevel++;
        for (int i = 0; i < node.keys.size(); i++) {
            child("key", node.keys.get(i));
            child("value", node.values.get(i));
        }
        indentLevel--;
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        header(node, "ArrayLiteralNode");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(AssignNode node) {
        header(node, "AssignNode");
        indentLevel++;
        child("lhs", node.lhs);
        child("rhs", node.rhs);
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        header(node, "BlockNode");
        indentLevel++;
        for (Node element : node.elements) {
            element.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(SuperNode node) {
        header(node, "SuperNode");
    }

    @Override
    public void visit(KeywordArgNode node) {
        header(node, "KeywordArgNode");
        indentLevel++;
        node.expr.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(OptionalArgNode node) {
        header(node, "OptionalArgNode");
        indentLevel++;
        node.expr.accept(this);
        child("default", node.defaultValue);
        indentLevel--;
    }

    @Override
    public void visit(RestArgNode node) {
        header(node, "RestArgNode");
        indentLevel++;
        node.expr.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(MethodDefNode node) {
        header(node, "MethodDefNode: " + (node.isSelfMethod ? "self." : "") + node.name
                + (node.isRewriterSynthesized ? "  synthesized" : ""));
        indentLevel++;
        children("args", node.args);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ClassDefNode node) {
        header(node, "ClassDefNode: " + node.kind);
        indentLevel++;
        child("name", node.name);
        children("ancestors", node.ancestors);
        children("rhs", node.rhs);
        indentLevel--;
    }
}
