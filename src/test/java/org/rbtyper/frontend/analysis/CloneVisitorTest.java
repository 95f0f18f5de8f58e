package org.rbtyper.frontend.analysis;

import org.junit.jupiter.api.Test;
import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.rbtyper.TestTrees.*;

public class CloneVisitorTest {

    private static ClassDefNode sampleClass() {
        MethodDefNode method = new MethodDefNode(new LocOffsets(20, 30), "run",
                new ArrayList<>(List.of(
                        new KeywordArgNode(new IdentifierNode(IdentifierKind.LOCAL, "a", LocOffsets.none()),
                                LocOffsets.none()),
                        new OptionalArgNode(new IdentifierNode(IdentifierKind.LOCAL, "b", LocOffsets.none()),
                                intLit("1"), LocOffsets.none()),
                        new RestArgNode(new IdentifierNode(IdentifierKind.LOCAL, "rest", LocOffsets.none()),
                                LocOffsets.none()))),
                new BlockNode(new ArrayList<>(List.of(
                        new AssignNode(new IdentifierNode(IdentifierKind.INSTANCE, "@x", LocOffsets.none()),
                                new ArrayLiteralNode(new ArrayList<>(List.of(nil(), trueLit())), LocOffsets.none()),
                                LocOffsets.none()),
                        new SuperNode(LocOffsets.none()))), LocOffsets.none()),
                true, false, new LocOffsets(20, 60));
        return struct("Sample",
                call("prop", sym("x"), tHash(cnst("String"), nilable(rootCnst("Integer"))),
                        hash("foreign", lambda(cnst("User")))),
                method);
    }

    @Test
    public void testCopyPrintsTheSame() {
        ClassDefNode original = sampleClass();
        Node copy = original.deepCopy();

        assertEquals(PrintVisitor.print(original), PrintVisitor.print(copy));
    }

    @Test
    public void testCopySharesNoNode() {
        ClassDefNode original = sampleClass();
        Node copy = CloneVisitor.clone(original);

        Set<Node> originalNodes = allNodes(List.of(original));
        Set<Node> copiedNodes = allNodes(List.of(copy));
        assertEquals(originalNodes.size(), copiedNodes.size());
        for (Node node : copiedNodes) {
            assertFalse(originalNodes.contains(node), "copy shares " + node.getClass().getSimpleName());
        }
    }

    @Test
    public void testCopyIsIndependent() {
        ClassDefNode original = sampleClass();
        ClassDefNode copy = (ClassDefNode) original.deepCopy();
        String before = PrintVisitor.print(original);

        ((SendNode) copy.rhs.get(0)).args.clear();
        ((MethodDefNode) copy.rhs.get(1)).args.clear();
        copy.rhs.clear();

        assertEquals(before, PrintVisitor.print(original));
    }

    @Test
    public void testCopyKeepsFlagsAndLocations() {
        MethodDefNode original = (MethodDefNode) sampleClass().rhs.get(1);
        MethodDefNode copy = (MethodDefNode) original.deepCopy();

        assertTrue(copy.isSelfMethod);
        assertFalse(copy.isRewriterSynthesized);
        assertEquals(new LocOffsets(20, 30), copy.declLoc);
        assertEquals(new LocOffsets(20, 60), copy.getLoc());
    }

    @Test
    public void testCloneList() {
        List<Node> nodes = List.of(cnst("A"), sym("b"));
        List<Node> copies = CloneVisitor.cloneList(nodes);

        assertEquals(2, copies.size());
        assertNotSame(nodes.get(0), copies.get(0));
        assertNotSame(nodes.get(1), copies.get(1));
        assertNull(CloneVisitor.clone(null));
    }
}
