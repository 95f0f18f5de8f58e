package org.rbtyper.frontend.rewriter;

import org.junit.jupiter.api.Test;
import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rbtyper.TestTrees.*;

public class RewriterTest {

    @Test
    public void testRewritesEveryClassInFile() {
        ClassDefNode first = plainClass("First", call("prop", sym("a"), cnst("String")));
        ClassDefNode second = struct("Second", call("prop", sym("b"), cnst("String")));
        BlockNode file = new BlockNode(new ArrayList<>(List.of(first, second)), LocOffsets.none());

        Rewriter.run(ctx(), file);

        assertEquals(List.of("a", "a="), methodNames(first.rhs));
        assertEquals(List.of("initialize", "b", "b="), methodNames(second.rhs));
    }

    @Test
    public void testNestedClassesAreRewrittenOnce() {
        ClassDefNode inner = struct("Inner", call("prop", sym("x"), cnst("Integer")));
        ClassDefNode outer = struct("Outer", call("prop", sym("y"), cnst("Integer")), inner);

        Rewriter.run(ctx(), outer);

        assertEquals(List.of("initialize", "x", "x="), methodNames(inner.rhs));
        assertEquals(List.of("initialize", "y", "y="), methodNames(outer.rhs));
        assertTrue(outer.rhs.contains(inner));
    }

    @Test
    public void testSynthesizedMutatorClassesAreLeftAlone() {
        ClassDefNode klass = struct("Order", call("prop", sym("items"), tArray(cnst("String"))));

        Rewriter.run(ctx(), klass);

        ClassDefNode mutator = findClass(klass.rhs);
        assertNotNull(mutator);
        assertEquals(List.of("items=", "items"), methodNames(mutator.rhs));
    }

    @Test
    public void testClassInsideMethodBody() {
        ClassDefNode local = plainClass("Local", call("const", sym("c"), cnst("String")));
        MethodDefNode method = new MethodDefNode(LocOffsets.none(), "build", new ArrayList<>(),
                new BlockNode(new ArrayList<>(List.of(local)), LocOffsets.none()), false, false, LocOffsets.none());
        ClassDefNode outer = plainClass("Outer", method);

        Rewriter.run(ctx(), outer);

        assertEquals(List.of("c"), methodNames(local.rhs));
        assertEquals(1, outer.rhs.size());
    }

    @Test
    public void testAutogenSkipsWholeTree() {
        ClassDefNode klass = struct("Point", call("prop", sym("x"), cnst("Integer")));
        MutableContext ctx = ctx().withAutogen(true);

        Rewriter.run(ctx, klass);

        assertEquals(1, klass.rhs.size());
    }

    @Test
    public void testNullTreeIsIgnored() {
        assertDoesNotThrow(() -> Rewriter.run(ctx(), null));
    }
}
