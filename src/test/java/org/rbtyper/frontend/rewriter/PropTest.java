package org.rbtyper.frontend.rewriter;

import org.junit.jupiter.api.Test;
import org.rbtyper.core.GlobalState;
import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.core.RewriterOptions;
import org.rbtyper.core.SourceFile;
import org.rbtyper.frontend.analysis.PrintVisitor;
import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rbtyper.TestTrees.*;

public class PropTest {

    @Test
    public void testStatementOrderIsPreserved() {
        MethodDefNode before = userMethod("before");
        MethodDefNode between = userMethod("between");
        MethodDefNode after = userMethod("after");
        ClassDefNode klass = plainClass("Account",
                before,
                call("prop", sym("a"), cnst("String")),
                between,
                call("const", sym("b"), cnst("Integer")),
                after);

        Prop.run(ctx(), klass);

        assertEquals(List.of("before", "a", "a=", "between", "b", "after"), methodNames(klass.rhs));
        assertSame(before, klass.rhs.get(0), "untouched statements keep their identity");
        assertSame(between, findMethod(klass.rhs, "between"));
        assertSame(after, klass.rhs.get(klass.rhs.size() - 1));
    }

    @Test
    public void testEachDeclarationGetsItsOwnMutator() {
        ClassDefNode klass = plainClass("Account",
                call("prop", sym("a"), cnst("String")),
                call("prop", sym("b"), cnst("String")));

        Prop.run(ctx(), klass);

        int mutators = 0;
        for (Node stat : klass.rhs) {
            if (stat instanceof ClassDefNode) {
                mutators++;
            }
        }
        assertEquals(2, mutators);
    }

    @Test
    public void testStructGetsInitializerFirst() {
        MethodDefNode userInit = userMethod("initialize");
        ClassDefNode klass = struct("Point",
                call("const", sym("x"), cnst("Integer")),
                call("const", sym("y"), cnst("Integer"), hash("default", intLit("0"))),
                userInit);

        Prop.run(ctx(), klass);

        assertEquals("sig", ((SendNode) klass.rhs.get(0)).fun);
        MethodDefNode init = assertInstanceOf(MethodDefNode.class, klass.rhs.get(1));
        assertEquals("initialize", init.name);
        assertTrue(init.isRewriterSynthesized);
        assertEquals(List.of("initialize", "x", "y", "initialize"), methodNames(klass.rhs));
        assertSame(userInit, klass.rhs.get(klass.rhs.size() - 1));

        IdentifierNode ivar = assertInstanceOf(IdentifierNode.class, findMethod(klass.rhs, "x").body);
        assertEquals("@x", ivar.name);
    }

    @Test
    public void testStructWithoutPropsStillGetsInitializer() {
        MethodDefNode helper = userMethod("helper");
        ClassDefNode klass = struct("Empty", helper);

        Prop.run(ctx(), klass);

        assertEquals(List.of("initialize", "helper"), methodNames(klass.rhs));
    }

    @Test
    public void testRootScopedStructIsRecognized() {
        ClassDefNode klass = klass("Point", List.of(scoped(rootCnst("T"), "Struct")),
                call("prop", sym("x"), cnst("Integer")));

        Prop.run(ctx(), klass);

        assertEquals("initialize", methodNames(klass.rhs).get(0));
    }

    @Test
    public void testPlainClassGetsNoInitializer() {
        ClassDefNode klass = plainClass("Account", call("prop", sym("a"), cnst("String")));

        Prop.run(ctx(), klass);

        assertFalse(methodNames(klass.rhs).contains("initialize"));
        assertRaisesBody(findMethod(klass.rhs, "a"));
    }

    @Test
    public void testOtherStructIsNotTStruct() {
        ClassDefNode klass = klass("Account", List.of(scoped(cnst("Foo"), "Struct")),
                call("prop", sym("a"), cnst("String")));

        Prop.run(ctx(), klass);

        assertFalse(methodNames(klass.rhs).contains("initialize"));
    }

    @Test
    public void testClassWithoutPropsIsUntouched() {
        SendNode include = call("include", cnst("Comparable"));
        MethodDefNode method = userMethod("foo");
        ClassDefNode klass = plainClass("Account", include, method);
        List<Node> rhs = klass.rhs;

        Prop.run(ctx(), klass);

        assertSame(rhs, klass.rhs);
        assertEquals(2, klass.rhs.size());
        assertSame(include, klass.rhs.get(0));
        assertSame(method, klass.rhs.get(1));
    }

    @Test
    public void testImmutableBodyListIsRewritten() {
        ClassDefNode klass = new ClassDefNode(ClassDefNode.Kind.CLASS, LocOffsets.none(), cnst("Account"),
                List.of(scoped(cnst("T"), "Struct")),
                List.of(call("prop", sym("a"), cnst("String"))), LocOffsets.none());

        assertDoesNotThrow(() -> Prop.run(ctx(), klass));
        assertEquals(List.of("initialize", "a", "a="), methodNames(klass.rhs));
    }

    @Test
    public void testAutogenLeavesBodyUnchanged() {
        RewriterOptions options = new RewriterOptions();
        options.runningUnderAutogen = true;
        MutableContext ctx = new GlobalState(options).contextFor(new SourceFile("test.rb", ""));
        ClassDefNode klass = struct("Point",
                call("prop", sym("x"), cnst("Integer")),
                call("prop", sym("y"), cnst("Integer"), hash("foreign", cnst("Other"))));
        String before = PrintVisitor.print(klass);

        Prop.run(ctx, klass);

        assertEquals(before, PrintVisitor.print(klass));
        assertTrue(ctx.state.errorQueue.isEmpty());
    }

    @Test
    public void testAutogenCanBeToggledPerContext() {
        ClassDefNode klass = plainClass("Account", call("prop", sym("a"), cnst("String")));

        Prop.run(ctx().withAutogen(true), klass);
        assertEquals(1, klass.rhs.size());

        Prop.run(ctx().withAutogen(false), klass);
        assertEquals(List.of("a", "a="), methodNames(klass.rhs));
    }

    @Test
    public void testRejectedDeclarationIsKept() {
        SendNode tooMany = call("prop", sym("a"), cnst("String"), intLit("1"), intLit("2"));
        SendNode badType = call("prop", sym("b"), intLit("3"));
        ClassDefNode klass = plainClass("Account", tooMany, badType);
        MutableContext ctx = ctx();

        Prop.run(ctx, klass);

        assertEquals(2, klass.rhs.size());
        assertSame(tooMany, klass.rhs.get(0));
        assertSame(badType, klass.rhs.get(1));
        assertTrue(ctx.state.errorQueue.isEmpty());
    }

    @Test
    public void testDiagnosticsAreReportedDuringRewrite() {
        ClassDefNode klass = plainClass("Account",
                call("prop", sym("user"), cnst("String"), hash("foreign", cnst("User"))),
                call("const", sym("n"), cnst("Integer"), hash("computed_by", str("calc"))));
        MutableContext ctx = ctx();

        Prop.run(ctx, klass);

        assertEquals(2, ctx.state.errorQueue.size());
        assertEquals(List.of("user", "user=", "user_", "user_!", "n"), methodNames(klass.rhs));
    }

    @Test
    public void testSynthesizedOutputIsNotADeclaration() {
        ClassDefNode klass = struct("Order",
                call("prop", sym("items"), tArray(cnst("String"))),
                call("prop", sym("user"), cnst("String"), hash("foreign", lambda(cnst("User")))),
                call("token_prop"),
                call("const", sym("total"), cnst("Integer"), hash("computed_by", sym("calc"))));
        MutableContext ctx = ctx();
        Prop.run(ctx, klass);

        List<Node> everything = new ArrayList<>(allNodes(klass.rhs));
        for (Node node : everything) {
            if (node instanceof SendNode send) {
                assertNull(PropParser.parseProp(ctx, send), "synthesized " + send.fun + " was classified");
            }
        }
    }

    @Test
    public void testRewritingTwiceChangesNothing() {
        ClassDefNode klass = plainClass("Account",
                call("prop", sym("a"), cnst("String")),
                call("token_prop"));
        Prop.run(ctx(), klass);
        String once = PrintVisitor.print(klass);

        Prop.run(ctx(), klass);

        assertEquals(once, PrintVisitor.print(klass));
    }

    private static void assertRaisesBody(MethodDefNode method) {
        assertNotNull(method);
        SendNode raise = assertInstanceOf(SendNode.class, method.body);
        assertEquals("raise", raise.fun);
    }
}
