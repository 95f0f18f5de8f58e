package org.rbtyper.frontend.rewriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.frontend.astnode.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rbtyper.TestTrees.*;

public class StructInitializerTest {

    private MutableContext ctx;

    @BeforeEach
    void setUp() {
        ctx = ctx();
    }

    private List<PropInfo> parseAll(SendNode... sends) {
        List<PropInfo> props = new ArrayList<>();
        for (SendNode send : sends) {
            PropInfo prop = PropParser.parseProp(ctx, send);
            assertNotNull(prop);
            props.add(prop);
        }
        return props;
    }

    @Test
    public void testRequiredParametersComeFirst() {
        List<PropInfo> props = parseAll(
                call("prop", sym("a"), cnst("Integer")),
                call("prop", sym("b"), cnst("Integer"), hash("default", intLit("1"))),
                call("prop", sym("c"), cnst("String")));

        List<Node> nodes = StructInitializer.mkInitialize(ctx, LocOffsets.none(), props);
        assertEquals(2, nodes.size());

        HashLiteralNode params = sigParams(nodes.get(0));
        assertEquals(List.of("a", "c", "b"), keyNames(params));
        assertEquals("Integer", ((UnresolvedConstantNode) params.values.get(0)).cnst);
        assertEquals("String", ((UnresolvedConstantNode) params.values.get(1)).cnst);
        assertEquals("Integer", ((UnresolvedConstantNode) params.values.get(2)).cnst);

        MethodDefNode init = assertInstanceOf(MethodDefNode.class, nodes.get(1));
        assertEquals("initialize", init.name);
        assertTrue(init.isRewriterSynthesized);
        assertEquals(3, init.args.size());
        assertEquals("a", keywordName(init.args.get(0)));
        assertEquals("c", keywordName(init.args.get(1)));
        OptionalArgNode b = assertInstanceOf(OptionalArgNode.class, init.args.get(2));
        assertEquals("b", keywordName(b.expr));
        assertEquals("1", ((LiteralNode) b.defaultValue).value);
        assertNotSame(props.get(1).defaultValue, b.defaultValue);
    }

    @Test
    public void testAssignmentsKeepDeclarationOrder() {
        List<PropInfo> props = parseAll(
                call("prop", sym("a"), cnst("Integer")),
                call("prop", sym("b"), cnst("Integer"), hash("default", intLit("1"))),
                call("prop", sym("c"), cnst("String")));

        MethodDefNode init = (MethodDefNode) StructInitializer.mkInitialize(ctx, LocOffsets.none(), props).get(1);
        BlockNode body = assertInstanceOf(BlockNode.class, init.body);

        assertEquals(4, body.elements.size());
        String[] names = {"a", "b", "c"};
        for (int i = 0; i < names.length; i++) {
            AssignNode assign = assertInstanceOf(AssignNode.class, body.elements.get(i));
            IdentifierNode lhs = (IdentifierNode) assign.lhs;
            IdentifierNode rhs = (IdentifierNode) assign.rhs;
            assertEquals(IdentifierKind.INSTANCE, lhs.kind);
            assertEquals("@" + names[i], lhs.name);
            assertEquals(IdentifierKind.LOCAL, rhs.kind);
            assertEquals(names[i], rhs.name);
        }
        assertInstanceOf(SuperNode.class, body.elements.get(3));
    }

    @Test
    public void testNilablePropIsOptional() {
        List<PropInfo> props = parseAll(
                call("prop", sym("note"), nilable(cnst("String"))),
                call("prop", sym("id"), cnst("Integer")));

        MethodDefNode init = (MethodDefNode) StructInitializer.mkInitialize(ctx, LocOffsets.none(), props).get(1);

        assertEquals("id", keywordName(init.args.get(0)));
        OptionalArgNode note = assertInstanceOf(OptionalArgNode.class, init.args.get(1));
        assertEquals("note", keywordName(note.expr));
        assertTrue(((LiteralNode) note.defaultValue).isNil());
    }

    @Test
    public void testNoProps() {
        List<Node> nodes = StructInitializer.mkInitialize(ctx, LocOffsets.none(), List.of());

        SendNode sig = (SendNode) nodes.get(0);
        SendNode voidSend = assertInstanceOf(SendNode.class, sig.block.body);
        assertEquals("void", voidSend.fun);
        assertInstanceOf(SelfNode.class, voidSend.recv, "no params call for an empty signature");

        MethodDefNode init = (MethodDefNode) nodes.get(1);
        assertTrue(init.args.isEmpty());
        BlockNode body = (BlockNode) init.body;
        assertEquals(1, body.elements.size());
        assertInstanceOf(SuperNode.class, body.elements.get(0));
    }

    @Test
    public void testSignatureTypesAreCopies() {
        List<PropInfo> props = parseAll(call("prop", sym("a"), tArray(cnst("String"))));

        List<Node> nodes = StructInitializer.mkInitialize(ctx, LocOffsets.none(), props);

        HashLiteralNode params = sigParams(nodes.get(0));
        assertNotSame(props.get(0).type, params.values.get(0));
        assertEquals(countNodes(nodes), allNodes(nodes).size());
    }

    private static List<String> keyNames(HashLiteralNode hash) {
        List<String> names = new ArrayList<>();
        for (Node key : hash.keys) {
            names.add(((LiteralNode) key).value);
        }
        return names;
    }

    private static String keywordName(Node arg) {
        KeywordArgNode kwarg = assertInstanceOf(KeywordArgNode.class, arg);
        return ((IdentifierNode) kwarg.expr).name;
    }
}
