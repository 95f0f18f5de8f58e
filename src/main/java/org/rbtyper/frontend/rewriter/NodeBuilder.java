package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.astnode.*;
import org.rbtyper.symbols.Names;
import org.rbtyper.symbols.SymbolRef;
import org.rbtyper.symbols.Symbols;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for the node shapes rewriter passes synthesize.
 * <p>
 * Every method returns freshly allocated nodes and takes ownership of the
 * nodes passed in. Callers that still need an argument elsewhere must pass a
 * copy.
 */
public class NodeBuilder {

    public static EmptyNode emptyTree() {
        return new EmptyNode();
    }

    public static SelfNode self(LocOffsets loc) {
        return new SelfNode(loc);
    }

    public static LiteralNode nil(LocOffsets loc) {
        return LiteralNode.nil(loc);
    }

    public static LiteralNode symbol(LocOffsets loc, String name) {
        return LiteralNode.symbol(name, loc);
    }

    public static LiteralNode string(LocOffsets loc, String text) {
        return LiteralNode.string(text, loc);
    }

    public static IdentifierNode local(LocOffsets loc, String name) {
        return new IdentifierNode(IdentifierKind.LOCAL, name, loc);
    }

    /**
     * @param name the instance variable name, including its {@code @}
     */
    public static IdentifierNode instance(LocOffsets loc, String name) {
        return new IdentifierNode(IdentifierKind.INSTANCE, name, loc);
    }

    public static ConstantNode constant(LocOffsets loc, SymbolRef symbol) {
        return new ConstantNode(symbol, loc);
    }

    public static UnresolvedConstantNode unresolvedConstant(LocOffsets loc, Node scope, String name) {
        return new UnresolvedConstantNode(scope, name, loc);
    }

    public static SendNode send(LocOffsets loc, Node recv, String fun, Node... args) {
        return new SendNode(recv, fun, new ArrayList<>(Arrays.asList(args)), loc);
    }

    public static SendNode sendWithBlock(LocOffsets loc, Node recv, String fun, ClosureNode block) {
        return new SendNode(recv, fun, new ArrayList<>(), block, loc);
    }

    public static ClosureNode block0(LocOffsets loc, Node body) {
        return new ClosureNode(new ArrayList<>(), body, loc);
    }

    public static HashLiteralNode hash0(LocOffsets loc) {
        return new HashLiteralNode(loc);
    }

    public static HashLiteralNode hash1(LocOffsets loc, Node key, Node value) {
        HashLiteralNode hash = new HashLiteralNode(loc);
        hash.keys.add(key);
        hash.values.add(value);
        return hash;
    }

    public static AssignNode assign(LocOffsets loc, Node lhs, Node rhs) {
        return new AssignNode(lhs, rhs, loc);
    }

    /**
     * A statement sequence whose value is its last element.
     */
    public static BlockNode insSeq(LocOffsets loc, List<Node> stats, Node expr) {
        List<Node> elements = new ArrayList<>(stats);
        elements.add(expr);
        return new BlockNode(elements, loc);
    }

    public static BlockNode insSeq1(LocOffsets loc, Node stat, Node expr) {
        return insSeq(loc, List.of(stat), expr);
    }

    public static SuperNode zSuper(LocOffsets loc) {
        return new SuperNode(loc);
    }

    public static KeywordArgNode keywordArg(LocOffsets loc, Node expr) {
        return new KeywordArgNode(expr, loc);
    }

    public static OptionalArgNode optionalArg(LocOffsets loc, Node expr, Node defaultValue) {
        return new OptionalArgNode(expr, defaultValue, loc);
    }

    public static RestArgNode restArg(LocOffsets loc, Node expr) {
        return new RestArgNode(expr, loc);
    }

    public static ConstantNode t(LocOffsets loc) {
        return constant(loc, Symbols.T);
    }

    /** {@code T.untyped} */
    public static SendNode untyped(LocOffsets loc) {
        return send(loc, t(loc), Names.UNTYPED);
    }

    /** {@code T.nilable(type)} */
    public static SendNode nilable(LocOffsets loc, Node type) {
        return send(loc, t(loc), Names.NILABLE, type);
    }

    /** {@code T.unsafe(expr)} */
    public static SendNode unsafe(LocOffsets loc, Node expr) {
        return send(loc, t(loc), Names.UNSAFE, expr);
    }

    /** {@code T.assert_type!(expr, type)} */
    public static SendNode assertType(LocOffsets loc, Node expr, Node type) {
        return send(loc, t(loc), Names.ASSERT_TYPE, expr, type);
    }

    /**
     * Body for synthesized methods whose behavior only the runtime library
     * provides. The type checker sees a call that never returns.
     */
    public static SendNode raiseUnimplemented(LocOffsets loc) {
        return send(loc, constant(loc, Symbols.KERNEL), Names.RAISE,
                string(loc, "rewriter pass partially unimplemented"));
    }

    /**
     * {@code sig {params(<params>).returns(<ret>)}}, or
     * {@code sig {returns(<ret>)}} when {@code params} is empty.
     */
    public static SendNode sig(LocOffsets loc, HashLiteralNode params, Node ret) {
        Node returnsRecv = params.size() == 0 ? self(loc) : send(loc, self(loc), Names.PARAMS, params);
        SendNode returns = send(loc, returnsRecv, Names.RETURNS, ret);
        return sendWithBlock(loc, self(loc), Names.SIG, block0(loc, returns));
    }

    public static SendNode sig0(LocOffsets loc, Node ret) {
        return sig(loc, hash0(loc), ret);
    }

    public static SendNode sig1(LocOffsets loc, Node key, Node value, Node ret) {
        return sig(loc, hash1(loc, key, value), ret);
    }

    /**
     * {@code sig {params(<params>).void}}.
     */
    public static SendNode sigVoid(LocOffsets loc, HashLiteralNode params) {
        Node voidRecv = params.size() == 0 ? self(loc) : send(loc, self(loc), Names.PARAMS, params);
        SendNode voidSend = send(loc, voidRecv, Names.VOID);
        return sendWithBlock(loc, self(loc), Names.SIG, block0(loc, voidSend));
    }

    public static MethodDefNode syntheticMethod(LocOffsets loc, String name, List<Node> args, Node body) {
        return new MethodDefNode(loc, name, args, body, false, true, loc);
    }

    public static MethodDefNode syntheticMethod0(LocOffsets loc, String name, Node body) {
        return syntheticMethod(loc, name, new ArrayList<>(), body);
    }

    public static MethodDefNode syntheticMethod1(LocOffsets loc, String name, Node arg, Node body) {
        List<Node> args = new ArrayList<>();
        args.add(arg);
        return syntheticMethod(loc, name, args, body);
    }

    public static ClassDefNode classDef(LocOffsets loc, Node name, List<Node> ancestors, List<Node> rhs) {
        return new ClassDefNode(ClassDefNode.Kind.CLASS, loc, name, ancestors, rhs, loc);
    }
}
