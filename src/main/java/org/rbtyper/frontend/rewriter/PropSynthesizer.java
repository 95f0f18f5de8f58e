package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.core.errors.RewriterException;
import org.rbtyper.frontend.astnode.*;
import org.rbtyper.symbols.Names;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the methods that replace one property declaration.
 * <p>
 * For {@code prop :foo, T::Array[String]} the output is equivalent to:
 * <pre>
 * sig {returns(T::Array[String])}
 * def foo; end
 * sig {params(arg0: T::Array[String]).returns(T::Array[String])}
 * def foo=(arg0); end
 * class Mutator
 *   sig {params(arg0: T::Array[String]).returns(T::Array[String])}
 *   def foo=(arg0); end
 *   sig {returns(::Chalk::ODM::ArrayMutator[String])}
 *   def foo; end
 * end
 * </pre>
 * Each occurrence of the declared type is a separate copy.
 */
public class PropSynthesizer {

    /**
     * @param ctx        the rewrite context
     * @param prop       a fully parsed declaration
     * @param forTStruct whether the enclosing class derives from {@code T::Struct}
     * @return the replacement statements, never empty
     */
    public static List<Node> processProp(MutableContext ctx, PropInfo prop, boolean forTStruct) {
        RewriterException.check(prop.name != null, "prop reached synthesis without a name");
        RewriterException.check(prop.type != null, "prop `" + prop.name + "` reached synthesis without a type");

        List<Node> nodes = new ArrayList<>();
        LocOffsets loc = prop.loc;
        String setName = ctx.state.names.setterName(prop.name);

        nodes.add(NodeBuilder.sig0(loc, dupType(prop.type)));
        nodes.add(mkGetter(ctx, prop, forTStruct));

        if (!prop.isImmutable) {
            nodes.add(setterSig(prop));
            nodes.add(ASTUtil.mkSet(loc, setName, prop.nameLoc, NodeBuilder.raiseUnimplemented(loc)));
        }

        if (prop.foreign != null) {
            addForeignAccessors(ctx, prop, nodes);
        }

        nodes.add(mkMutatorClass(prop, setName));
        return nodes;
    }

    private static MethodDefNode mkGetter(MutableContext ctx, PropInfo prop, boolean forTStruct) {
        LocOffsets loc = prop.loc;
        if (prop.computedByMethodName != null) {
            // Given `const :foo, type, computed_by: <name>`, where <name> is a class method,
            // check that the method takes one argument and returns the prop's type:
            // `T.assert_type!(self.class.<name>(T.unsafe(nil)), type)`
            LocOffsets computedLoc = prop.computedByMethodNameLoc;
            Node selfClass = NodeBuilder.send(computedLoc, NodeBuilder.self(loc), Names.CLASS);
            Node unsafeNil = NodeBuilder.unsafe(computedLoc, NodeBuilder.nil(computedLoc));
            Node computed = NodeBuilder.send(computedLoc, selfClass, prop.computedByMethodName, unsafeNil);
            Node assertTypeMatches = NodeBuilder.assertType(computedLoc, computed, dupType(prop.type));
            return ASTUtil.mkGet(loc, prop.name,
                    NodeBuilder.insSeq1(loc, assertTypeMatches, NodeBuilder.raiseUnimplemented(loc)));
        }
        if (prop.ifunset == null && forTStruct) {
            String ivarName = ctx.state.names.instanceVariableName(prop.name);
            return ASTUtil.mkGet(loc, prop.name, NodeBuilder.instance(prop.nameLoc, ivarName));
        }
        return ASTUtil.mkGet(loc, prop.name, NodeBuilder.raiseUnimplemented(loc));
    }

    /**
     * {@code sig {params(arg0: <type>).returns(<type>)}}.
     */
    private static Node setterSig(PropInfo prop) {
        return NodeBuilder.sig1(prop.loc,
                NodeBuilder.symbol(prop.nameLoc, Names.ARG0), dupType(prop.type),
                dupType(prop.type));
    }

    /**
     * {@code def <name>_(**opts)} returning the nilable foreign type, and
     * {@code def <name>_!(**opts)} returning it non-nil.
     */
    private static void addForeignAccessors(MutableContext ctx, PropInfo prop, List<Node> nodes) {
        LocOffsets loc = prop.loc;
        LocOffsets nameLoc = prop.nameLoc;

        Node type;
        Node nonNilType;
        if (ASTUtil.isTypeExpression(prop.foreign)) {
            type = NodeBuilder.nilable(loc, dupType(prop.foreign));
            nonNilType = dupType(prop.foreign);
        } else {
            // Not a usable type, so fall back to untyped
            type = NodeBuilder.untyped(loc);
            nonNilType = NodeBuilder.untyped(loc);
        }

        // sig {params(opts: T.untyped).returns(T.nilable($foreign))}
        nodes.add(NodeBuilder.sig1(loc, NodeBuilder.symbol(nameLoc, Names.OPTS), NodeBuilder.untyped(loc), type));
        nodes.add(NodeBuilder.syntheticMethod1(loc, ctx.enterName(prop.name + "_"), optsArg(nameLoc),
                NodeBuilder.raiseUnimplemented(loc)));

        // sig {params(opts: T.untyped).returns($foreign)}
        nodes.add(NodeBuilder.sig1(loc, NodeBuilder.symbol(nameLoc, Names.OPTS), NodeBuilder.untyped(loc),
                nonNilType));
        nodes.add(NodeBuilder.syntheticMethod1(loc, ctx.enterName(prop.name + "_!"), optsArg(nameLoc),
                NodeBuilder.raiseUnimplemented(loc)));
    }

    /** {@code **opts} */
    private static Node optsArg(LocOffsets nameLoc) {
        return NodeBuilder.restArg(nameLoc, NodeBuilder.keywordArg(nameLoc, NodeBuilder.local(nameLoc, Names.OPTS)));
    }

    /**
     * The nested {@code Mutator} class: a setter regardless of immutability,
     * plus a getter returning a mutator proxy for collection-typed props.
     */
    private static ClassDefNode mkMutatorClass(PropInfo prop, String setName) {
        LocOffsets loc = prop.loc;
        List<Node> rhs = new ArrayList<>();
        rhs.add(setterSig(prop));
        rhs.add(ASTUtil.mkSet(loc, setName, prop.nameLoc, NodeBuilder.raiseUnimplemented(loc)));

        Node mutator = mutatorType(prop);
        if (mutator != null) {
            rhs.add(NodeBuilder.sig0(loc, mutator));
            rhs.add(ASTUtil.mkGet(loc, prop.name, NodeBuilder.raiseUnimplemented(loc)));
        }

        Node name = NodeBuilder.unresolvedConstant(loc, NodeBuilder.emptyTree(), Names.CONSTANT_MUTATOR);
        return NodeBuilder.classDef(loc, name, new ArrayList<>(), rhs);
    }

    /**
     * {@code ::Chalk::ODM::HashMutator[K, V]} for hash types,
     * {@code ::Chalk::ODM::ArrayMutator[E]} for array types, null otherwise.
     */
    private static Node mutatorType(PropInfo prop) {
        LocOffsets loc = prop.loc;
        Node type = prop.type;
        if (ASTUtil.isProbablyCollection(type, Names.CONSTANT_HASH)) {
            Node mutator = ASTUtil.mkMutator(loc, Names.CONSTANT_HASH_MUTATOR);
            if (type instanceof SendNode send && Names.SQUARE_BRACKETS.equals(send.fun) && send.args.size() == 2) {
                return NodeBuilder.send(loc, mutator, Names.SQUARE_BRACKETS,
                        dupTypeOrUntyped(loc, send.args.get(0)), dupTypeOrUntyped(loc, send.args.get(1)));
            }
            return NodeBuilder.send(loc, mutator, Names.SQUARE_BRACKETS,
                    NodeBuilder.untyped(loc), NodeBuilder.untyped(loc));
        }
        if (ASTUtil.isProbablyCollection(type, Names.CONSTANT_ARRAY)) {
            Node mutator = ASTUtil.mkMutator(loc, Names.CONSTANT_ARRAY_MUTATOR);
            if (type instanceof SendNode send && Names.SQUARE_BRACKETS.equals(send.fun) && send.args.size() == 1) {
                return NodeBuilder.send(loc, mutator, Names.SQUARE_BRACKETS, dupTypeOrUntyped(loc, send.args.get(0)));
            }
            return NodeBuilder.send(loc, mutator, Names.SQUARE_BRACKETS, NodeBuilder.untyped(loc));
        }
        // Any other type gets no mutator getter. A user-defined constant may have a
        // Mutator of its own, but it can't be named before resolution.
        return null;
    }

    private static Node dupType(Node type) {
        Node copy = ASTUtil.dupType(type);
        RewriterException.check(copy != null, "expected a type expression");
        return copy;
    }

    private static Node dupTypeOrUntyped(LocOffsets loc, Node type) {
        Node copy = ASTUtil.dupType(type);
        return copy != null ? copy : NodeBuilder.untyped(loc);
    }
}
