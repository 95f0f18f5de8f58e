package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.astnode.*;
import org.rbtyper.symbols.Names;
import org.rbtyper.symbols.Symbols;

/**
 * Syntactic helpers shared by the rewriter passes.
 * <p>
 * Everything here works on the shape of the tree only. A constant spelled
 * {@code T} is assumed to be the {@code T} the runtime library defines,
 * since nothing is resolved yet when rewriters run.
 */
public class ASTUtil {

    /**
     * Checks whether {@code node} is shaped like a type expression: constants,
     * generic applications such as {@code T::Hash[K, V]}, combinator calls
     * such as {@code T.nilable(X)}, and tuple literals.
     */
    public static boolean isTypeExpression(Node node) {
        return isTypeExpression(node, false);
    }

    private static boolean isTypeExpression(Node node, boolean isCallArgument) {
        if (node instanceof ConstantNode) {
            return true;
        }
        if (node instanceof UnresolvedConstantNode cnst) {
            Node scope = cnst.scope;
            if (scope instanceof EmptyNode) {
                return true;
            }
            if (scope instanceof ConstantNode root) {
                return root.symbol.isRoot();
            }
            return scope instanceof UnresolvedConstantNode && isTypeExpression(scope, false);
        }
        if (node instanceof SendNode send) {
            if (send.block != null || !isTypeExpression(send.recv, false)) {
                return false;
            }
            if (Names.ENUM.equals(send.fun)) {
                // T.enum takes values rather than types; copy it through blindly
                return true;
            }
            for (Node arg : send.args) {
                if (!isTypeExpression(arg, true)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof ArrayLiteralNode tuple) {
            for (Node element : tuple.elements) {
                if (!isTypeExpression(element, false)) {
                    return false;
                }
            }
            return true;
        }
        if (isCallArgument && node instanceof HashLiteralNode shape) {
            // keyword arguments such as T.proc.params(x: Integer)
            for (int i = 0; i < shape.size(); i++) {
                if (!(shape.keys.get(i) instanceof LiteralNode key && key.isSymbol())
                        || !isTypeExpression(shape.values.get(i), false)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Returns a deep copy of {@code node} if it is a type expression, or null
     * when it is not.
     */
    public static Node dupType(Node node) {
        if (node == null || !isTypeExpression(node)) {
            return null;
        }
        return node.deepCopy();
    }

    /**
     * {@code T}, either with no scope or with the root scope ({@code ::T}).
     */
    public static boolean isT(Node node) {
        if (!(node instanceof UnresolvedConstantNode t) || !Names.CONSTANT_T.equals(t.cnst)) {
            return false;
        }
        if (t.scope instanceof EmptyNode) {
            return true;
        }
        return t.scope instanceof ConstantNode root && root.symbol.isRoot();
    }

    /**
     * {@code T.nilable(...)}.
     */
    public static boolean isTNilable(Node node) {
        return node instanceof SendNode nilable
                && Names.NILABLE.equals(nilable.fun)
                && isT(nilable.recv);
    }

    /**
     * {@code T::Struct}.
     */
    public static boolean isTStruct(Node node) {
        return node instanceof UnresolvedConstantNode struct
                && Names.CONSTANT_STRUCT.equals(struct.cnst)
                && isT(struct.scope);
    }

    /**
     * Checks whether {@code type} probably names the core collection
     * {@code constantName}: {@code Hash}, {@code ::Hash} or {@code T::Hash},
     * possibly applied to type arguments with {@code []}.
     */
    public static boolean isProbablyCollection(Node type, String constantName) {
        if (type instanceof SendNode send) {
            return Names.SQUARE_BRACKETS.equals(send.fun) && isProbablyCollection(send.recv, constantName);
        }
        if (type instanceof ConstantNode cnst) {
            return constantName.equals(cnst.symbol.name)
                    && (cnst.symbol.owner == Symbols.ROOT || cnst.symbol.owner == Symbols.T);
        }
        if (type instanceof UnresolvedConstantNode cnst) {
            if (!constantName.equals(cnst.cnst)) {
                return false;
            }
            if (cnst.scope instanceof EmptyNode) {
                return true;
            }
            if (cnst.scope instanceof ConstantNode root) {
                return root.symbol.isRoot();
            }
            return isT(cnst.scope);
        }
        return false;
    }

    public static boolean hasHashValue(HashLiteralNode hash, String name) {
        return indexOfKey(hash, name) >= 0;
    }

    /**
     * Checks for a key whose value is anything but a {@code nil} or
     * {@code false} literal.
     */
    public static boolean hasTruthyHashValue(HashLiteralNode hash, String name) {
        int i = indexOfKey(hash, name);
        if (i < 0) {
            return false;
        }
        Node value = hash.values.get(i);
        if (value instanceof LiteralNode literal) {
            return !literal.isNil() && !literal.isFalse();
        }
        return true;
    }

    /**
     * Removes the entry for symbol key {@code name} from {@code hash} and
     * returns its value, or null when there is no such key.
     */
    public static Node extractHashValue(HashLiteralNode hash, String name) {
        int i = indexOfKey(hash, name);
        if (i < 0) {
            return null;
        }
        hash.keys.remove(i);
        return hash.values.remove(i);
    }

    private static int indexOfKey(HashLiteralNode hash, String name) {
        for (int i = 0; i < hash.keys.size(); i++) {
            if (hash.keys.get(i) instanceof LiteralNode key && key.isSymbol() && name.equals(key.value)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * If {@code node} is a thunk ({@code -> {x}}, {@code lambda {x}} or
     * {@code proc {x}} called on self or {@code Kernel} with no parameters),
     * detaches and returns its body. Otherwise returns null and leaves the
     * node untouched.
     */
    public static Node thunkBody(Node node) {
        if (!(node instanceof SendNode send)) {
            return null;
        }
        if (!Names.LAMBDA.equals(send.fun) && !Names.PROC.equals(send.fun)) {
            return null;
        }
        if (!(send.recv instanceof SelfNode) && !isKernel(send.recv)) {
            return null;
        }
        if (!send.args.isEmpty() || send.block == null || !send.block.params.isEmpty()) {
            return null;
        }
        Node body = send.block.body;
        send.block.body = new EmptyNode();
        return body;
    }

    private static boolean isKernel(Node node) {
        if (node instanceof ConstantNode cnst) {
            return cnst.symbol == Symbols.KERNEL;
        }
        if (node instanceof UnresolvedConstantNode cnst && Names.CONSTANT_KERNEL.equals(cnst.cnst)) {
            return cnst.scope instanceof EmptyNode
                    || (cnst.scope instanceof ConstantNode root && root.symbol.isRoot());
        }
        return false;
    }

    /**
     * {@code def name; body; end}, marked as synthesized.
     */
    public static MethodDefNode mkGet(LocOffsets loc, String name, Node body) {
        return NodeBuilder.syntheticMethod0(loc, name, body);
    }

    /**
     * {@code def name=(arg0); body; end}, marked as synthesized.
     */
    public static MethodDefNode mkSet(LocOffsets loc, String name, LocOffsets argLoc, Node body) {
        return NodeBuilder.syntheticMethod1(loc, name, NodeBuilder.local(argLoc, Names.ARG0), body);
    }

    /**
     * {@code ::Chalk::ODM::<className>}.
     */
    public static UnresolvedConstantNode mkMutator(LocOffsets loc, String className) {
        UnresolvedConstantNode chalk = NodeBuilder.unresolvedConstant(loc,
                NodeBuilder.constant(loc, Symbols.ROOT), Names.CONSTANT_CHALK);
        UnresolvedConstantNode odm = NodeBuilder.unresolvedConstant(loc, chalk, Names.CONSTANT_ODM);
        return NodeBuilder.unresolvedConstant(loc, odm, className);
    }
}
