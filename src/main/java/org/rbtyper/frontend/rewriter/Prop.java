package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.MutableContext;
import org.rbtyper.core.errors.RewriterException;
import org.rbtyper.frontend.astnode.ClassDefNode;
import org.rbtyper.frontend.astnode.Node;
import org.rbtyper.frontend.astnode.SendNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prop rewrites the property declarations of one class body into ordinary
 * method definitions, so the type checker never has to know about the
 * macros.
 * <p>
 * The rewrite happens in two passes over the body: the first parses every
 * declaration and records its replacement by statement identity, the second
 * rebuilds the statement list in the original order. Statements that are
 * not property declarations are kept exactly as they were.
 */
public class Prop {
    private static final boolean DEBUG_PROP = Boolean.getBoolean("debug.rewriter.prop");

    /**
     * Rewrites {@code klass.rhs} in place.
     *
     * @param ctx   the rewrite context; nothing happens under autogeneration
     * @param klass the class whose direct statements are rewritten
     */
    public static void run(MutableContext ctx, ClassDefNode klass) {
        if (ctx.runningUnderAutogen()) {
            return;
        }

        boolean forTStruct = false;
        for (Node ancestor : klass.ancestors) {
            if (ASTUtil.isTStruct(ancestor)) {
                forTStruct = true;
                break;
            }
        }

        Map<Node, List<Node>> replaceNodes = new IdentityHashMap<>();
        List<PropInfo> props = new ArrayList<>();
        for (Node stat : klass.rhs) {
            if (!(stat instanceof SendNode send)) {
                continue;
            }
            PropInfo propInfo = PropParser.parseProp(ctx, send);
            if (propInfo == null) {
                continue;
            }
            List<Node> nodes = PropSynthesizer.processProp(ctx, propInfo, forTStruct);
            RewriterException.check(!nodes.isEmpty(), "if parseProp completed successfully, processProp must complete too");
            replaceNodes.put(stat, nodes);
            props.add(propInfo);
            if (DEBUG_PROP) {
                System.err.println("DEBUG: Prop: " + propInfo + " -> " + nodes.size() + " statements");
            }
        }

        if (replaceNodes.isEmpty() && !forTStruct) {
            return;
        }

        List<Node> oldRhs = new ArrayList<>(klass.rhs);
        klass.rhs.clear();
        if (forTStruct) {
            // Ours goes first so a user-written initialize later in the body overrides it
            klass.rhs.addAll(StructInitializer.mkInitialize(ctx, klass.loc, props));
        }
        for (Node stat : oldRhs) {
            List<Node> replacement = replaceNodes.get(stat);
            if (replacement == null) {
                klass.rhs.add(stat);
            } else {
                klass.rhs.addAll(replacement);
            }
        }
    }
}
