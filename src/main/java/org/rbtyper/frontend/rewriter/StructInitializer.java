package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.frontend.astnode.HashLiteralNode;
import org.rbtyper.frontend.astnode.Node;
import org.rbtyper.symbols.Names;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes {@code initialize} for classes deriving from {@code T::Struct}.
 * <p>
 * Given
 * <pre>
 * prop :a, Integer
 * prop :b, Integer, default: 1
 * prop :c, String
 * </pre>
 * it produces
 * <pre>
 * sig {params(a: Integer, c: String, b: Integer).void}
 * def initialize(a:, c:, b: 1)
 *   @a = a
 *   @b = b
 *   @c = c
 *   super
 * end
 * </pre>
 * Required keywords come first so the signature reads naturally; the
 * assignments keep declaration order.
 */
public class StructInitializer {

    public static List<Node> mkInitialize(MutableContext ctx, LocOffsets klassLoc, List<PropInfo> props) {
        List<Node> args = new ArrayList<>(props.size());
        HashLiteralNode sigParams = NodeBuilder.hash0(klassLoc);

        // add all the required props first.
        for (PropInfo prop : props) {
            if (prop.hasDefault()) {
                continue;
            }
            LocOffsets loc = prop.loc;
            args.add(NodeBuilder.keywordArg(loc, NodeBuilder.local(loc, prop.name)));
            sigParams.keys.add(NodeBuilder.symbol(loc, prop.name));
            sigParams.values.add(prop.type.deepCopy());
        }

        // then, add all the optional props.
        for (PropInfo prop : props) {
            if (!prop.hasDefault()) {
                continue;
            }
            LocOffsets loc = prop.loc;
            args.add(NodeBuilder.optionalArg(loc,
                    NodeBuilder.keywordArg(loc, NodeBuilder.local(loc, prop.name)),
                    prop.defaultValue.deepCopy()));
            sigParams.keys.add(NodeBuilder.symbol(loc, prop.name));
            sigParams.values.add(prop.type.deepCopy());
        }

        // then initialize all the instance variables in the body
        List<Node> stats = new ArrayList<>(props.size());
        for (PropInfo prop : props) {
            String ivarName = ctx.state.names.instanceVariableName(prop.name);
            stats.add(NodeBuilder.assign(prop.loc,
                    NodeBuilder.instance(prop.nameLoc, ivarName),
                    NodeBuilder.local(prop.nameLoc, prop.name)));
        }
        Node body = NodeBuilder.insSeq(klassLoc, stats, NodeBuilder.zSuper(klassLoc));

        List<Node> result = new ArrayList<>();
        result.add(NodeBuilder.sigVoid(klassLoc, sigParams));
        result.add(NodeBuilder.syntheticMethod(klassLoc, Names.INITIALIZE, args, body));
        return result;
    }
}
