package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.Loc;
import org.rbtyper.core.LocOffsets;
import org.rbtyper.core.MutableContext;
import org.rbtyper.core.errors.ErrorBuilder;
import org.rbtyper.core.errors.RewriterErrors;
import org.rbtyper.core.errors.RewriterException;
import org.rbtyper.frontend.astnode.HashLiteralNode;
import org.rbtyper.frontend.astnode.LiteralNode;
import org.rbtyper.frontend.astnode.Node;
import org.rbtyper.frontend.astnode.SendNode;
import org.rbtyper.symbols.Names;
import org.rbtyper.symbols.Symbols;

import java.util.List;

/**
 * Recognizes property declarations and reads their options.
 * <p>
 * Accepted shapes:
 * <pre>
 * prop :name, Type
 * prop :name, Type, key: value, ...
 * const :name, Type, ...
 * token_prop / timestamped_token_prop / created_prop / merchant_prop [key: value, ...]
 * </pre>
 * Anything else is left for later phases to report: a call that is not
 * recognized here produces no diagnostic.
 */
public class PropParser {

    // Length of the "_prop" suffix that separates e.g. `created_prop` from `created`
    private static final int PROP_SUFFIX_LENGTH = 5;
    // Length of the "timestamped_" prefix
    private static final int TIMESTAMPED_PREFIX_LENGTH = 12;

    /**
     * Classifies {@code send} and, if it is a property declaration, parses it.
     *
     * @param ctx  the rewrite context
     * @param send a statement of a class body
     * @return the parsed declaration, or null if {@code send} is not one
     */
    public static PropInfo parseProp(MutableContext ctx, SendNode send) {
        PropInfo ret = new PropInfo();
        ret.loc = send.loc;
        List<Node> args = send.args;

        // ----- Is this a send we care about? -----
        switch (send.fun) {
            case Names.PROP:
                break;
            case Names.CONST:
                ret.isImmutable = true;
                break;
            case Names.TOKEN_PROP:
            case Names.TIMESTAMPED_TOKEN_PROP:
                ret.name = Names.TOKEN;
                ret.nameLoc = sliceLoc(send.loc,
                        Names.TIMESTAMPED_TOKEN_PROP.equals(send.fun) ? TIMESTAMPED_PREFIX_LENGTH : 0);
                ret.type = NodeBuilder.constant(send.loc, Symbols.STRING);
                break;
            case Names.CREATED_PROP:
                ret.name = Names.CREATED;
                ret.nameLoc = sliceLoc(send.loc, 0);
                ret.type = NodeBuilder.constant(send.loc, Symbols.FLOAT);
                break;
            case Names.MERCHANT_PROP:
                ret.isImmutable = true;
                ret.name = Names.MERCHANT;
                ret.nameLoc = sliceLoc(send.loc, 0);
                ret.type = NodeBuilder.constant(send.loc, Symbols.STRING);
                break;
            default:
                return null;
        }

        if (args.size() >= 4) {
            // Too many args, even if all optional args were provided
            return null;
        }

        // ----- What's the prop's name? -----
        if (ret.name == null) {
            if (args.isEmpty()) {
                return null;
            }
            if (!(args.get(0) instanceof LiteralNode sym) || !sym.isSymbol()) {
                return null;
            }
            ret.name = ctx.enterName(sym.value);
            ret.nameLoc = sym.loc.exists() ? sym.loc.withBegin(sym.loc.beginPos + 1) : LocOffsets.none();
        } else if (isTokenAlias(send.fun) && args.size() > (endsWithOptions(args) ? 1 : 0)) {
            // Token props take no name argument, only options
            return null;
        }

        // ----- What's the prop's type? -----
        if (ret.type == null) {
            if (args.size() == 1) {
                // Type must have been implied by the alias or given in the second argument
                return null;
            }
            ret.type = ASTUtil.dupType(args.get(1));
            if (ret.type == null) {
                return null;
            }
        }

        RewriterException.check(ASTUtil.isTypeExpression(ret.type), "No obvious type AST for this prop");

        // ----- Does the prop have any extra options? -----
        HashLiteralNode rules = null;
        if (endsWithOptions(args)) {
            // Work on a copy so options can be pulled out without touching the original call
            rules = (HashLiteralNode) args.get(args.size() - 1).deepCopy();
        }
        if (rules == null && args.size() >= 3) {
            // No options, but three args including name and type: not a property declaration
            return null;
        }

        if (rules != null) {
            parseOptions(ctx, ret, rules);
        }

        if (ret.defaultValue == null && ASTUtil.isTNilable(ret.type)) {
            ret.defaultValue = NodeBuilder.nil(ret.loc);
        }

        return ret;
    }

    /**
     * Pulls the recognized keys out of {@code rules}, a private copy of the
     * declaration's options map. Unknown keys are ignored.
     */
    static void parseOptions(MutableContext ctx, PropInfo ret, HashLiteralNode rules) {
        if (ASTUtil.hasTruthyHashValue(rules, Names.IMMUTABLE)) {
            ret.isImmutable = true;
        }

        if (ASTUtil.hasTruthyHashValue(rules, Names.FACTORY)) {
            ret.defaultValue = NodeBuilder.raiseUnimplemented(ret.loc);
        } else if (ASTUtil.hasHashValue(rules, Names.DEFAULT)) {
            ret.defaultValue = ASTUtil.extractHashValue(rules, Names.DEFAULT);
        }

        // e.g. `const :foo, type, computed_by: :method_name`
        if (ASTUtil.hasTruthyHashValue(rules, Names.COMPUTED_BY)) {
            Node val = ASTUtil.extractHashValue(rules, Names.COMPUTED_BY);
            if (val instanceof LiteralNode lit && lit.isSymbol()) {
                ret.computedByMethodNameLoc = lit.loc;
                ret.computedByMethodName = ctx.enterName(lit.value);
            } else {
                try (ErrorBuilder e = ctx.beginError(val.getLoc(), RewriterErrors.COMPUTED_BY_SYMBOL)) {
                    e.setHeader("Value for `{}` must be a symbol literal", Names.COMPUTED_BY);
                }
            }
        }

        Node foreignTree = ASTUtil.extractHashValue(rules, Names.FOREIGN);
        if (foreignTree != null) {
            Node body = ASTUtil.thunkBody(foreignTree);
            if (body != null) {
                ret.foreign = body;
            } else {
                ret.foreign = foreignTree;
                try (ErrorBuilder e = ctx.beginError(foreignTree.getLoc(), RewriterErrors.PROP_FOREIGN_STRICT)) {
                    e.setHeader("The argument to `{}` must be a lambda", "foreign:");
                    Loc foreignLoc = ctx.locAt(foreignTree.getLoc());
                    String source = foreignLoc.source();
                    if (!source.isEmpty()) {
                        e.replaceWith("Convert to lambda", foreignLoc, "-> {{{}}}", source);
                    }
                }
            }
        }

        Node ifunset = ASTUtil.extractHashValue(rules, Names.IFUNSET);
        if (ifunset != null) {
            ret.ifunset = ifunset;
        }
    }

    private static boolean isTokenAlias(String fun) {
        return Names.TOKEN_PROP.equals(fun) || Names.TIMESTAMPED_TOKEN_PROP.equals(fun);
    }

    private static boolean endsWithOptions(List<Node> args) {
        return !args.isEmpty() && args.get(args.size() - 1) instanceof HashLiteralNode;
    }

    /**
     * The part of an alias call's range that spells the implied name, e.g.
     * {@code token} in {@code timestamped_token_prop}.
     */
    private static LocOffsets sliceLoc(LocOffsets callLoc, int prefixLength) {
        if (!callLoc.exists()) {
            return LocOffsets.none();
        }
        return LocOffsets.clamped(callLoc.beginPos + prefixLength, callLoc.endPos - PROP_SUFFIX_LENGTH);
    }
}
