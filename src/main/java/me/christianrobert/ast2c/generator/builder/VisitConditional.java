package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstValue;

/**
 * Static helper for visiting IF statements.
 *
 * <h3>Block branches:</h3>
 * <pre>
 * if ((a &gt; b))
 * {
 *     return a;
 * }
 * else
 * {
 *     return b;
 * }
 * </pre>
 *
 * <h3>Statement branches:</h3>
 * <pre>
 * if ((a &gt; b)) return a; else return b;
 * </pre>
 *
 * <p>An {@code else if} chain falls out of the statement-branch form: the nested IF is rendered
 * at the same level with its leading indent dropped.</p>
 *
 * <p>A then-branch ending in an IF without ELSE is braced when an ELSE follows, so the ELSE
 * keeps binding to this IF:</p>
 * <pre>
 * if (a)
 * {
 *     if (b) x = 1;
 * }
 * else y = 2;
 * </pre>
 */
public class VisitConditional {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        StringBuilder result = new StringBuilder();

        result.append(ctx.indent()).append("if (");
        result.append(b.visit(node.get("cond"), ctx));
        result.append(")");

        AstValue thenBranch = node.get("iftrue");
        AstValue elseBranch = node.get("iffalse");
        boolean braced = !elseBranch.isAbsent() && endsWithOpenIf(thenBranch);
        if (braced) {
            result.append("\n").append(ctx.indent()).append("{\n");
            result.append(b.visitStatement(thenBranch, ctx.nested()));
            result.append("\n").append(ctx.indent()).append("}");
        } else {
            result.append(b.visitBranch(thenBranch, ctx));
        }

        if (!elseBranch.isAbsent()) {
            if (braced || CCodeBuilder.isBlock(thenBranch)) {
                result.append("\n").append(ctx.indent()).append("else");
            } else {
                result.append(" else");
            }
            result.append(b.visitBranch(elseBranch, ctx));
        }

        return result.toString();
    }

    // Whether a trailing ELSE would attach to an IF inside this statement
    private static boolean endsWithOpenIf(AstValue statement) {
        if (!statement.isNode()) {
            return false;
        }
        AstNode node = (AstNode) statement;
        switch (node.getNodeTag()) {
            case CONDITIONAL:
                AstValue elseBranch = node.get("iffalse");
                return elseBranch.isAbsent() || endsWithOpenIf(elseBranch);
            case WHILE_LOOP:
                return endsWithOpenIf(node.get("stmt"));
            default:
                return false;
        }
    }
}
