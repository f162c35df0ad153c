package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstValue;

/**
 * Static helper for visiting RETURN statements.
 *
 * <pre>
 * return expression;
 * return;            (no expression)
 * </pre>
 */
public class VisitReturn {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        AstValue expr = node.get("expr");
        if (expr.isAbsent()) {
            return ctx.indent() + "return;";
        }
        return ctx.indent() + "return " + b.visit(expr, ctx) + ";";
    }
}
