package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

/**
 * Static helper for visiting WHILE loops: {@code while (cond)} followed by the body,
 * laid out like an IF branch.
 */
public class VisitWhileLoop {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String condition = b.visit(node.get("cond"), ctx);
        return ctx.indent() + "while (" + condition + ")" + b.visitBranch(node.get("stmt"), ctx);
    }
}
