package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

/**
 * Static helper for visiting assignments.
 *
 * <p>The operator is taken verbatim from the node, so compound operators ({@code +=}, {@code <<=})
 * pass through unchanged. A missing operator means plain {@code =}.</p>
 */
public class VisitAssignment {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String lvalue = b.visit(node.get("lvalue"), ctx);
        String rvalue = b.visit(node.get("rvalue"), ctx);
        String op = node.getText("op", "=");
        return ctx.indent() + lvalue + " " + op + " " + rvalue + ";";
    }
}
