package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

/**
 * Static helper for visiting binary operations.
 *
 * <p>Always fully parenthesized: {@code (left op right)}. No precedence table is needed and
 * regenerating the output's own tree yields the same text.</p>
 */
public class VisitBinaryOperation {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String left = b.visit(node.get("left"), ctx);
        String right = b.visit(node.get("right"), ctx);
        String op = node.getText("op", "");
        return "(" + left + " " + op + " " + right + ")";
    }
}
