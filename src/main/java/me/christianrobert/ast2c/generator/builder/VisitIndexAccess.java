package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

public class VisitIndexAccess {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String base = b.visit(node.get("name"), ctx);
        String subscript = b.visit(node.get("subscript"), ctx);
        return base + "[" + subscript + "]";
    }
}
