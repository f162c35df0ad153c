package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

/**
 * Static helper for type declarators: the inner type followed by the declared name, if any.
 */
public class VisitTypeDeclarator {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String inner = b.visit(node.get("type"), ctx);
        String declname = node.getText(DeclaredNameResolver.DECLNAME_FIELD);
        if (declname == null || declname.isEmpty()) {
            return inner;
        }
        if (inner.isEmpty()) {
            return declname;
        }
        return inner + " " + declname;
    }
}
