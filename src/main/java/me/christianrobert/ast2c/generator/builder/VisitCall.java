package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

import java.util.stream.Collectors;

/**
 * Static helper for visiting function calls: {@code callee(arg1, arg2)}.
 *
 * <p>Arguments render in the caller's context; a call never indents its own arguments.</p>
 */
public class VisitCall {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        String callee = b.visit(node.get("name"), ctx);

        String arguments = "";
        AstNode args = node.getNode("args");
        if (args != null) {
            arguments = args.getSequence("exprs").getElements().stream()
                    .map(expr -> b.visit(expr, ctx))
                    .collect(Collectors.joining(", "));
        }

        return callee + "(" + arguments + ")";
    }
}
