package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstValue;

/**
 * Static helper for visiting function definitions.
 *
 * <p>The signature is the owning declaration rendered as a statement, minus its terminating
 * semicolon. The body block follows on the next line:</p>
 * <pre>
 * int add(int a, int b)
 * {
 *     return (a + b);
 * }
 * </pre>
 */
public class VisitFunctionDefinition {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        GenerationContext statementCtx = ctx.asStatement();

        String signature = b.visit(node.get("decl"), statementCtx);
        if (signature.endsWith(";")) {
            signature = signature.substring(0, signature.length() - 1);
        }

        AstValue body = node.get("body");
        if (body.isAbsent()) {
            return signature;
        }
        if (CCodeBuilder.isBlock(body)) {
            return signature + "\n" + b.visit(body, statementCtx);
        }
        return signature + " " + b.visit(body, statementCtx);
    }
}
