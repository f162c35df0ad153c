package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for visiting compound blocks.
 *
 * <pre>
 * {                 ← current level
 *     statement;    ← current level + 1
 *     statement;
 * }                 ← current level
 * </pre>
 *
 * <p>An empty or missing item list renders as a bare brace pair on two lines.</p>
 */
public class VisitCompoundBlock {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        List<String> lines = new ArrayList<>();
        lines.add(ctx.indent() + "{");

        GenerationContext inner = ctx.nested();
        for (AstValue item : node.getSequence("block_items").getElements()) {
            lines.add(b.visitStatement(item, inner));
        }

        lines.add(ctx.indent() + "}");
        return String.join("\n", lines);
    }
}
