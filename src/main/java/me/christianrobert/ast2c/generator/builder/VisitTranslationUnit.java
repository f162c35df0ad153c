package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

import java.util.stream.Collectors;

/**
 * Static helper for visiting the translation unit (tree root).
 *
 * <p>Each top-level declaration or definition is rendered on its own, separated by a blank line.</p>
 */
public class VisitTranslationUnit {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        return node.getSequence("ext").getElements().stream()
                .map(external -> b.visit(external, ctx))
                .collect(Collectors.joining("\n\n"));
    }
}
