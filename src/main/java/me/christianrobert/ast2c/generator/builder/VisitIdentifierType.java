package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

import java.util.stream.Collectors;

/**
 * Static helper for base type names. Multi-token names ({@code unsigned long}) are joined with spaces.
 */
public class VisitIdentifierType {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        return node.getSequence("names").getElements().stream()
                .map(token -> b.visit(token, ctx))
                .collect(Collectors.joining(" "));
    }
}
