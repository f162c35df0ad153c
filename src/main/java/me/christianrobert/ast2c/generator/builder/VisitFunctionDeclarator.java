package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;

import java.util.stream.Collectors;

/**
 * Static helper for function declarators.
 *
 * <p>Visited on its own a function declarator renders nothing: its return type and parameters
 * only make sense through the declaration (or pointer) that owns it. The owners use
 * {@link #parameters} and {@link #carriesName} to build the signature.</p>
 */
public class VisitFunctionDeclarator {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        return "";
    }

    /**
     * Renders the parameter list (without parentheses).
     *
     * <p>Each parameter renders in parameter mode and the results are joined with {@code ", "}.
     * A missing list and a list that renders empty both become {@code void}.</p>
     */
    public static String parameters(AstNode funcDecl, GenerationContext ctx, CCodeBuilder b) {
        AstNode args = funcDecl.getNode("args");
        if (args == null) {
            return "void";
        }
        GenerationContext paramCtx = ctx.asParameter();
        String params = args.getSequence("params").getElements().stream()
                .map(param -> b.visit(param, paramCtx))
                .collect(Collectors.joining(", "));
        return params.isEmpty() ? "void" : params;
    }

    /**
     * Checks whether a rendered return type already ends with the function name
     * ({@code int add}, {@code char *dup}).
     */
    public static boolean carriesName(String returnType, String name) {
        if (name.isEmpty()) {
            return false;
        }
        String trimmed = returnType.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String[] tokens = trimmed.split("\\s+");
        String last = tokens[tokens.length - 1];
        int start = 0;
        while (start < last.length() && last.charAt(start) == '*') {
            start++;
        }
        return last.substring(start).equals(name);
    }
}
