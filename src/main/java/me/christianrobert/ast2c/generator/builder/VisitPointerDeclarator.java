package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.NodeTag;

/**
 * Static helper for visiting pointer declarators.
 *
 * <p>A run of nested pointer declarators collapses into one run of {@code *} markers placed
 * between the base type and the declared name:</p>
 * <pre>
 * PtrDecl(TypeDecl(name, char))           → char *name
 * PtrDecl(PtrDecl(TypeDecl(argv, char)))  → char **argv
 * PtrDecl(TypeDecl(null, char))           → char *          (abstract, e.g. in a cast or prototype)
 * PtrDecl(FuncDecl([int a], TypeDecl(fp, int)))
 *                                         → int (*fp)(int a)
 * </pre>
 *
 * <p>The declared name ends up inside this rendering, so the enclosing declaration sees it
 * as already declared and does not repeat it.</p>
 *
 * <p>Any other terminal (array declarators, unknown tags) renders best-effort as the
 * terminal's own rendering followed by the markers.</p>
 */
public class VisitPointerDeclarator {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        int depth = 0;
        AstValue current = node;
        while (isTag(current, NodeTag.POINTER_DECLARATOR)) {
            depth++;
            current = ((AstNode) current).get("type");
        }
        String markers = "*".repeat(depth);

        if (isTag(current, NodeTag.TYPE_DECLARATOR)) {
            AstNode typeDecl = (AstNode) current;
            String base = b.visit(typeDecl.get("type"), ctx);
            String declname = typeDecl.getText(DeclaredNameResolver.DECLNAME_FIELD, "");
            return join(base, markers + declname);
        }

        if (isTag(current, NodeTag.FUNCTION_DECLARATOR)) {
            return functionPointer((AstNode) current, markers, ctx, b);
        }

        return join(b.visit(current, ctx), markers);
    }

    /**
     * Follows the declarator chain (type links only) and returns the name it declares,
     * or empty string if the chain ends without one.
     */
    public static String chainName(AstNode node) {
        AstValue current = node;
        while (current.isNode()) {
            AstNode link = (AstNode) current;
            switch (link.getNodeTag()) {
                case TYPE_DECLARATOR:
                    return link.getText(DeclaredNameResolver.DECLNAME_FIELD, "");
                case POINTER_DECLARATOR:
                case FUNCTION_DECLARATOR:
                case TYPE_REFERENCE:
                    current = link.get("type");
                    break;
                default:
                    return "";
            }
        }
        return "";
    }

    // Return type of a function pointer: ret_base [*...] (*name)(params)
    private static String functionPointer(AstNode funcDecl, String markers, GenerationContext ctx, CCodeBuilder b) {
        int returnDepth = 0;
        AstValue returnChain = funcDecl.get("type");
        while (isTag(returnChain, NodeTag.POINTER_DECLARATOR)) {
            returnDepth++;
            returnChain = ((AstNode) returnChain).get("type");
        }

        String returnBase;
        String name;
        if (isTag(returnChain, NodeTag.TYPE_DECLARATOR)) {
            AstNode typeDecl = (AstNode) returnChain;
            returnBase = b.visit(typeDecl.get("type"), ctx);
            name = typeDecl.getText(DeclaredNameResolver.DECLNAME_FIELD, "");
        } else {
            returnBase = b.visit(returnChain, ctx);
            name = "";
        }

        String returnType = returnDepth > 0 ? join(returnBase, "*".repeat(returnDepth)) : returnBase;
        String parameters = VisitFunctionDeclarator.parameters(funcDecl, ctx, b);
        return join(returnType, "(" + markers + name + ")") + "(" + parameters + ")";
    }

    private static boolean isTag(AstValue value, NodeTag tag) {
        return value.isNode() && ((AstNode) value).is(tag);
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + " " + right;
    }
}
