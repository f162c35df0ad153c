package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.NodeTag;

/**
 * Static helper for visiting declarations.
 *
 * <p>The tree nests type modifiers around the declared name (pointer of type-declarator of
 * base type), while C spells them interleaved: {@code char *name}. This helper re-linearizes
 * the two shapes a declaration can take.</p>
 *
 * <h3>Function prototype (type is a function declarator):</h3>
 * <pre>
 * Decl(name=add, type=FuncDecl(args=[a, b], type=TypeDecl(add, int)))
 *   → int add(int a, int b);
 * </pre>
 * <p>The return type is rendered first. When its text already ends with the function name
 * (the return-type declarator names the function itself) the name is not repeated. An empty
 * or missing parameter list is spelled {@code (void)}.</p>
 *
 * <h3>Everything else:</h3>
 * <pre>
 * Decl(name=x, type=TypeDecl(x, int), init=Constant(5))
 *   → int x = 5;
 * </pre>
 * <p>The declaration's own name is appended only when the type rendering did not already
 * declare it.</p>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>Statement position: leading indent and terminating semicolon</li>
 *   <li>Parameter list: neither indent nor semicolon</li>
 *   <li>The parameter flag reaches the type rendering; the initializer renders in statement mode</li>
 * </ul>
 */
public class VisitDeclaration {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        AstNode type = node.getNode("type");
        String name = node.getText("name", "");

        StringBuilder line = new StringBuilder();
        if (type != null && type.is(NodeTag.FUNCTION_DECLARATOR)) {
            line.append(prototype(type, name, ctx, b));
        } else {
            line.append(variable(node.get("type"), name, ctx, b));
        }

        AstValue init = node.get("init");
        if (!init.isAbsent()) {
            line.append(" = ").append(b.visit(init, ctx.asStatement()));
        }

        if (ctx.isInParameterList()) {
            return line.toString();
        }
        return ctx.indent() + line + ";";
    }

    private static String prototype(AstNode funcDecl, String name, GenerationContext ctx, CCodeBuilder b) {
        String returnType = b.visit(funcDecl.get("type"), ctx);
        String parameters = VisitFunctionDeclarator.parameters(funcDecl, ctx, b);

        if (VisitFunctionDeclarator.carriesName(returnType, name)) {
            return returnType + "(" + parameters + ")";
        }
        return join(returnType, name) + "(" + parameters + ")";
    }

    private static String variable(AstValue type, String name, GenerationContext ctx, CCodeBuilder b) {
        String typeCode = b.visit(type, ctx);
        if (name.isEmpty() || alreadyDeclared(type, name)) {
            return typeCode;
        }
        return join(typeCode, name);
    }

    private static boolean alreadyDeclared(AstValue type, String name) {
        if (DeclaredNameResolver.resolve(type).map(name::equals).orElse(false)) {
            return true;
        }
        // Function pointers keep their parameter names ahead of the pointer's own name
        // in field order, so the chain is followed instead.
        return type.isNode() && ((AstNode) type).is(NodeTag.POINTER_DECLARATOR)
                && name.equals(VisitPointerDeclarator.chainName((AstNode) type));
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        return left + " " + right;
    }
}
