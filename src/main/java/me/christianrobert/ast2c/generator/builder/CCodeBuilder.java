package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstPrimitive;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.NodeTag;

import java.util.stream.Collectors;

/**
 * Renders a syntax tree back into C source text.
 *
 * <p>One recursive entry point, {@link #visit(AstValue, GenerationContext)}, dispatches on the
 * node tag to a static helper per construct ({@code VisitDeclaration}, {@code VisitCompoundBlock}, ...).
 * Helpers compose their output by calling back into the builder for their children. Indentation
 * and statement terminators are decided here, not read from the tree.</p>
 *
 * <p>The builder is stateless: output depends only on the subtree and the context, so one
 * instance can render any number of trees, also from several threads.</p>
 */
public class CCodeBuilder {

    // no logging is desired, this would create an overkill of logs

    private final GenerationContext rootContext;

    /**
     * Creates a builder with the default four-space indent unit.
     */
    public CCodeBuilder() {
        this(GenerationContext.root());
    }

    /**
     * Creates a builder whose top-level calls start from the given context.
     *
     * @param rootContext Context for the root node (normally level 0, statement position)
     */
    public CCodeBuilder(GenerationContext rootContext) {
        this.rootContext = rootContext;
    }

    public GenerationContext getRootContext() {
        return rootContext;
    }

    /**
     * Renders a whole tree, starting from the root context.
     *
     * @param root Tree root (normally a translation unit)
     * @return C source text
     */
    public String generate(AstValue root) {
        return visit(root, rootContext);
    }

    /**
     * Renders any tree value.
     *
     * <ul>
     *   <li>node: dispatched by tag</li>
     *   <li>sequence: elements rendered and joined by newline</li>
     *   <li>primitive: its text</li>
     *   <li>absent: empty string</li>
     * </ul>
     */
    public String visit(AstValue value, GenerationContext ctx) {
        return switch (value.getKind()) {
            case NODE -> visitNode((AstNode) value, ctx);
            case SEQUENCE -> ((AstSequence) value).getElements().stream()
                    .map(element -> visit(element, ctx))
                    .collect(Collectors.joining("\n"));
            case PRIMITIVE -> ((AstPrimitive) value).getText();
            case ABSENT -> "";
        };
    }

    private String visitNode(AstNode node, GenerationContext ctx) {
        return switch (node.getNodeTag()) {
            case TRANSLATION_UNIT -> VisitTranslationUnit.v(node, ctx, this);
            case DECLARATION -> VisitDeclaration.v(node, ctx, this);
            case FUNCTION_DEFINITION -> VisitFunctionDefinition.v(node, ctx, this);
            case FUNCTION_DECLARATOR -> VisitFunctionDeclarator.v(node, ctx, this);
            case TYPE_DECLARATOR -> VisitTypeDeclarator.v(node, ctx, this);
            case IDENTIFIER_TYPE -> VisitIdentifierType.v(node, ctx, this);
            case POINTER_DECLARATOR -> VisitPointerDeclarator.v(node, ctx, this);
            case TYPE_REFERENCE -> visit(node.get("type"), ctx);
            case COMPOUND_BLOCK -> VisitCompoundBlock.v(node, ctx, this);
            case RETURN -> VisitReturn.v(node, ctx, this);
            case CALL -> VisitCall.v(node, ctx, this);
            case ASSIGNMENT -> VisitAssignment.v(node, ctx, this);
            case BINARY_OPERATION -> VisitBinaryOperation.v(node, ctx, this);
            case IDENTIFIER_REFERENCE -> node.getText("name", "");
            case LITERAL -> node.getText("value", "");
            case CONDITIONAL -> VisitConditional.v(node, ctx, this);
            case WHILE_LOOP -> VisitWhileLoop.v(node, ctx, this);
            case INDEX_ACCESS -> VisitIndexAccess.v(node, ctx, this);
            case GENERIC -> VisitGenericNode.v(node, ctx, this);
        };
    }

    /**
     * Renders a value in statement position (a block item or a branch body).
     *
     * <p>Expressions standing alone as statements ({@code foo(x)}, {@code a[i]}) get the
     * line indent and a terminating semicolon. Nodes without a rule of their own get the line
     * indent unless their rendering already starts with it. Everything else renders as usual,
     * since statements carry their own indent and terminator.</p>
     */
    public String visitStatement(AstValue value, GenerationContext ctx) {
        if (!value.isNode()) {
            return visit(value, ctx);
        }
        NodeTag tag = ((AstNode) value).getNodeTag();
        if (tag.isExpression()) {
            return ctx.indent() + visit(value, ctx) + ";";
        }
        String code = visit(value, ctx);
        if (tag == NodeTag.GENERIC && !code.isEmpty() && !code.startsWith(ctx.indent())) {
            return ctx.indent() + code;
        }
        return code;
    }

    /**
     * Renders the body of an if/else/while, including the separator in front of it.
     *
     * <p>A block starts on the next line with its braces at the owning statement's level.
     * Any other statement follows on the same line after one space.</p>
     *
     * @param body Branch body (may be absent)
     * @param ctx Context of the owning statement
     * @return Separator plus rendered body, or empty string if there is no body
     */
    public String visitBranch(AstValue body, GenerationContext ctx) {
        if (body.isAbsent()) {
            return "";
        }
        if (isBlock(body)) {
            return "\n" + visit(body, ctx);
        }
        return " " + visitStatement(body, ctx).stripLeading();
    }

    /**
     * Checks whether a value is a compound block.
     */
    public static boolean isBlock(AstValue value) {
        return value.isNode() && ((AstNode) value).is(NodeTag.COMPOUND_BLOCK);
    }
}
