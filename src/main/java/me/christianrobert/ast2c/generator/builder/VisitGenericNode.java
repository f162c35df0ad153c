package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;

/**
 * Fallback for every tag without a dedicated rule (and for untagged objects).
 *
 * <p>Concatenates, in field order, the rendering of every node-valued field and of every
 * element of every sequence-valued field. The tag itself and primitive-valued fields
 * contribute nothing, so e.g. the operator of a unary operation is lost:
 * {@code UnaryOp(op=p++, expr=ID(i))} renders as {@code i}.</p>
 *
 * <p>Never fails: unsupported constructs degrade to whatever is renderable inside them.</p>
 */
public class VisitGenericNode {

    public static String v(AstNode node, GenerationContext ctx, CCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        for (AstValue child : node.getFields().values()) {
            switch (child.getKind()) {
                case NODE:
                    result.append(b.visit(child, ctx));
                    break;
                case SEQUENCE:
                    for (AstValue element : ((AstSequence) child).getElements()) {
                        result.append(b.visit(element, ctx));
                    }
                    break;
                default:
                    // PRIMITIVE, ABSENT: dropped
                    break;
            }
        }
        return result.toString();
    }
}
