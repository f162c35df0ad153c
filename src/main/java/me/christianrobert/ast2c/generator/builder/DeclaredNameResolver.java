package me.christianrobert.ast2c.generator.builder;

import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;

import java.util.Optional;

/**
 * Finds the first declared identifier anywhere inside a (sub)tree.
 *
 * <p>Search order is a fixed pre-order walk: a node's own {@code declname} first, then each
 * field in insertion order; a sequence's elements in order. Primitives and absent values
 * contribute nothing. The first non-empty name wins.</p>
 *
 * <p>Used by declaration rendering to decide whether the declaration's name was already
 * emitted by its type declarator.</p>
 */
public final class DeclaredNameResolver {

    public static final String DECLNAME_FIELD = "declname";

    private DeclaredNameResolver() {
    }

    /**
     * Resolves the first declared name in the given value.
     *
     * @param value Any tree value
     * @return The first non-empty declared name, or empty if the subtree declares nothing
     */
    public static Optional<String> resolve(AstValue value) {
        switch (value.getKind()) {
            case NODE:
                AstNode node = (AstNode) value;
                String declname = node.getText(DECLNAME_FIELD);
                if (declname != null && !declname.isEmpty()) {
                    return Optional.of(declname);
                }
                for (AstValue child : node.getFields().values()) {
                    Optional<String> found = resolve(child);
                    if (found.isPresent()) {
                        return found;
                    }
                }
                return Optional.empty();
            case SEQUENCE:
                for (AstValue element : ((AstSequence) value).getElements()) {
                    Optional<String> found = resolve(element);
                    if (found.isPresent()) {
                        return found;
                    }
                }
                return Optional.empty();
            default:
                // PRIMITIVE, ABSENT
                return Optional.empty();
        }
    }
}
