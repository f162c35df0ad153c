package me.christianrobert.ast2c.tree;

/**
 * A value in the syntax tree: a tagged node, an ordered sequence, a primitive leaf, or nothing.
 *
 * <p>Consumers switch over {@link #getKind()} instead of probing with {@code instanceof},
 * so every walker has to say what it does with each of the four shapes.</p>
 */
public interface AstValue {

    /**
     * The four shapes a tree value can take.
     */
    enum ValueKind {
        NODE,
        SEQUENCE,
        PRIMITIVE,
        ABSENT
    }

    ValueKind getKind();

    default boolean isNode() {
        return getKind() == ValueKind.NODE;
    }

    default boolean isSequence() {
        return getKind() == ValueKind.SEQUENCE;
    }

    default boolean isPrimitive() {
        return getKind() == ValueKind.PRIMITIVE;
    }

    default boolean isAbsent() {
        return getKind() == ValueKind.ABSENT;
    }
}
