package me.christianrobert.ast2c.tree;

/**
 * Marker for a missing field or a JSON {@code null}.
 */
public final class AstAbsent implements AstValue {

    public static final AstAbsent INSTANCE = new AstAbsent();

    private AstAbsent() {
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.ABSENT;
    }

    @Override
    public String toString() {
        return "AstAbsent";
    }
}
