package me.christianrobert.ast2c.tree;

import java.util.Objects;

/**
 * Leaf value (string, number or boolean) kept as its literal text.
 */
public final class AstPrimitive implements AstValue {

    private final String text;

    private AstPrimitive(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public static AstPrimitive of(String text) {
        return new AstPrimitive(text);
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.PRIMITIVE;
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return text.equals(((AstPrimitive) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "AstPrimitive{" + text + "}";
    }
}
