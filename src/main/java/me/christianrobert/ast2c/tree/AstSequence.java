package me.christianrobert.ast2c.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of tree values (statement lists, parameter lists, argument lists, type-name tokens).
 * Order is significant and preserved exactly as ingested.
 */
public final class AstSequence implements AstValue {

    private static final AstSequence EMPTY = new AstSequence(Collections.emptyList());

    private final List<AstValue> elements;

    private AstSequence(List<AstValue> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static AstSequence of(List<? extends AstValue> elements) {
        if (elements == null || elements.isEmpty()) {
            return EMPTY;
        }
        return new AstSequence(new ArrayList<>(elements));
    }

    public static AstSequence of(AstValue... elements) {
        return of(Arrays.asList(elements));
    }

    public static AstSequence empty() {
        return EMPTY;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.SEQUENCE;
    }

    public List<AstValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return "AstSequence{size=" + elements.size() + "}";
    }
}
