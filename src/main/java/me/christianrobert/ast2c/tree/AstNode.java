package me.christianrobert.ast2c.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tagged syntax-tree node: a tag plus named children in insertion order.
 *
 * <p>Nodes are immutable once built. Field order is the order of the source document and is
 * significant: declared-name resolution and the generic fallback both walk fields in this order.</p>
 *
 * <p>Accessors never return null for structure: a missing field reads as {@link AstAbsent},
 * a missing sequence as an empty {@link AstSequence}.</p>
 */
public final class AstNode implements AstValue {

    private final String tag;
    private final NodeTag nodeTag;
    private final Map<String, AstValue> fields;

    private AstNode(String tag, Map<String, AstValue> fields) {
        this.tag = tag;
        this.nodeTag = NodeTag.fromTagName(tag);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public static Builder builder(NodeTag tag) {
        return new Builder(tag.getTagName());
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.NODE;
    }

    /**
     * Raw tag string (may be null for an untagged object).
     */
    public String getTag() {
        return tag;
    }

    public NodeTag getNodeTag() {
        return nodeTag;
    }

    public boolean is(NodeTag expected) {
        return nodeTag == expected;
    }

    /**
     * All fields except the tag, in insertion order.
     */
    public Map<String, AstValue> getFields() {
        return fields;
    }

    public AstValue get(String field) {
        AstValue value = fields.get(field);
        return value != null ? value : AstAbsent.INSTANCE;
    }

    public boolean has(String field) {
        return !get(field).isAbsent();
    }

    /**
     * Gets a child node, or null when the field is absent or not a node.
     */
    public AstNode getNode(String field) {
        AstValue value = get(field);
        return value.isNode() ? (AstNode) value : null;
    }

    /**
     * Gets a child sequence, or an empty sequence when the field is absent or not a sequence.
     */
    public AstSequence getSequence(String field) {
        AstValue value = get(field);
        return value.isSequence() ? (AstSequence) value : AstSequence.empty();
    }

    /**
     * Gets the text of a primitive field, or null when the field is absent or structured.
     */
    public String getText(String field) {
        AstValue value = get(field);
        return value.isPrimitive() ? ((AstPrimitive) value).getText() : null;
    }

    public String getText(String field, String defaultValue) {
        String text = getText(field);
        return text != null ? text : defaultValue;
    }

    @Override
    public String toString() {
        return "AstNode{tag=" + tag + ", fields=" + fields.keySet() + "}";
    }

    /**
     * Builds nodes field by field, keeping the order of the calls.
     */
    public static final class Builder {

        private final String tag;
        private final Map<String, AstValue> fields = new LinkedHashMap<>();

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder field(String name, AstValue value) {
            fields.put(name, value != null ? value : AstAbsent.INSTANCE);
            return this;
        }

        public Builder text(String name, String text) {
            return field(name, text != null ? AstPrimitive.of(text) : AstAbsent.INSTANCE);
        }

        public Builder sequence(String name, AstValue... elements) {
            return field(name, AstSequence.of(elements));
        }

        public AstNode build() {
            return new AstNode(tag, fields);
        }
    }
}
