package me.christianrobert.ast2c.tree;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of node tags the generator renders with a dedicated rule.
 *
 * <p>Every tag string outside this set, and a node without a tag, maps to {@link #GENERIC}.
 * The generator switches exhaustively over these constants, so adding a tag here forces a
 * rendering rule to be written for it.</p>
 */
public enum NodeTag {

    TRANSLATION_UNIT("FileAST"),
    DECLARATION("Decl"),
    FUNCTION_DEFINITION("FuncDef"),
    FUNCTION_DECLARATOR("FuncDecl"),
    TYPE_DECLARATOR("TypeDecl"),
    IDENTIFIER_TYPE("IdentifierType"),
    POINTER_DECLARATOR("PtrDecl"),
    TYPE_REFERENCE("Typename"),
    COMPOUND_BLOCK("Compound"),
    RETURN("Return"),
    CALL("FuncCall"),
    ASSIGNMENT("Assignment"),
    BINARY_OPERATION("BinaryOp"),
    IDENTIFIER_REFERENCE("ID"),
    LITERAL("Constant"),
    CONDITIONAL("If"),
    WHILE_LOOP("While"),
    INDEX_ACCESS("ArrayRef"),
    GENERIC(null);

    private static final Map<String, NodeTag> BY_TAG = new HashMap<>();

    static {
        for (NodeTag tag : values()) {
            if (tag.tagName != null) {
                BY_TAG.put(tag.tagName, tag);
            }
        }
    }

    private final String tagName;

    NodeTag(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Tag string as it appears under {@code _nodetype} in the tree dump (null for GENERIC).
     */
    public String getTagName() {
        return tagName;
    }

    /**
     * Resolves a raw tag string. Unknown and null tags resolve to {@link #GENERIC}.
     */
    public static NodeTag fromTagName(String tagName) {
        if (tagName == null) {
            return GENERIC;
        }
        return BY_TAG.getOrDefault(tagName, GENERIC);
    }

    /**
     * Tags that render as expressions. Directly inside a block they become expression statements.
     */
    public boolean isExpression() {
        switch (this) {
            case CALL:
            case BINARY_OPERATION:
            case IDENTIFIER_REFERENCE:
            case LITERAL:
            case INDEX_ACCESS:
                return true;
            default:
                return false;
        }
    }
}
