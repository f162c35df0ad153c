package me.christianrobert.ast2c.tree.parser;

import me.christianrobert.ast2c.tree.AstValue;

import java.util.List;

/**
 * Result of reading a persisted syntax tree.
 * Holds either the tree root or the reasons it could not be read, never both.
 */
public class ParseResult {

    private final AstValue tree;
    private final List<String> errors;
    private final String originalSource;

    private ParseResult(AstValue tree, List<String> errors, String originalSource) {
        this.tree = tree;
        this.errors = List.copyOf(errors);
        this.originalSource = originalSource;
    }

    public static ParseResult success(AstValue tree, String originalSource) {
        return new ParseResult(tree, List.of(), originalSource);
    }

    public static ParseResult failure(String error, String originalSource) {
        return new ParseResult(null, List.of(error), originalSource);
    }

    /**
     * Gets the tree root (null if reading failed).
     */
    public AstValue getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Gets the text that was read; null when a file could not be loaded at all.
     */
    public String getOriginalSource() {
        return originalSource;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !isSuccess();
    }

    /**
     * All errors on one line each, or null when reading succeeded.
     */
    public String getErrorMessage() {
        return errors.isEmpty() ? null : String.join("\n", errors);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult{tree=" + tree.getKind() + "}"
                : "ParseResult{errors=" + errors + "}";
    }
}
