package me.christianrobert.ast2c.generator.context;

/**
 * Immutable rendering context threaded through every recursive generator call.
 *
 * <p>Carries the current indentation level, whether the node sits inside a parenthesized
 * parameter list, and the width of one indent unit. Every "with" method returns a new
 * instance, so a child call can never change what its parent sees.</p>
 */
public final class GenerationContext {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final int indentLevel;
    private final boolean inParameterList;
    private final String indentUnit;

    private GenerationContext(int indentLevel, boolean inParameterList, String indentUnit) {
        if (indentLevel < 0) {
            throw new IllegalArgumentException("Indent level must not be negative: " + indentLevel);
        }
        this.indentLevel = indentLevel;
        this.inParameterList = inParameterList;
        this.indentUnit = indentUnit;
    }

    /**
     * Root context: level 0, statement position, four-space indent unit.
     */
    public static GenerationContext root() {
        return withIndentWidth(DEFAULT_INDENT_WIDTH);
    }

    /**
     * Root context with a custom indent unit width.
     */
    public static GenerationContext withIndentWidth(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
        return new GenerationContext(0, false, " ".repeat(indentWidth));
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public boolean isInParameterList() {
        return inParameterList;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    /**
     * Leading whitespace for a statement line at the current level.
     */
    public String indent() {
        return indentUnit.repeat(indentLevel);
    }

    /**
     * Context for the statements of a block: one level deeper, statement position.
     */
    public GenerationContext nested() {
        return new GenerationContext(indentLevel + 1, false, indentUnit);
    }

    /**
     * Same level, rendering inside a parameter list.
     */
    public GenerationContext asParameter() {
        return inParameterList ? this : new GenerationContext(indentLevel, true, indentUnit);
    }

    /**
     * Same level, back in statement position.
     */
    public GenerationContext asStatement() {
        return inParameterList ? new GenerationContext(indentLevel, false, indentUnit) : this;
    }

    @Override
    public String toString() {
        return "GenerationContext{indentLevel=" + indentLevel + ", inParameterList=" + inParameterList + "}";
    }
}
