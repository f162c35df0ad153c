package me.christianrobert.ast2c.generator.context;

/**
 * Exception thrown at the boundary of code generation (unreadable or unusable input trees).
 * Carries a short description of where the failure happened.
 *
 * <p>The generator itself never throws this: unknown tags and absent fields are rendered
 * best-effort.</p>
 */
public class GenerationException extends RuntimeException {

    private final String context;

    public GenerationException(String message, String context) {
        super(message);
        this.context = context;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets the message followed by the context line, if any. The input itself is left out
     * because tree dumps are large.
     */
    public String getDetailedMessage() {
        if (context == null) {
            return getMessage();
        }
        return getMessage() + "\nContext: " + context;
    }
}
