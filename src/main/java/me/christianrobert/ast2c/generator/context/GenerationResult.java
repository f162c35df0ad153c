package me.christianrobert.ast2c.generator.context;

/**
 * Result of a generation operation.
 * Contains either the generated C code or an error message.
 * Optionally includes a formatted dump of the input tree for debugging.
 */
public class GenerationResult {

    private final boolean success;
    private final String code;
    private final String errorMessage;
    private final String sourceJson;
    private final String astTree;  // Optional tree dump (null by default)

    private GenerationResult(boolean success, String code, String errorMessage, String sourceJson, String astTree) {
        this.success = success;
        this.code = code;
        this.errorMessage = errorMessage;
        this.sourceJson = sourceJson;
        this.astTree = astTree;
    }

    public static GenerationResult success(String sourceJson, String code) {
        return new GenerationResult(true, code, null, sourceJson, null);
    }

    public static GenerationResult successWithAst(String sourceJson, String code, String astTree) {
        return new GenerationResult(true, code, null, sourceJson, astTree);
    }

    public static GenerationResult failure(String sourceJson, String errorMessage) {
        return new GenerationResult(false, null, errorMessage, sourceJson, null);
    }

    public static GenerationResult failure(String sourceJson, GenerationException exception) {
        return new GenerationResult(false, null, exception.getDetailedMessage(), sourceJson, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSourceJson() {
        return sourceJson;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "GenerationResult{success=true, code='" + code + "'" +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "GenerationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
