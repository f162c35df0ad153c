package me.christianrobert.ast2c.analysis.model;

/**
 * Result of a function analysis: the report and its text, or an error message.
 */
public class AnalysisResult {

    private final boolean success;
    private final AnalysisReport report;
    private final String errorMessage;

    private AnalysisResult(boolean success, AnalysisReport report, String errorMessage) {
        this.success = success;
        this.report = report;
        this.errorMessage = errorMessage;
    }

    public static AnalysisResult success(AnalysisReport report) {
        return new AnalysisResult(true, report, null);
    }

    public static AnalysisResult failure(String errorMessage) {
        return new AnalysisResult(false, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public AnalysisReport getReport() {
        return report;
    }

    /**
     * Gets the formatted report text (null on failure).
     */
    public String getText() {
        return report != null ? report.format() : null;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return success
                ? "AnalysisResult{success=true, functions=" + report.getTotalFunctions() + "}"
                : "AnalysisResult{success=false, error='" + errorMessage + "'}";
    }
}
