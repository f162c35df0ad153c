package me.christianrobert.ast2c.analysis.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All functions found in a translation unit, in source order.
 */
public class AnalysisReport {

    private static final String PARAMETER_INDENT = "    ";

    private final List<FunctionSummary> functions;

    public AnalysisReport(List<FunctionSummary> functions) {
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public List<FunctionSummary> getFunctions() {
        return functions;
    }

    public int getTotalFunctions() {
        return functions.size();
    }

    /**
     * Renders the report as plain text, one paragraph per function followed by the total.
     *
     * <pre>
     * Function: add
     * Return Type: int
     * Parameters:
     *     int a
     *     int b
     * if-condition count: 0
     *
     * Total number of functions: 1
     * </pre>
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (FunctionSummary function : functions) {
            sb.append("Function: ").append(function.getName()).append("\n");
            sb.append("Return Type: ").append(function.getReturnType()).append("\n");
            sb.append("Parameters:\n");
            if (!function.hasParameterList()) {
                sb.append("None\n");
            } else {
                for (ParameterSummary parameter : function.getParameters()) {
                    sb.append(PARAMETER_INDENT).append(parameter.getType())
                            .append(" ").append(parameter.getName()).append("\n");
                }
            }
            if (function.isDefinition()) {
                sb.append("if-condition count: ").append(function.getIfCount()).append("\n");
            }
            sb.append("\n");
        }
        sb.append("Total number of functions: ").append(functions.size()).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "AnalysisReport{functions=" + functions.size() + "}";
    }
}
