package me.christianrobert.ast2c.analysis.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Facts extracted for one function declaration or definition.
 */
public class FunctionSummary {

    private final String name;
    private final String returnType;
    private final List<ParameterSummary> parameters;  // null when the declarator has no parameter list
    private final boolean definition;
    private final int ifCount;

    private FunctionSummary(String name, String returnType, List<ParameterSummary> parameters,
                            boolean definition, int ifCount) {
        this.name = name;
        this.returnType = returnType;
        this.parameters = parameters != null ? Collections.unmodifiableList(new ArrayList<>(parameters)) : null;
        this.definition = definition;
        this.ifCount = ifCount;
    }

    public static FunctionSummary declaration(String name, String returnType, List<ParameterSummary> parameters) {
        return new FunctionSummary(name, returnType, parameters, false, 0);
    }

    public static FunctionSummary definition(String name, String returnType, List<ParameterSummary> parameters,
                                             int ifCount) {
        return new FunctionSummary(name, returnType, parameters, true, ifCount);
    }

    public String getName() {
        return name;
    }

    public String getReturnType() {
        return returnType;
    }

    /**
     * Gets the parameters, or null when the function has no parameter list at all.
     */
    public List<ParameterSummary> getParameters() {
        return parameters;
    }

    public boolean hasParameterList() {
        return parameters != null;
    }

    public boolean isDefinition() {
        return definition;
    }

    /**
     * Number of IF statements in the body. Always 0 for declarations.
     */
    public int getIfCount() {
        return ifCount;
    }

    @Override
    public String toString() {
        return "FunctionSummary{name=" + name + ", definition=" + definition + "}";
    }
}
