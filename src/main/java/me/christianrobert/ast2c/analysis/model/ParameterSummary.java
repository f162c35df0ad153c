package me.christianrobert.ast2c.analysis.model;

/**
 * Type and name of one function parameter.
 */
public class ParameterSummary {

    private final String type;
    private final String name;

    public ParameterSummary(String type, String name) {
        this.type = type;
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return type + " " + name;
    }
}
