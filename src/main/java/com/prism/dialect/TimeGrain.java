package com.prism.dialect;

/**
 * A named time truncation unit with its SQL template.
 * The template has one {@code {col}} substitution site.
 */
public class TimeGrain {

    public static final String COLUMN_PLACEHOLDER = "{col}";

    private final String name;
    private final String label;
    private final String function;

    public TimeGrain(String name, String label, String function) {
        this.name = name;
        this.label = label;
        this.function = function;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public String getFunction() {
        return function;
    }

    /**
     * Apply this grain to a SQL expression
     */
    public String apply(String expression) {
        return function.replace(COLUMN_PLACEHOLDER, expression);
    }

    @Override
    public String toString() {
        return name;
    }
}
