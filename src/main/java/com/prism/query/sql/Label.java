package com.prism.query.sql;

/**
 * An expression with an alias. Renders as {@code expr AS name} in a select
 * list, as the alias in an ORDER BY of the same select, and as the bare
 * expression everywhere else.
 */
public class Label implements SqlClause {

    private final SqlClause element;
    private final String name;

    public Label(SqlClause element, String name) {
        this.element = element;
        this.name = name;
    }

    public SqlClause getElement() {
        return element;
    }

    public String getName() {
        return name;
    }

    /**
     * Same expression under a different alias
     */
    public Label relabel(String newName) {
        return new Label(element, newName);
    }

    @Override
    public String toString() {
        return element + " AS " + name;
    }
}
