package com.prism.query.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code element [NOT] IN (v1, v2, ...)} over literal values
 */
public class InClause implements SqlClause {

    private final SqlClause element;
    private final List<Object> values;
    private final boolean negated;

    public InClause(SqlClause element, List<Object> values, boolean negated) {
        this.element = element;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.negated = negated;
    }

    public SqlClause getElement() {
        return element;
    }

    public List<Object> getValues() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Logical negation over the same values
     */
    public InClause negate() {
        return new InClause(element, values, !negated);
    }
}
