package com.prism.query.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conjunction of clauses. Nested conjunctions are flattened when rendered.
 */
public class BooleanClauseList implements SqlClause {

    private final List<SqlClause> clauses;

    public BooleanClauseList(List<? extends SqlClause> clauses) {
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
    }

    public static BooleanClauseList and(SqlClause... clauses) {
        return new BooleanClauseList(List.of(clauses));
    }

    public List<SqlClause> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Leaf clauses with nested conjunctions expanded in order
     */
    public List<SqlClause> flatten() {
        List<SqlClause> result = new ArrayList<>();
        for (SqlClause clause : clauses) {
            if (clause instanceof BooleanClauseList) {
                result.addAll(((BooleanClauseList) clause).flatten());
            } else {
                result.add(clause);
            }
        }
        return result;
    }
}
