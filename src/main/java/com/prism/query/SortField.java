package com.prism.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents an explicit sort column with direction
 */
public class SortField {
    private final String column;
    private final boolean ascending;

    @JsonCreator
    public SortField(@JsonProperty("column") String column,
                     @JsonProperty("ascending") boolean ascending) {
        this.column = column;
        this.ascending = ascending;
    }

    @JsonProperty("column")
    public String getColumn() {
        return column;
    }

    @JsonProperty("ascending")
    public boolean isAscending() {
        return ascending;
    }
}
