package com.prism.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A structured filter: column, operator and list of values.
 * Only the {@code in} and {@code not in} operators are compiled.
 */
public class QueryFilter {

    public static final String IN = "in";
    public static final String NOT_IN = "not in";

    @JsonProperty("col")
    private String col;

    @JsonProperty("op")
    private String op;

    @JsonProperty("val")
    private List<String> val = new ArrayList<>();

    public QueryFilter() {
    }

    public QueryFilter(String col, String op, List<String> val) {
        this.col = col;
        this.op = op;
        this.val = val;
    }

    public String getCol() {
        return col;
    }

    public void setCol(String col) {
        this.col = col;
    }

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public List<String> getVal() {
        return val;
    }

    public void setVal(List<String> val) {
        this.val = val;
    }

    /**
     * A filter missing its column, operator or values is not applied
     */
    @JsonIgnore
    public boolean isComplete() {
        return col != null && !col.isEmpty()
                && op != null && !op.isEmpty()
                && val != null && !val.isEmpty();
    }

    @Override
    public String toString() {
        return col + " " + op + " " + val;
    }
}
