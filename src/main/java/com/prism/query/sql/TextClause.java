package com.prism.query.sql;

/**
 * Opaque SQL text, emitted as is
 */
public class TextClause implements SqlClause {

    private final String text;

    public TextClause(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
