package com.prism.query.sql;

/**
 * Per-call rendering switches for {@link SqlCompiler}
 */
public class RenderOptions {

    private final boolean pretty;
    private final boolean literalBinds;
    private final boolean unescapeDateTimePercent;
    private final boolean formatStyleParams;

    public RenderOptions(boolean pretty, boolean literalBinds, boolean unescapeDateTimePercent) {
        this(pretty, literalBinds, unescapeDateTimePercent, false);
    }

    public RenderOptions(boolean pretty, boolean literalBinds, boolean unescapeDateTimePercent,
                         boolean formatStyleParams) {
        this.pretty = pretty;
        this.literalBinds = literalBinds;
        this.unescapeDateTimePercent = unescapeDateTimePercent;
        this.formatStyleParams = formatStyleParams;
    }

    public static RenderOptions compact() {
        return new RenderOptions(false, true, false);
    }

    public static RenderOptions pretty() {
        return new RenderOptions(true, true, false);
    }

    public RenderOptions withPretty(boolean value) {
        return new RenderOptions(value, literalBinds, unescapeDateTimePercent, formatStyleParams);
    }

    /**
     * Target a consumer that reads {@code %} as a parameter marker. Literal
     * text then has its percent signs doubled on engines whose drivers use
     * format-style markers. JDBC statements must not use this mode.
     */
    public RenderOptions withFormatStyleParams(boolean value) {
        return new RenderOptions(pretty, literalBinds, unescapeDateTimePercent, value);
    }

    /**
     * Undo percent doubling on literal date-time columns. Grain templates
     * such as {@code DATE_FORMAT({col}, '%Y-%m-01')} must reach the engine
     * with single percent signs.
     */
    public RenderOptions withUnescapeDateTimePercent(boolean value) {
        return new RenderOptions(pretty, literalBinds, value, formatStyleParams);
    }

    public boolean isPretty() {
        return pretty;
    }

    /**
     * Values are inlined as SQL literals instead of bind markers
     */
    public boolean isLiteralBinds() {
        return literalBinds;
    }

    public boolean isUnescapeDateTimePercent() {
        return unescapeDateTimePercent;
    }

    public boolean isFormatStyleParams() {
        return formatStyleParams;
    }
}
