package com.prism.template;

/**
 * Expands embedded expressions in user supplied SQL fragments
 */
public interface TemplateProcessor {

    /**
     * Returns the text with every expression it can resolve substituted from the context
     */
    String process(String text, TemplateContext context);
}
