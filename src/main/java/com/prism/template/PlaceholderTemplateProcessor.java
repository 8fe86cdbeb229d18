package com.prism.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.util.Map;

/**
 * Substitutes {@code {{ name }}} placeholders from the template context.
 * Placeholders with no value are left as written.
 */
@Component
public class PlaceholderTemplateProcessor implements TemplateProcessor {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderTemplateProcessor.class);

    private final PropertyPlaceholderHelper helper = new PropertyPlaceholderHelper("{{", "}}", null, true);

    @Override
    public String process(String text, TemplateContext context) {
        if (text == null || !text.contains("{{")) {
            return text;
        }
        Map<String, String> variables = context.asVariables();
        String result = helper.replacePlaceholders(text, name -> variables.get(name.trim()));
        logger.debug("Expanded template fragment: {}", result);
        return result;
    }
}
