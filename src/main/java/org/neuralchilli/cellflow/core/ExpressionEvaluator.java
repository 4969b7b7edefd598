package org.neuralchilli.cellflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Evaluates {@code ${...}} placeholders in stage command templates with JEXL.
 * Strings without a placeholder are returned as-is.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;

    public ExpressionEvaluator() {
        this.jexl = new JexlBuilder()
                .cache(256)
                .strict(true)  // Unknown variables are errors, not empty strings
                .silent(false)
                .permissions(JexlPermissions.RESTRICTED)
                .create();
    }

    /**
     * Interpolate every placeholder in {@code template}.
     *
     * @throws ExpressionException if a placeholder is malformed or fails
     */
    public String evaluate(String template, Map<String, Object> variables) {
        if (template == null) {
            return null;
        }

        if (!isExpression(template)) {
            return template;
        }

        try {
            return interpolateString(template, createJexlContext(variables));
        } catch (ExpressionException e) {
            throw e;
        } catch (Exception e) {
            String msg = String.format(
                    "Failed to evaluate expression: %s - %s",
                    template,
                    e.getMessage()
            );
            log.error(msg, e);
            throw new ExpressionException(msg, e);
        }
    }

    public List<String> evaluateAll(List<String> templates, Map<String, Object> variables) {
        return templates.stream()
                .map(template -> evaluate(template, variables))
                .collect(Collectors.toList());
    }

    /**
     * Check if a string contains an expression
     */
    public boolean isExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    private String interpolateString(String template, JexlContext context) {
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template.substring(pos));
                break;
            }

            // Append text before expression
            result.append(template, pos, start);

            // Find matching closing brace
            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException("Unclosed expression in: " + template);
            }

            JexlExpression compiled = jexl.createExpression(template.substring(start + 2, end));
            Object evaluated = compiled.evaluate(context);
            result.append(evaluated != null ? evaluated.toString() : "");

            pos = end + 1;
        }

        return result.toString();
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JexlContext createJexlContext(Map<String, Object> variables) {
        MapContext jexlContext = new MapContext();
        variables.forEach(jexlContext::set);
        return jexlContext;
    }
}
