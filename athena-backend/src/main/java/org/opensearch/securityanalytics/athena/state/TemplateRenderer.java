/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.state;

import org.opensearch.securityanalytics.athena.exception.MissingTemplateKeyException;
import org.opensearch.securityanalytics.athena.exception.RuleConversionException;

import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders in a template. Doubled braces produce a literal brace.
 */
public final class TemplateRenderer {
    private static final char OPEN = '{';
    private static final char CLOSE = '}';

    private TemplateRenderer() {
    }

    public static String render(final String template, final Map<String, String> values) {
        final StringBuilder result = new StringBuilder(template.length());

        int i = 0;
        while (i < template.length()) {
            final char c = template.charAt(i);
            final boolean doubled = i + 1 < template.length() && template.charAt(i + 1) == c;

            if (doubled && (c == OPEN || c == CLOSE)) {
                result.append(c);
                i += 2;
            } else if (c == OPEN) {
                final int end = template.indexOf(CLOSE, i + 1);
                if (end < 0) {
                    throw new RuleConversionException("Single '{' encountered in template: " + template);
                }

                final String key = template.substring(i + 1, end);
                if (key.isEmpty()) {
                    throw new RuleConversionException("Empty placeholder in template: " + template);
                }

                final String value = values.get(key);
                if (value == null) {
                    throw new MissingTemplateKeyException(key, "Missing key '" + key + "'");
                }

                result.append(value);
                i = end + 1;
            } else if (c == CLOSE) {
                throw new RuleConversionException("Single '}' encountered in template: " + template);
            } else {
                result.append(c);
                i++;
            }
        }

        return result.toString();
    }
}
