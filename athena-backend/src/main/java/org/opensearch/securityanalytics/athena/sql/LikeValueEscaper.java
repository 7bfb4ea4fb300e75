/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.sql;

import org.opensearch.securityanalytics.athena.model.types.SigmaString;
import org.opensearch.securityanalytics.athena.modifier.ComparisonShape;

/**
 * Builds the body of a SQL string literal from a Sigma value. The result is ready to be placed between single
 * quotes: LIKE metacharacters are escaped with {@link #ESCAPE_CHAR}, quotes are doubled and, for pattern
 * comparisons, Sigma wildcards become their LIKE equivalents.
 */
public class LikeValueEscaper {
    public static final char ESCAPE_CHAR = '\\';

    private static final char LIKE_WILDCARD_MULTI = '%';
    private static final char LIKE_WILDCARD_SINGLE = '_';
    private static final char QUOTE = '\'';

    /**
     * Escapes a Sigma value for the given comparison. Equality literals are escaped the same way as patterns even
     * though they are compared with {@code =}, which does not honour the escape character, so an equality value
     * containing {@code %}, {@code _} or a backslash only matches column text carrying the same escapes.
     */
    public String escape(final SigmaString value, final ComparisonShape shape, final boolean caseSensitive) {
        final StringBuilder body = new StringBuilder();
        for (final SigmaString.Part part : value.getParts()) {
            if (!part.isSpecial()) {
                body.append(escapeLikeMetacharacters(part.getText()));
            } else if (part.getSpecialChar() == SigmaString.SpecialChar.WILDCARD_MULTI) {
                body.append(shape.isPattern() ? LIKE_WILDCARD_MULTI : SigmaString.WILDCARD_MULTI);
            } else {
                body.append(shape.isPattern() ? LIKE_WILDCARD_SINGLE : SigmaString.WILDCARD_SINGLE);
            }
        }

        return bracket(body.toString(), shape, caseSensitive);
    }

    /**
     * Escapes text that carries no wildcards, such as the string form of a number.
     */
    public String escape(final String literal, final ComparisonShape shape, final boolean caseSensitive) {
        return bracket(escapeLikeMetacharacters(literal), shape, caseSensitive);
    }

    /**
     * Doubles single quotes so the text can be embedded in a SQL string literal.
     */
    public static String escapeQuotes(final String text) {
        return text.replace("'", "''");
    }

    private String bracket(final String body, final ComparisonShape shape, final boolean caseSensitive) {
        final String caseAdjusted = caseSensitive ? body : toLowerCase(body);
        return shape.getPatternPrefix() + caseAdjusted + shape.getPatternSuffix();
    }

    // Per code point, as LOWER() does, so no character expands to several
    private static String toLowerCase(final String text) {
        final StringBuilder lowered = new StringBuilder(text.length());
        text.codePoints().map(Character::toLowerCase).forEach(lowered::appendCodePoint);

        return lowered.toString();
    }

    private static String escapeLikeMetacharacters(final String text) {
        final StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == ESCAPE_CHAR || c == LIKE_WILDCARD_MULTI || c == LIKE_WILDCARD_SINGLE) {
                escaped.append(ESCAPE_CHAR).append(c);
            } else if (c == QUOTE) {
                escaped.append(QUOTE).append(QUOTE);
            } else {
                escaped.append(c);
            }
        }

        return escaped.toString();
    }
}
