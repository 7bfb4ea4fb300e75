/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.sql;

import org.opensearch.securityanalytics.athena.exception.RuleConversionException;
import org.opensearch.securityanalytics.athena.modifier.ComparisonShape;

import java.util.List;

/**
 * Renders Athena SQL boolean expressions from already resolved identifiers and escaped values.
 */
public class SqlPredicateAssembler {
    private static final String LOWER_FORMAT = "LOWER(%s)";
    private static final String LIKE_FORMAT = "%s LIKE '%s' ESCAPE '\\'";
    private static final String EQUALS_FORMAT = "%s = %s";
    private static final String REGEX_FORMAT = "REGEXP_LIKE(%s, '%s')";
    private static final String CIDR_FORMAT = "contains('%s', CAST(%s AS IPADDRESS))";
    private static final String IS_NULL_FORMAT = "%s IS NULL";
    private static final String IS_NOT_NULL_FORMAT = "%s IS NOT NULL";

    private static final String OR_SEPARATOR = " OR ";
    private static final String AND_SEPARATOR = " AND ";
    private static final String NOT_PREFIX = "NOT ";

    /**
     * @param identifier - the resolved column expression
     * @param escapedValue - the value body from {@link LikeValueEscaper}, already bracketed for pattern shapes
     */
    public String stringComparison(final String identifier, final String escapedValue, final ComparisonShape shape,
                                   final boolean caseSensitive) {
        final String quotedValue = "'" + escapedValue + "'";

        if (shape.isPattern()) {
            return String.format(LIKE_FORMAT, caseSensitive ? identifier : lower(identifier), escapedValue);
        }
        if (shape == ComparisonShape.EQUALITY) {
            return caseSensitive
                    ? String.format(EQUALS_FORMAT, identifier, quotedValue)
                    : String.format(EQUALS_FORMAT, lower(identifier), lower(quotedValue));
        }

        throw new RuleConversionException("Comparison " + shape + " is not a string comparison");
    }

    public String fieldEquality(final String identifier, final String otherIdentifier) {
        return String.format(EQUALS_FORMAT, lower(identifier), lower(otherIdentifier));
    }

    public String regularExpression(final String identifier, final String regex) {
        return String.format(REGEX_FORMAT, identifier, LikeValueEscaper.escapeQuotes(regex));
    }

    public String numericComparison(final String identifier, final ComparisonShape shape, final String number) {
        if (!shape.isNumericComparison() && shape != ComparisonShape.EQUALITY) {
            throw new RuleConversionException("Comparison " + shape + " cannot be applied to a number");
        }

        return identifier + " " + shape.getOperator() + " " + number;
    }

    public String booleanEquality(final String identifier, final boolean value) {
        return String.format(EQUALS_FORMAT, identifier, value);
    }

    public String cidrContains(final String identifier, final String network) {
        return String.format(CIDR_FORMAT, LikeValueEscaper.escapeQuotes(network), identifier);
    }

    public String isNull(final String identifier) {
        return String.format(IS_NULL_FORMAT, identifier);
    }

    public String isNotNull(final String identifier) {
        return String.format(IS_NOT_NULL_FORMAT, identifier);
    }

    /**
     * Joins the per-value predicates of one leaf condition and applies negation once around the whole group.
     */
    public String combine(final List<String> predicates, final boolean matchAll, final boolean negated) {
        if (predicates.isEmpty()) {
            throw new RuleConversionException("No predicates to combine");
        }

        final String joined = String.join(matchAll ? AND_SEPARATOR : OR_SEPARATOR, predicates);
        if (!negated) {
            return joined;
        }

        return predicates.size() == 1 ? NOT_PREFIX + joined : NOT_PREFIX + "(" + joined + ")";
    }

    private static String lower(final String expression) {
        return String.format(LOWER_FORMAT, expression);
    }
}
