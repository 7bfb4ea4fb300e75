/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.modifier;

/**
 * The kind of SQL comparison generated for a value.
 */
public enum ComparisonShape {
    EQUALITY(Kind.STRING, "", "", "="),
    CONTAINS(Kind.PATTERN, "%", "%", "LIKE"),
    STARTSWITH(Kind.PATTERN, "", "%", "LIKE"),
    ENDSWITH(Kind.PATTERN, "%", "", "LIKE"),
    REGEX(Kind.REGEX, "", "", null),
    FIELD_EQUALITY(Kind.FIELD, "", "", "="),
    CIDR(Kind.NETWORK, "", "", null),
    LESS_THAN(Kind.NUMERIC, "", "", "<"),
    LESS_THAN_OR_EQUAL(Kind.NUMERIC, "", "", "<="),
    GREATER_THAN(Kind.NUMERIC, "", "", ">"),
    GREATER_THAN_OR_EQUAL(Kind.NUMERIC, "", "", ">="),
    EXISTS(Kind.EXISTENCE, "", "", null);

    enum Kind {
        STRING,
        PATTERN,
        REGEX,
        FIELD,
        NETWORK,
        NUMERIC,
        EXISTENCE
    }

    private final Kind kind;
    private final String patternPrefix;
    private final String patternSuffix;
    private final String operator;

    ComparisonShape(final Kind kind, final String patternPrefix, final String patternSuffix, final String operator) {
        this.kind = kind;
        this.patternPrefix = patternPrefix;
        this.patternSuffix = patternSuffix;
        this.operator = operator;
    }

    public boolean isPattern() {
        return kind == Kind.PATTERN;
    }

    public boolean isNumericComparison() {
        return kind == Kind.NUMERIC;
    }

    /**
     * @return - true for the string comparisons that honour the cased modifier
     */
    public boolean isCaseAware() {
        return kind == Kind.STRING || kind == Kind.PATTERN;
    }

    public String getPatternPrefix() {
        return patternPrefix;
    }

    public String getPatternSuffix() {
        return patternSuffix;
    }

    public String getOperator() {
        return operator;
    }
}
