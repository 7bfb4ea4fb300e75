/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model;

import org.opensearch.securityanalytics.athena.exception.InvalidModifierException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sigma value modifiers understood by the Athena backend.
 */
public enum Modifier {
    CONTAINS("contains", true),
    STARTSWITH("startswith", true),
    ENDSWITH("endswith", true),
    CASED("cased", false),
    FIELDREF("fieldref", true),
    RE("re", true),
    ALL("all", false),
    CIDR("cidr", true),
    LT("lt", true),
    LTE("lte", true),
    GT("gt", true),
    GTE("gte", true),
    EXISTS("exists", true);

    private static final Map<String, Modifier> BY_IDENTIFIER = Arrays.stream(values())
            .collect(Collectors.toMap(Modifier::getIdentifier, Function.identity()));

    private final String identifier;
    private final boolean shapeSelecting;

    Modifier(final String identifier, final boolean shapeSelecting) {
        this.identifier = identifier;
        this.shapeSelecting = shapeSelecting;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return - true if the modifier decides which kind of comparison is generated, false if it only qualifies it
     */
    public boolean isShapeSelecting() {
        return shapeSelecting;
    }

    public static Modifier fromIdentifier(final String identifier) {
        final Modifier modifier = identifier == null ? null : BY_IDENTIFIER.get(identifier.toLowerCase(Locale.ROOT));
        if (modifier == null) {
            throw new InvalidModifierException("Unknown modifier '" + identifier + "'");
        }

        return modifier;
    }

    @Override
    public String toString() {
        return identifier;
    }
}
