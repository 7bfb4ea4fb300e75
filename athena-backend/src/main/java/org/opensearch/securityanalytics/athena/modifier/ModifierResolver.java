/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.modifier;

import org.opensearch.securityanalytics.athena.exception.InvalidModifierException;
import org.opensearch.securityanalytics.athena.model.Modifier;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reduces a modifier stack to a single comparison shape and case policy.
 */
public class ModifierResolver {
    static final String REGEX_NOT_APPLICABLE_MESSAGE = "Regular expression modifier only applicable to unmodified values";
    static final String CASED_FIELDREF_NOT_SUPPORTED_MESSAGE = "cased is not support with fieldref for this backend at present";
    private static final String INCOMPATIBLE_MODIFIERS_FORMAT = "Modifiers '%s' and '%s' cannot be combined";

    public ResolvedModifiers resolve(final List<Modifier> modifiers) {
        final Set<Modifier> modifierSet = modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers);

        if (modifierSet.contains(Modifier.RE)) {
            if (modifierSet.size() > 1) {
                throw new InvalidModifierException(REGEX_NOT_APPLICABLE_MESSAGE);
            }
            return new ResolvedModifiers(ComparisonShape.REGEX, false, false);
        }

        final boolean cased = modifierSet.contains(Modifier.CASED);
        if (cased && modifierSet.contains(Modifier.FIELDREF)) {
            throw new UnsupportedOperationException(CASED_FIELDREF_NOT_SUPPORTED_MESSAGE);
        }

        // Keeps the order the modifiers were written in so errors name them as the rule author did
        final List<Modifier> shapeModifiers = modifiers.stream()
                .filter(Modifier::isShapeSelecting)
                .distinct()
                .collect(Collectors.toList());
        if (shapeModifiers.size() > 1) {
            throw incompatible(shapeModifiers.get(0), shapeModifiers.get(1));
        }

        final ComparisonShape shape = shapeModifiers.isEmpty() ? ComparisonShape.EQUALITY : toShape(shapeModifiers.get(0));
        if (cased && !shape.isCaseAware()) {
            throw incompatible(Modifier.CASED, shapeModifiers.get(0));
        }

        return new ResolvedModifiers(shape, cased, modifierSet.contains(Modifier.ALL));
    }

    private ComparisonShape toShape(final Modifier modifier) {
        return switch (modifier) {
            case CONTAINS -> ComparisonShape.CONTAINS;
            case STARTSWITH -> ComparisonShape.STARTSWITH;
            case ENDSWITH -> ComparisonShape.ENDSWITH;
            case FIELDREF -> ComparisonShape.FIELD_EQUALITY;
            case RE -> ComparisonShape.REGEX;
            case CIDR -> ComparisonShape.CIDR;
            case LT -> ComparisonShape.LESS_THAN;
            case LTE -> ComparisonShape.LESS_THAN_OR_EQUAL;
            case GT -> ComparisonShape.GREATER_THAN;
            case GTE -> ComparisonShape.GREATER_THAN_OR_EQUAL;
            case EXISTS -> ComparisonShape.EXISTS;
            case CASED, ALL -> throw new IllegalStateException("Modifier " + modifier + " does not select a comparison");
        };
    }

    private InvalidModifierException incompatible(final Modifier first, final Modifier second) {
        return new InvalidModifierException(String.format(INCOMPATIBLE_MODIFIERS_FORMAT, first, second));
    }
}
