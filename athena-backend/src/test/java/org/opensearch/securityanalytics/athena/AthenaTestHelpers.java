/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena;

import org.opensearch.securityanalytics.athena.model.FieldReference;
import org.opensearch.securityanalytics.athena.model.LeafCondition;
import org.opensearch.securityanalytics.athena.model.Modifier;
import org.opensearch.securityanalytics.athena.model.types.SigmaString;
import org.opensearch.securityanalytics.athena.model.types.SigmaType;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class AthenaTestHelpers {
    /**
     * Builds a condition from the field/modifier notation used in Sigma rules, e.g. {@code fieldA|cased|contains}.
     */
    public static LeafCondition getLeafCondition(final String fieldWithModifiers, final String... values) {
        return getLeafCondition(fieldWithModifiers, false, Arrays.stream(values)
                .map(SigmaString::new)
                .collect(Collectors.toList()));
    }

    public static LeafCondition getNegatedLeafCondition(final String fieldWithModifiers, final String... values) {
        return getLeafCondition(fieldWithModifiers, values).negate();
    }

    public static LeafCondition getLeafCondition(final String fieldWithModifiers, final boolean negated,
                                                 final List<SigmaType> values) {
        final String[] parts = fieldWithModifiers.split("\\|");
        final List<Modifier> modifiers = Arrays.stream(parts)
                .skip(1)
                .map(Modifier::fromIdentifier)
                .collect(Collectors.toList());

        return new LeafCondition(FieldReference.of(parts[0]), modifiers, values, negated);
    }

    public static List<Modifier> getModifiers(final String... identifiers) {
        return Arrays.stream(identifiers)
                .map(Modifier::fromIdentifier)
                .collect(Collectors.toList());
    }
}
