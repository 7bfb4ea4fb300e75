/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model;

import org.opensearch.securityanalytics.athena.model.types.SigmaType;

import java.util.List;
import java.util.Objects;

/**
 * A single field/value match clause of a Sigma detection, before boolean combination with other clauses.
 * All values share the modifier stack and are implicitly OR-combined unless {@link Modifier#ALL} is present.
 */
public class LeafCondition {
    private final FieldReference field;
    private final List<Modifier> modifiers;
    private final List<SigmaType> values;
    private final boolean negated;

    public LeafCondition(final FieldReference field, final List<Modifier> modifiers, final List<SigmaType> values,
                         final boolean negated) {
        this.field = Objects.requireNonNull(field, "Leaf condition requires a field");
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.values = List.copyOf(Objects.requireNonNull(values, "Leaf condition requires values"));
        this.negated = negated;

        if (this.values.isEmpty()) {
            throw new IllegalArgumentException("Leaf condition for field " + field + " has no values");
        }
    }

    public LeafCondition(final FieldReference field, final List<Modifier> modifiers, final SigmaType value) {
        this(field, modifiers, List.of(value), false);
    }

    public FieldReference getField() {
        return field;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public List<SigmaType> getValues() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    public LeafCondition negate() {
        return new LeafCondition(field, modifiers, values, !negated);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final LeafCondition that = (LeafCondition) o;
        return negated == that.negated && field.equals(that.field) && modifiers.equals(that.modifiers)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, modifiers, values, negated);
    }

    @Override
    public String toString() {
        return (negated ? "not " : "") + field + modifiers + values;
    }
}
