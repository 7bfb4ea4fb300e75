/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

import org.opensearch.securityanalytics.athena.model.FieldReference;

import java.util.Objects;

/**
 * A value naming another field, compared against under the fieldref modifier.
 */
public class SigmaFieldReference implements SigmaType {
    private final FieldReference field;

    public SigmaFieldReference(final FieldReference field) {
        this.field = Objects.requireNonNull(field, "Referenced field must not be null");
    }

    public SigmaFieldReference(final String fieldName) {
        this(FieldReference.of(fieldName));
    }

    public FieldReference getField() {
        return field;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return field.equals(((SigmaFieldReference) o).field);
    }

    @Override
    public int hashCode() {
        return field.hashCode();
    }

    @Override
    public String toString() {
        return field.toString();
    }
}
