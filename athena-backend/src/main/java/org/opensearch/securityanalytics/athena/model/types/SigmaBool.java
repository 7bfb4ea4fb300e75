/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

public class SigmaBool implements SigmaType {
    private final boolean aBoolean;

    public SigmaBool(final boolean aBoolean) {
        this.aBoolean = aBoolean;
    }

    public boolean isaBoolean() {
        return aBoolean;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return aBoolean == ((SigmaBool) o).aBoolean;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(aBoolean);
    }

    @Override
    public String toString() {
        return Boolean.toString(aBoolean);
    }
}
