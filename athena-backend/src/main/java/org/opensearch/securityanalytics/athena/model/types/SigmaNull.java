/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

public class SigmaNull implements SigmaType {
    @Override
    public boolean equals(final Object o) {
        return o instanceof SigmaNull;
    }

    @Override
    public int hashCode() {
        return SigmaNull.class.hashCode();
    }

    @Override
    public String toString() {
        return "null";
    }
}
