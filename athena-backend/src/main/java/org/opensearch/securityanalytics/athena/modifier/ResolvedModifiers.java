/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.modifier;

import java.util.Objects;

public class ResolvedModifiers {
    private final ComparisonShape shape;
    private final boolean caseSensitive;
    private final boolean matchAll;

    public ResolvedModifiers(final ComparisonShape shape, final boolean caseSensitive, final boolean matchAll) {
        this.shape = Objects.requireNonNull(shape);
        this.caseSensitive = caseSensitive;
        this.matchAll = matchAll;
    }

    public ComparisonShape getShape() {
        return shape;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * @return - true if every value must match, false if any value is enough
     */
    public boolean isMatchAll() {
        return matchAll;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ResolvedModifiers that = (ResolvedModifiers) o;
        return caseSensitive == that.caseSensitive && matchAll == that.matchAll && shape == that.shape;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, caseSensitive, matchAll);
    }

    @Override
    public String toString() {
        return shape + (caseSensitive ? "|cased" : "") + (matchAll ? "|all" : "");
    }
}
