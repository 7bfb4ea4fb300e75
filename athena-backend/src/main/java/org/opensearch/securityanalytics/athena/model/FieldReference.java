/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A Sigma field name as supplied by the rule parser. Dots separate path segments unless escaped
 * with a backslash, in which case the dot belongs to the segment. A doubled backslash is one literal
 * backslash and escapes nothing.
 */
public class FieldReference {
    private static final char PATH_SEPARATOR = '.';
    private static final char ESCAPE_CHAR = '\\';

    private final String name;
    private final boolean unmapped;

    private FieldReference(final String name, final boolean unmapped) {
        this.name = Objects.requireNonNull(name, "Field name must not be null");
        this.unmapped = unmapped;
    }

    public static FieldReference of(final String name) {
        return new FieldReference(name, false);
    }

    /**
     * A field without a dedicated column that must be read from the generic key-value container.
     */
    public static FieldReference unmapped(final String name) {
        return new FieldReference(name, true);
    }

    public String getName() {
        return name;
    }

    public boolean isUnmapped() {
        return unmapped;
    }

    /**
     * @return - the path segments of the name with escaped dots resolved to literal dots
     */
    public List<String> getPathSegments() {
        final List<String> segments = new ArrayList<>();
        final StringBuilder segment = new StringBuilder();

        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            final char next = i + 1 < name.length() ? name.charAt(i + 1) : 0;
            if (c == ESCAPE_CHAR && (next == PATH_SEPARATOR || next == ESCAPE_CHAR)) {
                segment.append(next);
                i++;
            } else if (c == PATH_SEPARATOR) {
                segments.add(segment.toString());
                segment.setLength(0);
            } else {
                segment.append(c);
            }
        }
        segments.add(segment.toString());

        return Collections.unmodifiableList(segments);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final FieldReference that = (FieldReference) o;
        return unmapped == that.unmapped && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unmapped);
    }

    @Override
    public String toString() {
        return unmapped ? "unmapped:" + name : name;
    }
}
