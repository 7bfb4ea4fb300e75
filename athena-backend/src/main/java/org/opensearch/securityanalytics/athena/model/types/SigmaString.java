/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A Sigma string value split into literal text and wildcards.
 * <p>
 * {@code *} and {@code ?} are wildcards unless escaped with a backslash. {@code \*}, {@code \?} and {@code \\}
 * produce the literal character; a backslash before any other character is kept as a literal backslash.
 */
public class SigmaString implements SigmaType {
    public static final char WILDCARD_MULTI = '*';
    public static final char WILDCARD_SINGLE = '?';
    public static final char ESCAPE_CHAR = '\\';

    public enum SpecialChar {
        WILDCARD_MULTI,
        WILDCARD_SINGLE
    }

    public static final class Part {
        private final String text;
        private final SpecialChar specialChar;

        private Part(final String text, final SpecialChar specialChar) {
            this.text = text;
            this.specialChar = specialChar;
        }

        static Part literal(final String text) {
            return new Part(text, null);
        }

        static Part special(final SpecialChar specialChar) {
            return new Part(null, specialChar);
        }

        public boolean isSpecial() {
            return specialChar != null;
        }

        public String getText() {
            return text;
        }

        public SpecialChar getSpecialChar() {
            return specialChar;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final Part part = (Part) o;
            return Objects.equals(text, part.text) && specialChar == part.specialChar;
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, specialChar);
        }
    }

    private final String original;
    private final List<Part> parts;

    public SigmaString(final String original) {
        this.original = Objects.requireNonNull(original, "Sigma string must not be null");
        this.parts = parse(original);
    }

    public String getOriginal() {
        return original;
    }

    public List<Part> getParts() {
        return parts;
    }

    public boolean containsWildcards() {
        return parts.stream().anyMatch(Part::isSpecial);
    }

    /**
     * @return - the value with escapes resolved and wildcards rendered as their plain characters
     */
    public String toPlainString() {
        final StringBuilder builder = new StringBuilder();
        for (final Part part : parts) {
            if (!part.isSpecial()) {
                builder.append(part.getText());
            } else if (part.getSpecialChar() == SpecialChar.WILDCARD_MULTI) {
                builder.append(WILDCARD_MULTI);
            } else {
                builder.append(WILDCARD_SINGLE);
            }
        }

        return builder.toString();
    }

    private static List<Part> parse(final String value) {
        final List<Part> parts = new ArrayList<>();
        final StringBuilder literal = new StringBuilder();

        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == ESCAPE_CHAR && i + 1 < value.length() && isEscapable(value.charAt(i + 1))) {
                literal.append(value.charAt(++i));
            } else if (c == WILDCARD_MULTI || c == WILDCARD_SINGLE) {
                if (literal.length() > 0) {
                    parts.add(Part.literal(literal.toString()));
                    literal.setLength(0);
                }
                parts.add(Part.special(c == WILDCARD_MULTI ? SpecialChar.WILDCARD_MULTI : SpecialChar.WILDCARD_SINGLE));
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            parts.add(Part.literal(literal.toString()));
        }

        return Collections.unmodifiableList(parts);
    }

    private static boolean isEscapable(final char c) {
        return c == WILDCARD_MULTI || c == WILDCARD_SINGLE || c == ESCAPE_CHAR;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return original.equals(((SigmaString) o).original);
    }

    @Override
    public int hashCode() {
        return original.hashCode();
    }

    @Override
    public String toString() {
        return original;
    }
}
