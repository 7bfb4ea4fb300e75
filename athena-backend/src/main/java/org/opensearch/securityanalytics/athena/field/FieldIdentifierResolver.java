/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.field;

import org.opensearch.securityanalytics.athena.config.AthenaBackendOptions;
import org.opensearch.securityanalytics.athena.model.FieldReference;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns Sigma field references into Athena column expressions.
 * <p>
 * Fields whose first path segment is a configured element_at field, or which are flagged as unmapped, are read
 * from a map column with {@code element_at}. All other fields become (possibly nested) column identifiers.
 */
public class FieldIdentifierResolver {
    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String ELEMENT_AT_FORMAT = "element_at(%s, '%s')";

    private final Map<String, String> fieldMappings;
    private final Set<String> elementAtFields;
    private final String elementAtContainer;

    public FieldIdentifierResolver(final AthenaBackendOptions options) {
        this(options.getFieldMappings(), options.getElementAtFields(), options.getElementAtContainer());
    }

    public FieldIdentifierResolver(final Map<String, String> fieldMappings, final Set<String> elementAtFields,
                                   final String elementAtContainer) {
        this.fieldMappings = fieldMappings == null ? Collections.emptyMap() : fieldMappings;
        this.elementAtFields = elementAtFields == null ? Collections.emptySet() : elementAtFields;
        this.elementAtContainer = elementAtContainer;
    }

    public String resolve(final FieldReference field) {
        final FieldReference mappedField = convertFieldName(field);
        final List<String> segments = mappedField.getPathSegments();

        if (segments.size() > 1 && elementAtFields.contains(segments.get(0))) {
            return elementAt(segments.get(0), segments.subList(1, segments.size()));
        }
        if (mappedField.isUnmapped()) {
            return elementAt(elementAtContainer, segments);
        }

        return segments.stream()
                .map(FieldIdentifierResolver::quoteIdentifier)
                .collect(Collectors.joining("."));
    }

    /**
     * Quotes an identifier with double quotes unless it is a valid bare identifier.
     */
    public static String quoteIdentifier(final String identifier) {
        if (BARE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }

        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private String elementAt(final String container, final List<String> path) {
        final String key = String.join(".", path).replace("'", "''");
        return String.format(ELEMENT_AT_FORMAT, quoteIdentifier(container), key);
    }

    private FieldReference convertFieldName(final FieldReference field) {
        final String mappedFieldName = fieldMappings.get(field.getName());
        if (mappedFieldName == null) {
            return field;
        }

        return field.isUnmapped() ? FieldReference.unmapped(mappedFieldName) : FieldReference.of(mappedFieldName);
    }
}
