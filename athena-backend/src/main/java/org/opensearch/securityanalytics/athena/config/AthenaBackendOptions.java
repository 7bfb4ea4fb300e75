/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Backend configuration consumed by field resolution. Built either programmatically or from the
 * backend options map that is also used for run-scoped state templating.
 */
public class AthenaBackendOptions {
    public static final String ELEMENT_AT_FIELDS_OPTION = "element_at_fields";
    public static final String ELEMENT_AT_CONTAINER_OPTION = "element_at_container";
    public static final String FIELD_MAPPING_OPTION_PREFIX = "field_mapping.";

    public static final String DEFAULT_ELEMENT_AT_FIELD = "unmapped";

    private final Map<String, String> fieldMappings;
    private final Set<String> elementAtFields;
    private final String elementAtContainer;

    private AthenaBackendOptions(final Builder builder) {
        this.fieldMappings = Collections.unmodifiableMap(new HashMap<>(builder.fieldMappings));
        this.elementAtFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.elementAtFields));
        this.elementAtContainer = builder.elementAtContainer;
    }

    public static AthenaBackendOptions defaults() {
        return builder().build();
    }

    /**
     * Reads the options from backend options. Unknown keys are ignored since the same map carries the
     * template variables for run-scoped state.
     */
    public static AthenaBackendOptions fromBackendOptions(final Map<String, String> backendOptions) {
        final Builder builder = builder();
        if (backendOptions == null) {
            return builder.build();
        }

        final String elementAtFields = backendOptions.get(ELEMENT_AT_FIELDS_OPTION);
        if (elementAtFields != null) {
            builder.elementAtFields(splitList(elementAtFields));
        }

        final String elementAtContainer = backendOptions.get(ELEMENT_AT_CONTAINER_OPTION);
        if (StringUtils.isNotBlank(elementAtContainer)) {
            builder.elementAtContainer(elementAtContainer.trim());
        }

        backendOptions.forEach((key, value) -> {
            if (key.startsWith(FIELD_MAPPING_OPTION_PREFIX) && StringUtils.isNotBlank(value)) {
                builder.fieldMapping(key.substring(FIELD_MAPPING_OPTION_PREFIX.length()), value.trim());
            }
        });

        return builder.build();
    }

    public Map<String, String> getFieldMappings() {
        return fieldMappings;
    }

    public Set<String> getElementAtFields() {
        return elementAtFields;
    }

    public String getElementAtContainer() {
        return elementAtContainer;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<String> splitList(final String value) {
        final Set<String> items = new LinkedHashSet<>();
        for (final String item : StringUtils.split(value, ',')) {
            if (StringUtils.isNotBlank(item)) {
                items.add(item.trim());
            }
        }

        return items;
    }

    public static class Builder {
        private final Map<String, String> fieldMappings = new HashMap<>();
        private final Set<String> elementAtFields = new LinkedHashSet<>(Set.of(DEFAULT_ELEMENT_AT_FIELD));
        private String elementAtContainer = DEFAULT_ELEMENT_AT_FIELD;

        private Builder() {
        }

        public Builder fieldMapping(final String sigmaField, final String column) {
            fieldMappings.put(sigmaField, column);
            return this;
        }

        public Builder fieldMappings(final Map<String, String> mappings) {
            if (mappings != null) {
                fieldMappings.putAll(mappings);
            }
            return this;
        }

        public Builder elementAtFields(final Set<String> fields) {
            elementAtFields.clear();
            if (fields != null) {
                elementAtFields.addAll(fields);
            }
            return this;
        }

        public Builder elementAtContainer(final String container) {
            this.elementAtContainer = container;
            return this;
        }

        public AthenaBackendOptions build() {
            if (StringUtils.isBlank(elementAtContainer)) {
                throw new IllegalArgumentException("element_at container name must not be blank");
            }
            return new AthenaBackendOptions(this);
        }
    }
}
