/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.converter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.securityanalytics.athena.config.AthenaBackendOptions;
import org.opensearch.securityanalytics.athena.field.FieldIdentifierResolver;
import org.opensearch.securityanalytics.athena.model.LeafCondition;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for converting Sigma leaf conditions to Athena SQL predicates. Instances are immutable and can be
 * shared between threads.
 */
public class AthenaBackend {
    private static final Logger log = LogManager.getLogger(AthenaBackend.class);

    private final AthenaLeafConditionConverter leafConditionConverter;

    public AthenaBackend(final Map<String, String> backendOptions) {
        this(AthenaBackendOptions.fromBackendOptions(backendOptions));
    }

    public AthenaBackend(final AthenaBackendOptions options) {
        this.leafConditionConverter = new AthenaLeafConditionConverter(new FieldIdentifierResolver(options));
        log.info("Created Athena backend with element_at fields {} and container {}",
                options.getElementAtFields(), options.getElementAtContainer());
    }

    public String convert(final LeafCondition condition) {
        return leafConditionConverter.convertLeafCondition(condition);
    }

    /**
     * Converts each condition independently. The caller combines the returned predicates.
     */
    public List<String> convert(final List<LeafCondition> conditions) {
        return conditions.stream()
                .map(this::convert)
                .collect(Collectors.toList());
    }
}
