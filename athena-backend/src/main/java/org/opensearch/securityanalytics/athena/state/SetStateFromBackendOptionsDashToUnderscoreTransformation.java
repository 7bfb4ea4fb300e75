/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.state;

import java.util.Map;

/**
 * Variant for values embedded in identifiers, where dashes are not allowed: every {@code -} becomes {@code _}.
 */
public class SetStateFromBackendOptionsDashToUnderscoreTransformation extends SetStateFromBackendOptionsTransformation {
    public SetStateFromBackendOptionsDashToUnderscoreTransformation(final String key, final String template,
                                                                    final Map<String, String> defaultValues) {
        super(key, template, defaultValues);
    }

    @Override
    protected String computeValue(final Map<String, String> values) {
        return super.computeValue(values).replace('-', '_');
    }
}
