/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.securityanalytics.athena.exception.MissingTemplateKeyException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes a run state value from a template, filled from default values overridden by the backend options.
 */
public class SetStateFromBackendOptionsTransformation {
    private static final Logger log = LogManager.getLogger(SetStateFromBackendOptionsTransformation.class);

    private static final String MISSING_KEY_FORMAT = "Missing key '%s' in template substitution for '%s'. " +
            "Available keys: %s. You likely need to set the key '%s' via 'backend options'.";

    private final String key;
    private final String template;
    private final Map<String, String> defaultValues;

    public SetStateFromBackendOptionsTransformation(final String key, final String template,
                                                    final Map<String, String> defaultValues) {
        this.key = key;
        this.template = template;
        this.defaultValues = defaultValues == null ? Collections.emptyMap() : new HashMap<>(defaultValues);
    }

    public SetStateFromBackendOptionsTransformation(final String key, final String template) {
        this(key, template, Collections.emptyMap());
    }

    /**
     * Writes the computed value to the state. Nothing is written if the template cannot be filled.
     *
     * @param state - the run state to update
     * @param backendOptions - user supplied options, taking precedence over the default values
     * @return - the value written
     */
    public String apply(final RunState state, final Map<String, String> backendOptions) {
        final String value = computeValue(mergeValues(backendOptions));
        state.set(key, value);
        log.info("Set run state {} to {}", key, value);

        return value;
    }

    protected String computeValue(final Map<String, String> values) {
        try {
            return TemplateRenderer.render(template, values);
        } catch (final MissingTemplateKeyException e) {
            final String missingKey = e.getMissingKey();
            throw new MissingTemplateKeyException(missingKey,
                    String.format(MISSING_KEY_FORMAT, missingKey, key, values.keySet(), missingKey), e);
        }
    }

    private Map<String, String> mergeValues(final Map<String, String> backendOptions) {
        final Map<String, String> values = new LinkedHashMap<>(defaultValues);
        if (backendOptions != null) {
            values.putAll(backendOptions);
        }

        return values;
    }
}
