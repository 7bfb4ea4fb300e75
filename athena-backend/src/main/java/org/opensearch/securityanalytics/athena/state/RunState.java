/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.state;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key/value state computed once at the start of a conversion run and read by later stages, such as the table
 * name used in the final query.
 */
public class RunState {
    private final Map<String, String> state;

    public RunState() {
        this.state = new ConcurrentHashMap<>();
    }

    public void set(final String key, final String value) {
        state.put(key, value);
    }

    /**
     * @return - the value stored under the key, or null if the key was never set
     */
    public String get(final String key) {
        return state.get(key);
    }

    public boolean contains(final String key) {
        return state.containsKey(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new HashMap<>(state));
    }
}
