/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

/**
 * Marker for the values a leaf condition can compare a field against.
 */
public interface SigmaType {
}
