/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.exception;

/**
 * Thrown when the modifiers attached to a value cannot be combined into a single comparison.
 */
public class InvalidModifierException extends RuleConversionException {
    public InvalidModifierException(final String message) {
        super(message);
    }
}
