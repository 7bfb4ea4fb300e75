/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.exception;

public class RuleConversionException extends RuntimeException {
    public RuleConversionException(final String message) {
        super(message);
    }

    public RuleConversionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
