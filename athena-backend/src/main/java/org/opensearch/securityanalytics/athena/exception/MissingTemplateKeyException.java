/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.exception;

public class MissingTemplateKeyException extends RuleConversionException {
    private final String missingKey;

    public MissingTemplateKeyException(final String missingKey, final String message) {
        super(message);
        this.missingKey = missingKey;
    }

    public MissingTemplateKeyException(final String missingKey, final String message, final Throwable cause) {
        super(message, cause);
        this.missingKey = missingKey;
    }

    public String getMissingKey() {
        return missingKey;
    }
}
