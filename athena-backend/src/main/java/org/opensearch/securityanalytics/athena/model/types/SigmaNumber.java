/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model.types;

import org.opensearch.securityanalytics.athena.exception.RuleConversionException;

import java.math.BigDecimal;
import java.util.Objects;

public class SigmaNumber implements SigmaType {
    private final Number number;

    public SigmaNumber(final int number) {
        this.number = number;
    }

    public SigmaNumber(final long number) {
        this.number = number;
    }

    public SigmaNumber(final float number) {
        this.number = number;
    }

    public SigmaNumber(final double number) {
        this.number = number;
    }

    public boolean isInteger() {
        return number instanceof Integer || number instanceof Long;
    }

    public boolean isFinite() {
        return isInteger() || Double.isFinite(number.doubleValue());
    }

    /**
     * @return - the number as it is written in a SQL statement, without exponent notation
     * @throws RuleConversionException - if the number is NaN or infinite, which have no SQL literal
     */
    public String toSqlString() {
        if (isInteger()) {
            return number.toString();
        }
        if (!isFinite()) {
            throw new RuleConversionException("Number " + number + " cannot be written as a SQL literal");
        }

        return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return number.equals(((SigmaNumber) o).number);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number);
    }

    @Override
    public String toString() {
        return String.valueOf(number);
    }
}
