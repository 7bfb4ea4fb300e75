/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.converter;

import inet.ipaddr.IPAddress;
import inet.ipaddr.IPAddressString;
import inet.ipaddr.IPAddressStringParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.securityanalytics.athena.exception.RuleConversionException;
import org.opensearch.securityanalytics.athena.field.FieldIdentifierResolver;
import org.opensearch.securityanalytics.athena.model.FieldReference;
import org.opensearch.securityanalytics.athena.model.LeafCondition;
import org.opensearch.securityanalytics.athena.model.types.SigmaBool;
import org.opensearch.securityanalytics.athena.model.types.SigmaFieldReference;
import org.opensearch.securityanalytics.athena.model.types.SigmaNull;
import org.opensearch.securityanalytics.athena.model.types.SigmaNumber;
import org.opensearch.securityanalytics.athena.model.types.SigmaString;
import org.opensearch.securityanalytics.athena.model.types.SigmaType;
import org.opensearch.securityanalytics.athena.modifier.ComparisonShape;
import org.opensearch.securityanalytics.athena.modifier.ModifierResolver;
import org.opensearch.securityanalytics.athena.modifier.ResolvedModifiers;
import org.opensearch.securityanalytics.athena.sql.LikeValueEscaper;
import org.opensearch.securityanalytics.athena.sql.SqlPredicateAssembler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts one leaf condition into an Athena SQL boolean expression.
 * <p>
 * The field is resolved once, every value produces one predicate under the shared modifiers, and the predicates
 * are joined and negated as a group.
 */
public class AthenaLeafConditionConverter {
    private static final Logger log = LogManager.getLogger(AthenaLeafConditionConverter.class);
    private static final IPAddressStringParameters CIDR_PARAMETERS = new IPAddressStringParameters.Builder()
            .getIPv4AddressParametersBuilder()
            .allow_inet_aton(false)
            .getParentBuilder()
            .toParams();

    private final FieldIdentifierResolver fieldIdentifierResolver;
    private final ModifierResolver modifierResolver;
    private final LikeValueEscaper likeValueEscaper;
    private final SqlPredicateAssembler sqlPredicateAssembler;

    public AthenaLeafConditionConverter(final FieldIdentifierResolver fieldIdentifierResolver) {
        this(fieldIdentifierResolver, new ModifierResolver(), new LikeValueEscaper(), new SqlPredicateAssembler());
    }

    // Visible for testing
    AthenaLeafConditionConverter(final FieldIdentifierResolver fieldIdentifierResolver,
                                 final ModifierResolver modifierResolver,
                                 final LikeValueEscaper likeValueEscaper,
                                 final SqlPredicateAssembler sqlPredicateAssembler) {
        this.fieldIdentifierResolver = fieldIdentifierResolver;
        this.modifierResolver = modifierResolver;
        this.likeValueEscaper = likeValueEscaper;
        this.sqlPredicateAssembler = sqlPredicateAssembler;
    }

    public String convertLeafCondition(final LeafCondition condition) {
        final ResolvedModifiers modifiers = modifierResolver.resolve(condition.getModifiers());
        final String identifier = fieldIdentifierResolver.resolve(condition.getField());

        final List<String> predicates = condition.getValues().stream()
                .map(value -> convertValue(identifier, value, modifiers, condition.getField()))
                .collect(Collectors.toList());

        final String predicate = sqlPredicateAssembler.combine(predicates, modifiers.isMatchAll(), condition.isNegated());
        log.debug("Converted condition {} to {}", condition, predicate);

        return predicate;
    }

    private String convertValue(final String identifier, final SigmaType value, final ResolvedModifiers modifiers,
                                final FieldReference field) {
        final ComparisonShape shape = modifiers.getShape();

        switch (shape) {
            case REGEX:
                return convertRegularExpression(identifier, value, field);
            case FIELD_EQUALITY:
                return convertFieldReference(identifier, value, field);
            case CIDR:
                return convertCIDRContains(identifier, value, field);
            case EXISTS:
                return convertExists(identifier, value, field);
            default:
                break;
        }

        if (value instanceof SigmaString) {
            return convertString(identifier, (SigmaString) value, modifiers, field);
        } else if (value instanceof SigmaNumber) {
            return convertNumber(identifier, (SigmaNumber) value, modifiers);
        } else if (value instanceof SigmaBool && shape == ComparisonShape.EQUALITY) {
            return sqlPredicateAssembler.booleanEquality(identifier, ((SigmaBool) value).isaBoolean());
        } else if (value instanceof SigmaNull && shape == ComparisonShape.EQUALITY) {
            return sqlPredicateAssembler.isNull(identifier);
        } else {
            throw unexpectedValue(value, shape, field);
        }
    }

    private String convertString(final String identifier, final SigmaString value, final ResolvedModifiers modifiers,
                                 final FieldReference field) {
        final ComparisonShape shape = modifiers.getShape();
        if (shape.isNumericComparison()) {
            throw unexpectedValue(value, shape, field);
        }

        final String escapedValue = likeValueEscaper.escape(value, shape, modifiers.isCaseSensitive());
        return sqlPredicateAssembler.stringComparison(identifier, escapedValue, shape, modifiers.isCaseSensitive());
    }

    private String convertNumber(final String identifier, final SigmaNumber value, final ResolvedModifiers modifiers) {
        final ComparisonShape shape = modifiers.getShape();
        if (shape.isPattern()) {
            final String escapedValue = likeValueEscaper.escape(value.toSqlString(), shape, modifiers.isCaseSensitive());
            return sqlPredicateAssembler.stringComparison(identifier, escapedValue, shape, modifiers.isCaseSensitive());
        }

        return sqlPredicateAssembler.numericComparison(identifier, shape, value.toSqlString());
    }

    private String convertRegularExpression(final String identifier, final SigmaType value, final FieldReference field) {
        if (!(value instanceof SigmaString)) {
            throw unexpectedValue(value, ComparisonShape.REGEX, field);
        }

        return sqlPredicateAssembler.regularExpression(identifier, ((SigmaString) value).getOriginal());
    }

    private String convertFieldReference(final String identifier, final SigmaType value, final FieldReference field) {
        final FieldReference otherField;
        if (value instanceof SigmaFieldReference) {
            otherField = ((SigmaFieldReference) value).getField();
        } else if (value instanceof SigmaString) {
            otherField = FieldReference.of(((SigmaString) value).getOriginal());
        } else {
            throw unexpectedValue(value, ComparisonShape.FIELD_EQUALITY, field);
        }

        return sqlPredicateAssembler.fieldEquality(identifier, fieldIdentifierResolver.resolve(otherField));
    }

    private String convertCIDRContains(final String identifier, final SigmaType value, final FieldReference field) {
        if (!(value instanceof SigmaString)) {
            throw unexpectedValue(value, ComparisonShape.CIDR, field);
        }

        final String cidr = ((SigmaString) value).getOriginal();
        final IPAddressString addressString = new IPAddressString(cidr, CIDR_PARAMETERS);
        if (!addressString.isIPAddress()) {
            throw new RuleConversionException("Invalid CIDR expression '" + cidr + "' for field " + field);
        }

        final IPAddress address = addressString.getAddress();
        final String network = address.isPrefixed()
                ? address.toPrefixBlock().toCanonicalString()
                : address.toCanonicalString() + "/" + address.getBitCount();

        return sqlPredicateAssembler.cidrContains(identifier, network);
    }

    private String convertExists(final String identifier, final SigmaType value, final FieldReference field) {
        if (!(value instanceof SigmaBool)) {
            throw unexpectedValue(value, ComparisonShape.EXISTS, field);
        }

        return ((SigmaBool) value).isaBoolean()
                ? sqlPredicateAssembler.isNotNull(identifier)
                : sqlPredicateAssembler.isNull(identifier);
    }

    private RuleConversionException unexpectedValue(final SigmaType value, final ComparisonShape shape,
                                                    final FieldReference field) {
        return new RuleConversionException("Unexpected value type " + value.getClass().getSimpleName() +
                " for comparison " + shape + " on field " + field);
    }
}
