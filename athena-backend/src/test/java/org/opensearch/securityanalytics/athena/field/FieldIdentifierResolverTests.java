/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.field;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opensearch.securityanalytics.athena.config.AthenaBackendOptions;
import org.opensearch.securityanalytics.athena.model.FieldReference;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FieldIdentifierResolverTests {
    private static final Map<String, String> FIELD_MAPPINGS = Map.of(
            "EventName", "api.operation",
            "AccountId", "unmapped.recipientAccountId",
            "UserName", "actor.user.name"
    );

    private FieldIdentifierResolver resolverWithMappings;
    private FieldIdentifierResolver resolverWithoutMappings;

    @BeforeEach
    public void setup() {
        this.resolverWithMappings = new FieldIdentifierResolver(FIELD_MAPPINGS, Set.of("unmapped"), "unmapped");
        this.resolverWithoutMappings = new FieldIdentifierResolver(AthenaBackendOptions.defaults());
    }

    @Test
    public void testResolve_BareIdentifier() {
        assertEquals("eventName", resolverWithoutMappings.resolve(FieldReference.of("eventName")));
        assertEquals("_private1", resolverWithoutMappings.resolve(FieldReference.of("_private1")));
    }

    @Test
    public void testResolve_IdentifierNeedingQuotes() {
        assertEquals("\"field name\"", resolverWithoutMappings.resolve(FieldReference.of("field name")));
        assertEquals("\"1stField\"", resolverWithoutMappings.resolve(FieldReference.of("1stField")));
        assertEquals("\"dash-field\"", resolverWithoutMappings.resolve(FieldReference.of("dash-field")));
    }

    @Test
    public void testResolve_EmbeddedDoubleQuoteIsDoubled() {
        assertEquals("\"say \"\"hi\"\"\"", resolverWithoutMappings.resolve(FieldReference.of("say \"hi\"")));
    }

    @Test
    public void testResolve_NestedColumn() {
        assertEquals("actor.user.name", resolverWithoutMappings.resolve(FieldReference.of("actor.user.name")));
        assertEquals("src_endpoint.\"ip address\"", resolverWithoutMappings.resolve(FieldReference.of("src_endpoint.ip address")));
    }

    @Test
    public void testResolve_EscapedDotBecomesQuotedSegment() {
        assertEquals("actor.\"user.uid\"", resolverWithoutMappings.resolve(FieldReference.of("actor.user\\.uid")));
    }

    @Test
    public void testResolve_ElementAtPrefix() {
        assertEquals("element_at(unmapped, 'serviceEventDetails.account_id')",
                resolverWithoutMappings.resolve(FieldReference.of("unmapped.serviceEventDetails.account_id")));
    }

    @Test
    public void testResolve_ElementAtPrefix_EscapedDotKeptInKey() {
        assertEquals("element_at(unmapped, 'requestParameters.bucket.name')",
                resolverWithoutMappings.resolve(FieldReference.of("unmapped.requestParameters.bucket\\.name")));
    }

    @Test
    public void testResolve_ElementAtPrefix_QuoteInKeyIsDoubled() {
        assertEquals("element_at(unmapped, 'it''s')", resolverWithoutMappings.resolve(FieldReference.of("unmapped.it's")));
    }

    @Test
    public void testResolve_PrefixAloneIsAColumn() {
        assertEquals("unmapped", resolverWithoutMappings.resolve(FieldReference.of("unmapped")));
    }

    @Test
    public void testResolve_FlaggedUnmappedUsesContainer() {
        final FieldIdentifierResolver resolver = new FieldIdentifierResolver(Map.of(), Set.of(), "raw_data");

        assertEquals("element_at(raw_data, 'userIdentity.arn')",
                resolver.resolve(FieldReference.unmapped("userIdentity.arn")));
    }

    @Test
    public void testResolve_WithMapping() {
        assertEquals("api.operation", resolverWithMappings.resolve(FieldReference.of("EventName")));
        assertEquals("element_at(unmapped, 'recipientAccountId')", resolverWithMappings.resolve(FieldReference.of("AccountId")));
    }

    @Test
    public void testResolve_WithoutMapping() {
        assertEquals("EventName", resolverWithoutMappings.resolve(FieldReference.of("EventName")));
        assertEquals("\"Event Name\"", resolverWithMappings.resolve(FieldReference.of("Event Name")));
    }

    @Test
    public void testQuoteIdentifier() {
        assertEquals("col", FieldIdentifierResolver.quoteIdentifier("col"));
        assertEquals("\"user.uid\"", FieldIdentifierResolver.quoteIdentifier("user.uid"));
        assertEquals("\"\"", FieldIdentifierResolver.quoteIdentifier(""));
    }
}
