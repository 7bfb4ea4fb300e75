/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.config;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AthenaBackendOptionsTests {
    @Test
    public void testDefaults() {
        final AthenaBackendOptions options = AthenaBackendOptions.defaults();

        assertEquals(Set.of("unmapped"), options.getElementAtFields());
        assertEquals("unmapped", options.getElementAtContainer());
        assertTrue(options.getFieldMappings().isEmpty());
    }

    @Test
    public void testFromBackendOptions() {
        final AthenaBackendOptions options = AthenaBackendOptions.fromBackendOptions(Map.of(
                "element_at_fields", " unmapped , raw ,,",
                "element_at_container", "raw",
                "field_mapping.EventName", "api.operation",
                "backend_aws_table_region", "us_east_1"
        ));

        assertEquals(Set.of("unmapped", "raw"), options.getElementAtFields());
        assertEquals("raw", options.getElementAtContainer());
        assertEquals(Map.of("EventName", "api.operation"), options.getFieldMappings());
    }

    @Test
    public void testFromBackendOptions_Null() {
        assertEquals(Set.of("unmapped"), AthenaBackendOptions.fromBackendOptions(null).getElementAtFields());
    }

    @Test
    public void testFromBackendOptions_EmptyElementAtFieldsDisablesPrefixes() {
        assertTrue(AthenaBackendOptions.fromBackendOptions(Map.of("element_at_fields", "")).getElementAtFields().isEmpty());
    }

    @Test
    public void testBuilder_BlankContainer_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> AthenaBackendOptions.builder().elementAtContainer(" ").build());
    }
}
