/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package org.opensearch.securityanalytics.athena.model;

import org.junit.jupiter.api.Test;
import org.opensearch.securityanalytics.athena.exception.InvalidModifierException;
import org.opensearch.securityanalytics.athena.model.types.SigmaString;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FieldReferenceTests {
    @Test
    public void testGetPathSegments() {
        assertEquals(List.of("single"), FieldReference.of("single").getPathSegments());
        assertEquals(List.of("a", "b", "c"), FieldReference.of("a.b.c").getPathSegments());
        assertEquals(List.of("actor", "user.uid"), FieldReference.of("actor.user\\.uid").getPathSegments());
        assertEquals(List.of("a\\b"), FieldReference.of("a\\b").getPathSegments());
    }

    @Test
    public void testGetPathSegments_DoubledBackslashDoesNotEscapeDot() {
        assertEquals(List.of("a\\", "b"), FieldReference.of("a\\\\.b").getPathSegments());
        assertEquals(List.of("a\\.b"), FieldReference.of("a\\\\\\.b").getPathSegments());
    }

    @Test
    public void testUnmappedFlag() {
        assertFalse(FieldReference.of("x").isUnmapped());
        assertTrue(FieldReference.unmapped("x").isUnmapped());
        assertNotEquals(FieldReference.of("x"), FieldReference.unmapped("x"));
    }

    @Test
    public void testModifierFromIdentifier() {
        assertEquals(Modifier.STARTSWITH, Modifier.fromIdentifier("startswith"));
        assertEquals(Modifier.CASED, Modifier.fromIdentifier("Cased"));
        assertThrows(InvalidModifierException.class, () -> Modifier.fromIdentifier("base64offset"));
    }

    @Test
    public void testLeafCondition_RequiresValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new LeafCondition(FieldReference.of("x"), List.of(), List.of(), false));
    }

    @Test
    public void testLeafCondition_Negate() {
        final LeafCondition condition = new LeafCondition(FieldReference.of("x"), List.of(Modifier.CONTAINS), new SigmaString("y"));

        assertFalse(condition.isNegated());
        assertTrue(condition.negate().isNegated());
        assertEquals(condition, condition.negate().negate());
    }
}
