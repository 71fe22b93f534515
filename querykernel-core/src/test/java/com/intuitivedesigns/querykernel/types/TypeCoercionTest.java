/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.types;

import com.intuitivedesigns.querykernel.error.AggregationException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.model.SemanticType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeCoercionTest {

    @Test
    void testNullPassesThrough() {
        for (SemanticType t : SemanticType.values()) {
            assertNull(TypeCoercion.coerce(null, t));
        }
    }

    @Test
    void testIntegerCoercion() {
        assertEquals(42L, TypeCoercion.coerce(42, SemanticType.INTEGER));
        assertEquals(42L, TypeCoercion.coerce("42", SemanticType.INTEGER));
        assertEquals(7L, TypeCoercion.coerce(7.0d, SemanticType.INTEGER));
        assertEquals(10L, TypeCoercion.coerce(new BigDecimal("10.00"), SemanticType.INTEGER));

        AggregationException e = assertThrows(AggregationException.class,
                () -> TypeCoercion.coerce(7.5d, SemanticType.INTEGER));
        assertEquals(ErrorKind.UNSUPPORTED_COERCION, e.kind());
        assertThrows(AggregationException.class, () -> TypeCoercion.coerce("seven", SemanticType.INTEGER));
    }

    @Test
    void testTextRendersWholeDoublesWithoutFraction() {
        assertEquals("3", TypeCoercion.coerce(3.0d, SemanticType.TEXT));
        assertEquals("3.25", TypeCoercion.coerce(3.25d, SemanticType.TEXT));
        assertEquals("17", TypeCoercion.coerce(17L, SemanticType.TEXT));
        assertEquals("true", TypeCoercion.coerce(true, SemanticType.TEXT));
    }

    @Test
    void testBooleanCoercion() {
        assertEquals(Boolean.TRUE, TypeCoercion.coerce("yes", SemanticType.BOOLEAN));
        assertEquals(Boolean.FALSE, TypeCoercion.coerce(0, SemanticType.BOOLEAN));
        assertThrows(AggregationException.class, () -> TypeCoercion.coerce(2, SemanticType.BOOLEAN));
        assertThrows(AggregationException.class, () -> TypeCoercion.coerce("maybe", SemanticType.BOOLEAN));
    }

    @Test
    void testTimestampCoercion() {
        long expected = Instant.parse("2025-01-02T03:04:05Z").toEpochMilli();

        assertEquals(expected, TypeCoercion.coerce("2025-01-02T03:04:05Z", SemanticType.TIMESTAMP));
        assertEquals(expected, TypeCoercion.coerce("2025-01-02 03:04:05", SemanticType.TIMESTAMP));
        assertEquals(expected, TypeCoercion.coerce(Instant.ofEpochMilli(expected), SemanticType.TIMESTAMP));
        assertEquals(expected, TypeCoercion.coerce(String.valueOf(expected), SemanticType.TIMESTAMP));
        assertThrows(AggregationException.class, () -> TypeCoercion.coerce("yesterday", SemanticType.TIMESTAMP));
    }

    @Test
    void testJoinKeyTypes() {
        assertEquals(Optional.of(SemanticType.INTEGER), TypeCoercion.joinKeyType(SemanticType.INTEGER, SemanticType.INTEGER));
        assertEquals(Optional.of(SemanticType.FLOAT), TypeCoercion.joinKeyType(SemanticType.INTEGER, SemanticType.FLOAT));
        assertEquals(Optional.of(SemanticType.TEXT), TypeCoercion.joinKeyType(SemanticType.TEXT, SemanticType.INTEGER));
        assertTrue(TypeCoercion.joinKeyType(SemanticType.BOOLEAN, SemanticType.INTEGER).isEmpty());
        assertTrue(TypeCoercion.joinKeyType(SemanticType.VECTOR, SemanticType.VECTOR).isEmpty());
    }

    @Test
    void testJoinKeyCanonicalization() {
        assertEquals(TypeCoercion.joinKey(-0.0d, SemanticType.FLOAT), TypeCoercion.joinKey(0.0d, SemanticType.FLOAT));
        assertNull(TypeCoercion.joinKey(Double.NaN, SemanticType.FLOAT));
        assertEquals(TypeCoercion.joinKey(5, SemanticType.FLOAT), TypeCoercion.joinKey("5.0", SemanticType.FLOAT));
    }

    @Test
    void testCompareAcrossNumericClasses() {
        assertTrue(TypeCoercion.compare(2L, 2.5d) < 0);
        assertTrue(TypeCoercion.compare("b", "a") > 0);
        assertThrows(AggregationException.class, () -> TypeCoercion.compare("a", 1L));
    }
}
