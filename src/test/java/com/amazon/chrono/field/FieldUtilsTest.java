// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.IllegalFieldValueException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class FieldUtilsTest
{
    @Test
    public void testSafeAddOverflow()
    {
        assertEquals(-2, FieldUtils.safeAdd(5, -7));
        assertEquals(Long.MAX_VALUE, FieldUtils.safeAdd(Long.MAX_VALUE - 1, 1L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeAdd(Integer.MAX_VALUE, 1));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeAdd(Integer.MIN_VALUE, -1));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeAdd(Long.MAX_VALUE, 1L));
    }

    @Test
    public void testSafeSubtractOverflow()
    {
        assertEquals(12L, FieldUtils.safeSubtract(5L, -7L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeSubtract(Long.MIN_VALUE, 1L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeSubtract(0L, Long.MIN_VALUE));
    }

    @Test
    public void testSafeNegate()
    {
        assertEquals(-5, FieldUtils.safeNegate(5));
        assertEquals(Integer.MAX_VALUE, FieldUtils.safeNegate(-Integer.MAX_VALUE));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeNegate(Integer.MIN_VALUE));
    }

    @Test
    public void testSafeMultiply()
    {
        assertEquals(-21L, FieldUtils.safeMultiply(7L, -3));
        assertEquals(0L, FieldUtils.safeMultiply(Long.MAX_VALUE, 0));
        assertEquals(-Long.MAX_VALUE, FieldUtils.safeMultiply(Long.MAX_VALUE, -1));
        assertEquals(1L << 62, FieldUtils.safeMultiply(1L << 31, 1L << 31));

        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(65536, 65536));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(Long.MIN_VALUE, -1));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(Long.MAX_VALUE / 2, 3));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(Long.MIN_VALUE, -1L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(-1L, Long.MIN_VALUE));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiply(1L << 32, 1L << 31));
    }

    @Test
    public void testSafeDivide()
    {
        assertEquals(-3L, FieldUtils.safeDivide(-7L, 2L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeDivide(Long.MIN_VALUE, -1L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeDivide(1L, 0L));
    }

    @Test
    public void testSafeToInt()
    {
        assertEquals(Integer.MIN_VALUE, FieldUtils.safeToInt(Integer.MIN_VALUE));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeToInt(Integer.MAX_VALUE + 1L));
        assertEquals(6, FieldUtils.safeMultiplyToInt(2L, 3L));
        assertThrows(ArithmeticException.class, () -> FieldUtils.safeMultiplyToInt(65536L, 65536L));
    }

    @ParameterizedTest
    @CsvSource({
        "30,  5,  1, 30,  5",
        " 1, -1,  1, 12, 12",
        " 0, -1,  0, 59, 59",
        "12, 12,  1, 12, 12",
        " 3, -25, 1, 12,  2",
        " 0, 120, 0, 59,  0",
    })
    public void testGetWrappedValue(int current, int add, int min, int max, int expected)
    {
        assertEquals(expected, FieldUtils.getWrappedValue(current, add, min, max));
    }

    @Test
    public void testGetWrappedValueDoesNotOverflow()
    {
        assertEquals(4, FieldUtils.getWrappedValue(Integer.MAX_VALUE, Integer.MAX_VALUE, 0, 9));
        assertEquals(1, FieldUtils.getWrappedValue(-5, 1, 3));
    }

    @Test
    public void testGetWrappedValueRejectsEmptyRange()
    {
        assertThrows(IllegalArgumentException.class, () -> FieldUtils.getWrappedValue(5, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> FieldUtils.getWrappedValue(5, 1, 6, 5));
    }

    @Test
    public void testVerifyValueBounds()
    {
        FieldUtils.verifyValueBounds(DateTimeFieldType.MONTH_OF_YEAR, 12, 1, 12);

        IllegalFieldValueException e =
            assertThrows(IllegalFieldValueException.class,
                         () -> FieldUtils.verifyValueBounds(DateTimeFieldType.MONTH_OF_YEAR, 13, 1, 12));
        assertSame(DateTimeFieldType.MONTH_OF_YEAR, e.getDateTimeFieldType());
        assertEquals("monthOfYear", e.getFieldName());
        assertEquals(13, e.getIllegalNumberValue().intValue());
        assertEquals(1, e.getLowerBound().intValue());
        assertEquals(12, e.getUpperBound().intValue());
        assertThat(e.getMessage(), equalTo("Value 13 for monthOfYear must be in the range [1,12]"));

        e = assertThrows(IllegalFieldValueException.class,
                         () -> FieldUtils.verifyValueBounds("quarter", 0, 1, 4));
        assertEquals("quarter", e.getFieldName());
    }
}
