// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class IllegalFieldValueExceptionTest
{
    @Test
    public void testRangeMessage()
    {
        IllegalFieldValueException e =
            new IllegalFieldValueException(DateTimeFieldType.DAY_OF_MONTH, 32, 1, 31);
        assertEquals("Value 32 for dayOfMonth must be in the range [1,31]", e.getMessage());
        assertSame(DateTimeFieldType.DAY_OF_MONTH, e.getDateTimeFieldType());
        assertNull(e.getDurationFieldType());
        assertTrue(e instanceof ChronoException);
    }

    @Test
    public void testOpenBoundMessages()
    {
        assertEquals("Value 5 for days must not be larger than 4",
                     new IllegalFieldValueException(DurationFieldType.DAYS, 5, null, 4).getMessage());
        assertEquals("Value -1 for days must not be smaller than 0",
                     new IllegalFieldValueException(DurationFieldType.DAYS, -1, 0, null).getMessage());
        assertEquals("Value 7 for quarter is not supported",
                     new IllegalFieldValueException("quarter", 7, null, null).getMessage());
    }

    @Test
    public void testExplanationMessage()
    {
        IllegalFieldValueException e =
            new IllegalFieldValueException(DateTimeFieldType.YEAR, 0, "the value 0 is skipped");
        assertEquals("Value 0 for year is not supported: the value 0 is skipped", e.getMessage());
        assertEquals("year", e.getFieldName());
        assertNull(e.getLowerBound());
        assertNull(e.getUpperBound());
    }

    @Test
    public void testExceptionTaxonomy()
    {
        UnsupportedFieldException unsupported = new UnsupportedFieldException("eras");
        assertEquals("eras field is unsupported", unsupported.getMessage());
        assertTrue(unsupported instanceof ChronoException);

        IncompatibleFieldsException incompatible = new IncompatibleFieldsException("no carry");
        assertEquals("no carry", incompatible.getMessage());
        assertTrue(incompatible instanceof ChronoException);

        ChronoException wrapped = new ChronoException("outer", new ArithmeticException("inner"));
        assertEquals("outer", wrapped.getMessage());
        assertTrue(wrapped.getCause() instanceof ArithmeticException);
    }
}
