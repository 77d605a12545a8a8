// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

import static com.amazon.chrono.TestCalendar.DAY_OF_MONTH;
import static com.amazon.chrono.TestCalendar.HOUR_OF_DAY;
import static com.amazon.chrono.TestCalendar.MONTH_OF_YEAR;
import static com.amazon.chrono.TestCalendar.YEAR;
import static com.amazon.chrono.TestCalendar.instant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Behavior the interface derives for every field.
 */
public class DateTimeFieldTest
{
    @Test
    public void testRoundHalfEvenPicksEvenValueOnTie()
    {
        assertEquals(instant(2001, 1, 1, 12, 0, 0, 0),
                     HOUR_OF_DAY.roundHalfEven(instant(2001, 1, 1, 11, 30, 0, 0)));
        assertEquals(instant(2001, 1, 1, 10, 0, 0, 0),
                     HOUR_OF_DAY.roundHalfEven(instant(2001, 1, 1, 10, 30, 0, 0)));
        assertEquals(instant(2001, 1, 1, 11, 0, 0, 0),
                     HOUR_OF_DAY.roundHalfEven(instant(2001, 1, 1, 10, 31, 0, 0)));
        assertEquals(instant(2001, 1, 1, 10, 0, 0, 0),
                     HOUR_OF_DAY.roundHalfEven(instant(2001, 1, 1, 10, 29, 0, 0)));
    }

    @Test
    public void testRoundingImpreciseField()
    {
        // the 16th of a 30 day month is exactly halfway
        long halfway = instant(2001, 4, 16, 0, 0, 0, 0);
        assertEquals(instant(2001, 4, 1), MONTH_OF_YEAR.roundHalfFloor(halfway));
        assertEquals(instant(2001, 5, 1), MONTH_OF_YEAR.roundHalfCeiling(halfway));
        assertEquals(instant(2001, 4, 1), MONTH_OF_YEAR.roundHalfEven(halfway));
        assertEquals(15 * 86400000L, MONTH_OF_YEAR.remainder(halfway));
        assertEquals(instant(2001, 4, 1), MONTH_OF_YEAR.roundCeiling(instant(2001, 4, 1)));
    }

    @Test
    public void testLeapDefaults()
    {
        assertFalse(HOUR_OF_DAY.isLeap(0L));
        assertEquals(0, HOUR_OF_DAY.getLeapAmount(0L));
        assertNull(HOUR_OF_DAY.getLeapDurationField());

        assertTrue(YEAR.isLeap(instant(2000, 6, 1)));
        assertEquals(1, YEAR.getLeapAmount(instant(2000, 6, 1)));
        assertFalse(YEAR.isLeap(instant(1900, 6, 1)));
        assertSame(TestCalendar.DAYS, YEAR.getLeapDurationField());
        assertTrue(DAY_OF_MONTH.isLeap(instant(2004, 2, 29)));
    }

    @Test
    public void testBoundsOverloadsDefaultToIntrinsicBounds()
    {
        ReadablePartial partial = new TestPartial(HOUR_OF_DAY);
        int[] values = { 5 };
        assertEquals(0, HOUR_OF_DAY.getMinimumValue(0L));
        assertEquals(0, HOUR_OF_DAY.getMinimumValue(partial));
        assertEquals(0, HOUR_OF_DAY.getMinimumValue(partial, values));
        assertEquals(23, HOUR_OF_DAY.getMaximumValue(partial));
        assertEquals(23, HOUR_OF_DAY.getMaximumValue(partial, values));
        assertEquals(31, DAY_OF_MONTH.getMaximumValue(partial, values));
    }

    @Test
    public void testIdentity()
    {
        assertEquals("hourOfDay", HOUR_OF_DAY.getName());
        assertTrue(HOUR_OF_DAY.isSupported());
        assertFalse(HOUR_OF_DAY.isLenient());
        assertEquals("DateTimeField[hourOfDay]", HOUR_OF_DAY.toString());
        assertEquals("DateTimeField[monthOfYear]", MONTH_OF_YEAR.toString());
    }

    @Test
    public void testPartialLookup()
    {
        ReadablePartial partial = new TestPartial(YEAR, MONTH_OF_YEAR, DAY_OF_MONTH);
        assertEquals(3, partial.size());
        assertEquals(DateTimeFieldType.MONTH_OF_YEAR, partial.getFieldType(1));
        assertEquals(2, partial.indexOf(DateTimeFieldType.DAY_OF_MONTH));
        assertEquals(-1, partial.indexOf(DateTimeFieldType.HOUR_OF_DAY));
    }
}
