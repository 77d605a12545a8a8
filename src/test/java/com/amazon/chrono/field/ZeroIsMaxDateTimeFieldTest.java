// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.TestCalendar.HOUR_OF_DAY;
import static com.amazon.chrono.TestCalendar.HOUR_OF_HALFDAY;
import static com.amazon.chrono.TestCalendar.MONTH_OF_YEAR;
import static com.amazon.chrono.TestCalendar.instant;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.IllegalFieldValueException;
import com.amazon.chrono.ReadablePartial;
import com.amazon.chrono.TestPartial;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ZeroIsMaxDateTimeFieldTest
{
    private static final ZeroIsMaxDateTimeField CLOCKHOUR_OF_DAY =
        new ZeroIsMaxDateTimeField(HOUR_OF_DAY, DateTimeFieldType.CLOCKHOUR_OF_DAY);

    @Test
    public void testWrappedMinimumMustBeZero()
    {
        assertThrows(IllegalArgumentException.class,
                     () -> new ZeroIsMaxDateTimeField(MONTH_OF_YEAR, DateTimeFieldType.MONTH_OF_YEAR));
        assertThrows(IllegalArgumentException.class,
                     () -> new ZeroIsMaxDateTimeField(HOUR_OF_DAY, null));
    }

    @ParameterizedTest
    @CsvSource({
        " 0, 24",
        " 1,  1",
        "10, 10",
        "23, 23",
    })
    public void testZeroReadsAsMaximum(int hourOfDay, int clockhour)
    {
        assertEquals(clockhour, CLOCKHOUR_OF_DAY.get(instant(2001, 1, 1, hourOfDay, 30, 0, 0)));
    }

    @Test
    public void testSetMaximumStoresZero()
    {
        long instant = instant(2001, 1, 1, 10, 30, 0, 0);
        assertEquals(instant(2001, 1, 1, 0, 30, 0, 0), CLOCKHOUR_OF_DAY.set(instant, 24));
        assertEquals(instant(2001, 1, 1, 23, 30, 0, 0), CLOCKHOUR_OF_DAY.set(instant, 23));
        assertThrows(IllegalFieldValueException.class, () -> CLOCKHOUR_OF_DAY.set(instant, 0));
        assertThrows(IllegalFieldValueException.class, () -> CLOCKHOUR_OF_DAY.set(instant, 25));
    }

    @Test
    public void testBounds()
    {
        ReadablePartial partial = new TestPartial(CLOCKHOUR_OF_DAY);
        int[] values = { 5 };

        assertEquals(DateTimeFieldType.CLOCKHOUR_OF_DAY, CLOCKHOUR_OF_DAY.getType());
        assertEquals(1, CLOCKHOUR_OF_DAY.getMinimumValue());
        assertEquals(1, CLOCKHOUR_OF_DAY.getMinimumValue(0L));
        assertEquals(1, CLOCKHOUR_OF_DAY.getMinimumValue(partial));
        assertEquals(1, CLOCKHOUR_OF_DAY.getMinimumValue(partial, values));
        assertEquals(24, CLOCKHOUR_OF_DAY.getMaximumValue());
        assertEquals(24, CLOCKHOUR_OF_DAY.getMaximumValue(0L));
        assertEquals(24, CLOCKHOUR_OF_DAY.getMaximumValue(partial));
        assertEquals(24, CLOCKHOUR_OF_DAY.getMaximumValue(partial, values));

        ZeroIsMaxDateTimeField clockhourOfHalfday =
            new ZeroIsMaxDateTimeField(HOUR_OF_HALFDAY, DateTimeFieldType.CLOCKHOUR_OF_HALFDAY);
        assertEquals(12, clockhourOfHalfday.getMaximumValue());
        assertEquals(12, clockhourOfHalfday.get(instant(2001, 1, 1, 12, 0, 0, 0)));
    }

    @Test
    public void testArithmeticUsesWrappedField()
    {
        long lateEvening = instant(2001, 1, 1, 23, 30, 0, 0);
        assertEquals(instant(2001, 1, 2, 0, 30, 0, 0), CLOCKHOUR_OF_DAY.add(lateEvening, 1));
        assertEquals(instant(2001, 1, 1, 0, 30, 0, 0), CLOCKHOUR_OF_DAY.addWrapField(lateEvening, 1));
        assertEquals(2, CLOCKHOUR_OF_DAY.getDifference(lateEvening, instant(2001, 1, 1, 21, 0, 0, 0)));
        assertEquals(instant(2001, 1, 1, 23, 0, 0, 0), CLOCKHOUR_OF_DAY.roundFloor(lateEvening));
        assertSame(HOUR_OF_DAY.getDurationField(), CLOCKHOUR_OF_DAY.getDurationField());
        assertSame(HOUR_OF_DAY, CLOCKHOUR_OF_DAY.getWrappedField());
    }

    @ParameterizedTest
    @CsvSource({
        "23,   1, 24",
        "24,   1,  1",
        "23,   2,  1",
        " 1,  -1, 24",
        " 5, -29, 24",
    })
    public void testPartialAddWrapFieldStaysInClockhours(int clockhour, int amount, int expected)
    {
        ReadablePartial partial = new TestPartial(CLOCKHOUR_OF_DAY);
        int[] result = CLOCKHOUR_OF_DAY.addWrapField(partial, 0, new int[] { clockhour }, amount);
        assertArrayEquals(new int[] { expected }, result);
    }

    @Test
    public void testPartialSetAndAdd()
    {
        ReadablePartial partial = new TestPartial(CLOCKHOUR_OF_DAY);
        assertArrayEquals(new int[] { 24 }, CLOCKHOUR_OF_DAY.set(partial, 0, new int[] { 5 }, 24));
        assertThrows(IllegalFieldValueException.class,
                     () -> CLOCKHOUR_OF_DAY.set(partial, 0, new int[] { 5 }, 0));
        assertArrayEquals(new int[] { 24 },
                          CLOCKHOUR_OF_DAY.addWrapPartial(partial, 0, new int[] { 23 }, 1));
        assertArrayEquals(new int[] { 2 },
                          CLOCKHOUR_OF_DAY.addWrapPartial(partial, 0, new int[] { 23 }, 3));
    }
}
