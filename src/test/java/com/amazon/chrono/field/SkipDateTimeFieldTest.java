// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.TestCalendar.HOUR_OF_DAY;
import static com.amazon.chrono.TestCalendar.MONTH_OF_YEAR;
import static com.amazon.chrono.TestCalendar.YEAR;
import static com.amazon.chrono.TestCalendar.instant;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazon.chrono.IllegalFieldValueException;
import com.amazon.chrono.IncompatibleFieldsException;
import com.amazon.chrono.ReadablePartial;
import com.amazon.chrono.TestPartial;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class SkipDateTimeFieldTest
{
    private static final SkipDateTimeField NO_YEAR_ZERO = new SkipDateTimeField(YEAR);

    private static final ReadablePartial YEAR_MONTH = new TestPartial(NO_YEAR_ZERO, MONTH_OF_YEAR);

    @ParameterizedTest
    @CsvSource({
        "  2,  2",
        "  1,  1",
        "  0, -1",
        " -1, -2",
        "-43, -44",
    })
    public void testValuesBelowSkipShiftDown(int prolepticYear, int historicalYear)
    {
        long instant = instant(prolepticYear, 3, 1);
        assertEquals(historicalYear, NO_YEAR_ZERO.get(instant));
        assertEquals(instant, NO_YEAR_ZERO.set(instant(1999, 3, 1), historicalYear));
    }

    @Test
    public void testSkippedValueCannotBeSet()
    {
        IllegalFieldValueException e =
            assertThrows(IllegalFieldValueException.class,
                         () -> NO_YEAR_ZERO.set(instant(2001, 1, 1), 0));
        assertThat(e.getMessage(), containsString("the value 0 is skipped"));
        assertEquals(0, e.getIllegalNumberValue().intValue());
    }

    @Test
    public void testMinimumValue()
    {
        assertEquals(YEAR.getMinimumValue() - 1, NO_YEAR_ZERO.getMinimumValue());
        assertEquals(YEAR.getMinimumValue() - 1, NO_YEAR_ZERO.getMinimumValue(instant(2001, 1, 1)));
        assertEquals(YEAR.getMaximumValue(), NO_YEAR_ZERO.getMaximumValue());
        assertEquals(0, NO_YEAR_ZERO.getSkip());

        // when the wrapped minimum is the skipped value, the next value up is the minimum
        assertEquals(1, new SkipDateTimeField(HOUR_OF_DAY).getMinimumValue());
        assertEquals(0, new SkipDateTimeField(HOUR_OF_DAY, -1).getMinimumValue());
    }

    @Test
    public void testBoundsChecked()
    {
        assertThrows(IllegalFieldValueException.class,
                     () -> NO_YEAR_ZERO.set(instant(2001, 1, 1), YEAR.getMinimumValue() - 2));
        assertEquals(instant(YEAR.getMinimumValue(), 1, 1),
                     NO_YEAR_ZERO.set(instant(2001, 1, 1), YEAR.getMinimumValue() - 1));
    }

    @Test
    public void testArithmeticUsesWrappedField()
    {
        // one year after 1 BC is 1 AD, but the wrapped field counts the skipped year
        assertEquals(instant(1, 3, 1), NO_YEAR_ZERO.add(instant(0, 3, 1), 1));
        assertEquals(2, NO_YEAR_ZERO.getDifference(instant(1, 3, 1), instant(-1, 3, 1)));
        assertEquals(instant(2001, 1, 1), NO_YEAR_ZERO.roundFloor(instant(2001, 3, 1)));
    }

    @Test
    public void testSkipUndoReversesSkip()
    {
        SkipUndoDateTimeField proleptic = new SkipUndoDateTimeField(NO_YEAR_ZERO);
        assertEquals(YEAR.getMinimumValue(), proleptic.getMinimumValue());
        for (int year = -5; year <= 5; year++)
        {
            long instant = instant(year, 7, 4);
            assertEquals(year, proleptic.get(instant));
            assertEquals(instant, proleptic.set(instant(1999, 7, 4), year));
        }
    }

    @Test
    public void testPartialSetRejectsSkippedValue()
    {
        assertThrows(IllegalFieldValueException.class,
                     () -> NO_YEAR_ZERO.set(YEAR_MONTH, 0, new int[] { -1, 1 }, 0));
        assertThrows(IllegalFieldValueException.class,
                     () -> NO_YEAR_ZERO.set(YEAR_MONTH, 0, new int[] { -1, 1 }, YEAR.getMinimumValue() - 2));
        assertArrayEquals(new int[] { -1, 6 },
                          NO_YEAR_ZERO.set(YEAR_MONTH, 0, new int[] { 5, 6 }, -1));
        assertArrayEquals(new int[] { YEAR.getMinimumValue() - 1, 6 },
                          NO_YEAR_ZERO.set(YEAR_MONTH, 0, new int[] { 5, 6 }, YEAR.getMinimumValue() - 1));
    }

    @ParameterizedTest
    @CsvSource({
        "-1,  1,  1",
        " 1, -1, -1",
        "-2,  3,  2",
        " 2, -3, -2",
        " 5,  4,  9",
    })
    public void testPartialAddStepsOverSkippedValue(int year, int amount, int expected)
    {
        assertArrayEquals(new int[] { expected, 6 },
                          NO_YEAR_ZERO.add(YEAR_MONTH, 0, new int[] { year, 6 }, amount));
    }

    @Test
    public void testPartialCarryIntoSkipField()
    {
        assertArrayEquals(new int[] { 1, 1 },
                          MONTH_OF_YEAR.add(YEAR_MONTH, 1, new int[] { -1, 12 }, 1));
        assertArrayEquals(new int[] { -1, 12 },
                          MONTH_OF_YEAR.add(YEAR_MONTH, 1, new int[] { 1, 1 }, -1));
    }

    @Test
    public void testPartialAddPastMaximum()
    {
        int[] values = { YEAR.getMaximumValue(), 6 };
        assertThrows(IncompatibleFieldsException.class,
                     () -> NO_YEAR_ZERO.add(YEAR_MONTH, 0, values, 1));
        assertArrayEquals(new int[] { YEAR.getMaximumValue(), 6 }, values);

        assertArrayEquals(new int[] { YEAR.getMinimumValue() - 1, 6 },
                          NO_YEAR_ZERO.addWrapPartial(YEAR_MONTH, 0, new int[] { YEAR.getMaximumValue(), 6 }, 1));
    }

    @Test
    public void testPartialAddWrapField()
    {
        assertArrayEquals(new int[] { 1, 6 },
                          NO_YEAR_ZERO.addWrapField(YEAR_MONTH, 0, new int[] { -1, 6 }, 1));
        assertArrayEquals(new int[] { -1, 6 },
                          NO_YEAR_ZERO.addWrapField(YEAR_MONTH, 0, new int[] { 1, 6 }, -1));
        assertArrayEquals(new int[] { YEAR.getMinimumValue() - 1, 6 },
                          NO_YEAR_ZERO.addWrapField(YEAR_MONTH, 0, new int[] { YEAR.getMaximumValue(), 6 }, 1));
        assertArrayEquals(new int[] { YEAR.getMaximumValue(), 6 },
                          NO_YEAR_ZERO.addWrapField(YEAR_MONTH, 0, new int[] { YEAR.getMinimumValue() - 1, 6 }, -1));
    }
}
