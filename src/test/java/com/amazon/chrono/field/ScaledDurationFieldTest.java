// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.TestCalendar.instant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;
import com.amazon.chrono.TestCalendar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ScaledDurationFieldTest
{
    private static final DurationField HALF_MINUTES =
        new ScaledDurationField(TestCalendar.SECONDS, DurationFieldType.custom("halfMinutes"), 30);

    @ParameterizedTest
    @ValueSource(ints = { 0, 1 })
    public void testConstructorRejectsTrivialScalar(int scalar)
    {
        assertThrows(IllegalArgumentException.class,
                     () -> new ScaledDurationField(TestCalendar.SECONDS, DurationFieldType.MINUTES, scalar));
    }

    @Test
    public void testConstructorRejectsUnsupportedField()
    {
        DurationField unsupported = UnsupportedDurationField.getInstance(DurationFieldType.WEEKS);
        assertThrows(IllegalArgumentException.class,
                     () -> new ScaledDurationField(unsupported, DurationFieldType.WEEKS, 2));
        assertThrows(IllegalArgumentException.class,
                     () -> new ScaledDurationField(null, DurationFieldType.WEEKS, 2));
        assertThrows(IllegalArgumentException.class,
                     () -> new ScaledDurationField(TestCalendar.SECONDS, null, 2));
    }

    @Test
    public void testPreciseScaling()
    {
        assertTrue(HALF_MINUTES.isPrecise());
        assertEquals(30000L, HALF_MINUTES.getUnitMillis());
        assertEquals(2, HALF_MINUTES.getValue(89999L));
        assertEquals(60000L, HALF_MINUTES.getMillis(2));
        assertEquals(90000L, HALF_MINUTES.add(0L, 3));
        assertEquals(-1, HALF_MINUTES.getDifference(0L, 59999L));
        assertEquals(-30000L, HALF_MINUTES.getMillis(-1L, 0L));
    }

    @Test
    public void testNegativeScalarReversesDirection()
    {
        DurationField backwards =
            new ScaledDurationField(TestCalendar.SECONDS, DurationFieldType.custom("backSeconds"), -1);
        assertEquals(-1000L, backwards.add(0L, 1));
        assertEquals(-1000L, backwards.getUnitMillis());
        assertEquals(-3, backwards.getDifference(3000L, 0L));
    }

    @Test
    public void testImpreciseScaling()
    {
        DurationField decades =
            new ScaledDurationField(TestCalendar.YEAR.getDurationField(),
                                    DurationFieldType.custom("decades"), 10);
        assertFalse(decades.isPrecise());
        assertEquals(instant(2020, 2, 29), decades.add(instant(2000, 2, 29), 2));
        assertEquals(1, decades.getDifference(instant(2019, 12, 31), instant(2000, 1, 1)));
        assertEquals(2, decades.getValue(instant(2020, 1, 1) - instant(2000, 1, 1), instant(2000, 1, 1)));
    }

    @Test
    public void testEquality()
    {
        assertSame(TestCalendar.SECONDS, ((ScaledDurationField) HALF_MINUTES).getWrappedField());
        assertEquals(30, ((ScaledDurationField) HALF_MINUTES).getScalar());
        assertEquals(HALF_MINUTES,
                     new ScaledDurationField(TestCalendar.SECONDS, DurationFieldType.custom("halfMinutes"), 30));
        assertNotEquals(HALF_MINUTES,
                        new ScaledDurationField(TestCalendar.SECONDS, DurationFieldType.custom("halfMinutes"), 31));
    }
}
