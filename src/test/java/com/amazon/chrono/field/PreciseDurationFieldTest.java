// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class PreciseDurationFieldTest
{
    private static final DurationField SECONDS =
        new PreciseDurationField(DurationFieldType.SECONDS, 1000L);
    private static final DurationField MINUTES =
        new PreciseDurationField(DurationFieldType.MINUTES, 60000L);

    @ParameterizedTest
    @ValueSource(longs = { 0L, -1L, -1000L })
    public void testConstructorRejectsUnitBelowOne(long unitMillis)
    {
        assertThrows(IllegalArgumentException.class,
                     () -> new PreciseDurationField(DurationFieldType.SECONDS, unitMillis));
    }

    @Test
    public void testConstructorRejectsNullType()
    {
        assertThrows(IllegalArgumentException.class, () -> new PreciseDurationField(null, 1000L));
    }

    @Test
    public void testConversions()
    {
        assertTrue(SECONDS.isPrecise());
        assertTrue(SECONDS.isSupported());
        assertEquals("seconds", SECONDS.getName());
        assertEquals(1000L, SECONDS.getUnitMillis());

        assertEquals(2, SECONDS.getValue(2999L));
        assertEquals(-2, SECONDS.getValue(-2999L));
        assertEquals(2L, SECONDS.getValueAsLong(2999L, 123456789L));
        assertEquals(5000L, SECONDS.getMillis(5));
        assertEquals(-5000L, SECONDS.getMillis(-5L, 0L));
        assertThrows(ArithmeticException.class, () -> SECONDS.getMillis(Long.MAX_VALUE));
        assertThrows(ArithmeticException.class, () -> SECONDS.getValue(Long.MAX_VALUE));
    }

    @Test
    public void testAddAndSubtract()
    {
        assertEquals(4000L, SECONDS.add(1000L, 3));
        assertEquals(-2000L, SECONDS.add(1000L, -3L));
        assertEquals(-2000L, SECONDS.subtract(1000L, 3));
        assertEquals(1000L + 2147483648000L, SECONDS.subtract(1000L, Integer.MIN_VALUE));
        assertThrows(ArithmeticException.class, () -> SECONDS.subtract(0L, Long.MIN_VALUE));
        assertThrows(ArithmeticException.class, () -> SECONDS.add(Long.MAX_VALUE - 999L, 1));
    }

    @Test
    public void testDifferenceTruncatesTowardZero()
    {
        assertEquals(2, SECONDS.getDifference(2999L, 0L));
        assertEquals(-2, SECONDS.getDifference(0L, 2999L));
        assertEquals(0L, MINUTES.getDifferenceAsLong(59999L, 0L));
        assertThrows(ArithmeticException.class,
                     () -> MillisDurationField.INSTANCE.getDifference(Long.MAX_VALUE, 0L));
        assertThrows(ArithmeticException.class,
                     () -> SECONDS.getDifferenceAsLong(Long.MIN_VALUE, 1L));
    }

    @Test
    public void testMillisIsIdentity()
    {
        DurationField millis = MillisDurationField.INSTANCE;
        assertEquals(DurationFieldType.MILLIS, millis.getType());
        assertEquals(1L, millis.getUnitMillis());
        assertEquals(123L, millis.getValueAsLong(123L, 0L));
        assertEquals(123L, millis.getMillis(123L, 0L));
        assertEquals(223L, millis.add(100L, 123));
        assertEquals(-23L, millis.getDifferenceAsLong(100L, 123L));
        assertThrows(ArithmeticException.class, () -> millis.add(Long.MAX_VALUE, 1L));
        assertThrows(ArithmeticException.class, () -> millis.getValue(Integer.MAX_VALUE + 1L));
    }

    @Test
    public void testCompareToOrdersByUnitMillis()
    {
        assertThat(SECONDS.compareTo(MINUTES), lessThan(0));
        assertThat(MINUTES.compareTo(SECONDS), greaterThan(0));
        assertThat(MillisDurationField.INSTANCE.compareTo(SECONDS), lessThan(0));
        assertEquals(0, SECONDS.compareTo(new PreciseDurationField(DurationFieldType.custom("ticks"), 1000L)));
    }

    @Test
    public void testEquality()
    {
        assertEquals(SECONDS, new PreciseDurationField(DurationFieldType.SECONDS, 1000L));
        assertEquals(SECONDS.hashCode(),
                     new PreciseDurationField(DurationFieldType.SECONDS, 1000L).hashCode());
        assertNotEquals(SECONDS, new PreciseDurationField(DurationFieldType.SECONDS, 1001L));
        assertNotEquals(SECONDS, new PreciseDurationField(DurationFieldType.MINUTES, 1000L));
    }
}
