// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;


/**
 * The precise duration field of one millisecond, for which every conversion
 * is the identity. Use the shared {@link #INSTANCE}.
 */
public final class MillisDurationField
    implements DurationField
{
    /** Singleton instance. */
    public static final DurationField INSTANCE = new MillisDurationField();

    private MillisDurationField() { }

    public DurationFieldType getType()
    {
        return DurationFieldType.MILLIS;
    }

    public boolean isPrecise()
    {
        return true;
    }

    public long getUnitMillis()
    {
        return 1;
    }

    @Override
    public int getValue(long duration)
    {
        return FieldUtils.safeToInt(duration);
    }

    @Override
    public long getValueAsLong(long duration)
    {
        return duration;
    }

    @Override
    public int getValue(long duration, long instant)
    {
        return FieldUtils.safeToInt(duration);
    }

    public long getValueAsLong(long duration, long instant)
    {
        return duration;
    }

    @Override
    public long getMillis(int value)
    {
        return value;
    }

    @Override
    public long getMillis(long value)
    {
        return value;
    }

    public long getMillis(int value, long instant)
    {
        return value;
    }

    public long getMillis(long value, long instant)
    {
        return value;
    }

    public long add(long instant, int value)
    {
        return FieldUtils.safeAdd(instant, value);
    }

    public long add(long instant, long value)
    {
        return FieldUtils.safeAdd(instant, value);
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return FieldUtils.safeToInt(FieldUtils.safeSubtract(minuendInstant, subtrahendInstant));
    }

    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return FieldUtils.safeSubtract(minuendInstant, subtrahendInstant);
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof MillisDurationField;
    }

    @Override
    public int hashCode()
    {
        return (int) getUnitMillis();
    }

    @Override
    public String toString()
    {
        return "DurationField[millis]";
    }
}
