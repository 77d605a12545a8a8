// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;


/**
 * A duration field with a fixed unit length in milliseconds, such as hours
 * or days in a calendar without daylight-saving transitions.
 */
public final class PreciseDurationField
    implements DurationField
{
    private final DurationFieldType myType;
    private final long myUnitMillis;


    /**
     * @param type the type this field represents; must not be null.
     * @param unitMillis the length of one unit in milliseconds; at least 1.
     *
     * @throws IllegalArgumentException if {@code type} is null or
     * {@code unitMillis} is less than 1.
     */
    public PreciseDurationField(DurationFieldType type, long unitMillis)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }
        if (unitMillis < 1)
        {
            throw new IllegalArgumentException("The unit milliseconds must be at least 1");
        }
        myType = type;
        myUnitMillis = unitMillis;
    }

    public DurationFieldType getType()
    {
        return myType;
    }

    public boolean isPrecise()
    {
        return true;
    }

    public long getUnitMillis()
    {
        return myUnitMillis;
    }

    public long getValueAsLong(long duration, long instant)
    {
        return duration / myUnitMillis;  // safe
    }

    public long getMillis(int value, long instant)
    {
        return FieldUtils.safeMultiply(myUnitMillis, value);
    }

    public long getMillis(long value, long instant)
    {
        return FieldUtils.safeMultiply(value, myUnitMillis);
    }

    public long add(long instant, int value)
    {
        long addition = FieldUtils.safeMultiply(myUnitMillis, value);
        return FieldUtils.safeAdd(instant, addition);
    }

    public long add(long instant, long value)
    {
        long addition = FieldUtils.safeMultiply(value, myUnitMillis);
        return FieldUtils.safeAdd(instant, addition);
    }

    /**
     * Rounds toward zero, so the result has the sign of the difference.
     */
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        long difference = FieldUtils.safeSubtract(minuendInstant, subtrahendInstant);
        return difference / myUnitMillis;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }
        if (obj instanceof PreciseDurationField)
        {
            PreciseDurationField other = (PreciseDurationField) obj;
            return (myType.equals(other.myType)) && (myUnitMillis == other.myUnitMillis);
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        long millis = myUnitMillis;
        int hash = (int) (millis ^ (millis >>> 32));
        hash += myType.hashCode();
        return hash;
    }

    @Override
    public String toString()
    {
        return "DurationField[" + getName() + ']';
    }
}
