// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;


/**
 * Base for calendar fields whose unit has a fixed length, such as
 * day-of-month (days) or second-of-minute (seconds).
 * <p>
 * Provides {@link #set(long, int)} by moving the instant a whole number of
 * units, and rounding that assumes unit boundaries are aligned to the epoch.
 * Subclasses supply {@link #get(long)}, the maximum value and the range
 * duration field. The minimum value is zero unless overridden.
 */
public abstract class PreciseDurationDateTimeField
    implements DateTimeField
{
    private final DateTimeFieldType myType;

    /** The fractional unit in millis */
    final long myUnitMillis;

    private final DurationField myUnitField;


    /**
     * @param type the field type this field will actually use.
     * @param unit precise unit duration, like "days()".
     *
     * @throws IllegalArgumentException if the type is null, or the unit is
     * null, imprecise or shorter than one millisecond.
     */
    public PreciseDurationDateTimeField(DateTimeFieldType type, DurationField unit)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }
        if (unit == null || !unit.isPrecise())
        {
            throw new IllegalArgumentException("Unit duration field must be precise");
        }

        myUnitMillis = unit.getUnitMillis();
        if (myUnitMillis < 1)
        {
            throw new IllegalArgumentException("The unit milliseconds must be at least 1");
        }

        myType = type;
        myUnitField = unit;
    }

    public final DateTimeFieldType getType()
    {
        return myType;
    }

    /**
     * Sets the value of this field by moving the instant a whole number of
     * units.
     *
     * @throws com.amazon.chrono.IllegalFieldValueException if the value is
     * out of bounds.
     * @throws ArithmeticException if the result overflows a long.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, getMinimumValue(),
                                     getMaximumValueForSet(instant, value));
        long units = (long) value - get(instant);
        return FieldUtils.safeAdd(instant, FieldUtils.safeMultiply(units, myUnitMillis));
    }

    /**
     * This method assumes that this field is properly rounded on
     * 1970-01-01T00:00:00. If the rounding alignment differs, override this
     * method as follows:
     * <pre>
     * return super.roundFloor(instant + ALIGNMENT_MILLIS) - ALIGNMENT_MILLIS;
     * </pre>
     */
    public long roundFloor(long instant)
    {
        if (instant >= 0)
        {
            return instant - instant % myUnitMillis;
        }
        instant += 1;
        return instant - instant % myUnitMillis - myUnitMillis;
    }

    /**
     * This method assumes that this field is properly rounded on
     * 1970-01-01T00:00:00. If the rounding alignment differs, override this
     * method as follows:
     * <pre>
     * return super.roundCeiling(instant + ALIGNMENT_MILLIS) - ALIGNMENT_MILLIS;
     * </pre>
     */
    @Override
    public long roundCeiling(long instant)
    {
        if (instant > 0)
        {
            instant -= 1;
            return instant - instant % myUnitMillis + myUnitMillis;
        }
        return instant - instant % myUnitMillis;
    }

    /**
     * This method assumes that this field is properly rounded on
     * 1970-01-01T00:00:00. If the rounding alignment differs, override this
     * method as follows:
     * <pre>
     * return super.remainder(instant + ALIGNMENT_MILLIS);
     * </pre>
     */
    @Override
    public long remainder(long instant)
    {
        if (instant >= 0)
        {
            return instant % myUnitMillis;
        }
        return (instant + 1) % myUnitMillis + myUnitMillis - 1;
    }

    /**
     * Returns the duration per unit value of this field. For example, if this
     * field represents "minute of hour", then the duration field is minutes.
     */
    public DurationField getDurationField()
    {
        return myUnitField;
    }

    /**
     * Get the minimum value for the field.
     *
     * @return the minimum value, zero unless overridden
     */
    public int getMinimumValue()
    {
        return 0;
    }

    public final long getUnitMillis()
    {
        return myUnitMillis;
    }

    /**
     * Called by the set method to get the maximum allowed value. By default,
     * returns getMaximumValue(instant). Override to provide a faster
     * implementation.
     */
    protected int getMaximumValueForSet(long instant, int value)
    {
        return getMaximumValue(instant);
    }

    @Override
    public String toString()
    {
        return "DateTimeField[" + getName() + ']';
    }
}
