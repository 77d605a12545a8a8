// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;


/**
 * A calendar field whose unit and range both have fixed lengths, such as
 * hour-of-day (hours within days) or millis-of-second.
 * <p>
 * Its value is the number of whole units since the start of the enclosing
 * range, counting from zero, with ranges aligned to the epoch.
 */
public final class PreciseDateTimeField
    extends PreciseDurationDateTimeField
{
    /** The maximum range in the correct units */
    private final int myRange;

    private final DurationField myRangeField;


    /**
     * @param type the field type this field uses.
     * @param unit precise unit duration, like "seconds()".
     * @param range precise range duration, preferably a multiple of the unit,
     * like "minutes()".
     *
     * @throws IllegalArgumentException if either duration field is imprecise,
     * or the range is smaller than two units.
     */
    public PreciseDateTimeField(DateTimeFieldType type,
                                DurationField unit,
                                DurationField range)
    {
        super(type, unit);

        if (range == null || !range.isPrecise())
        {
            throw new IllegalArgumentException("Range duration field must be precise");
        }

        long rangeMillis = range.getUnitMillis();
        long units = rangeMillis / getUnitMillis();
        if (units < 2 || units > Integer.MAX_VALUE)
        {
            throw new IllegalArgumentException("The effective range must be at least 2");
        }

        myRange = (int) units;
        myRangeField = range;
    }

    public int get(long instant)
    {
        if (instant >= 0)
        {
            return (int) ((instant / getUnitMillis()) % myRange);
        }
        return myRange - 1 + (int) (((instant + 1) / getUnitMillis()) % myRange);
    }

    /**
     * Adds to this field only, moving the instant by whole units so the
     * larger fields are never touched.
     */
    @Override
    public long addWrapField(long instant, int amount)
    {
        int thisValue = get(instant);
        int wrappedValue = FieldUtils.getWrappedValue(thisValue, amount,
                                                      getMinimumValue(), getMaximumValue());
        // copy code from set() to avoid repeat call to get()
        return FieldUtils.safeAdd(instant, (wrappedValue - thisValue) * getUnitMillis());
    }

    public DurationField getRangeDurationField()
    {
        return myRangeField;
    }

    public int getMaximumValue()
    {
        return myRange - 1;
    }

    /**
     * Returns the number of units in the range of this field.
     */
    public int getRange()
    {
        return myRange;
    }
}
