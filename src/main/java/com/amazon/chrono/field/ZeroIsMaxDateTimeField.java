// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.field.DividedDateTimeField.checkWrapped;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.ReadablePartial;


/**
 * Reports the zero value of another field as one more than its maximum,
 * such as clock-hour-of-day (1 to 24) from hour-of-day (0 to 23).
 * <p>
 * The wrapped field must have a minimum of zero. This field's minimum is 1
 * and its maximum is the wrapped maximum plus 1. Setting the maximum stores
 * zero in the wrapped field. Instant arithmetic, rounding and leap queries
 * go straight to the wrapped field; partial arithmetic runs over this
 * field's own bounds.
 */
public final class ZeroIsMaxDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;
    private final DateTimeFieldType myType;


    /**
     * Constructor.
     *
     * @param field the base field
     * @param type the field type this field will actually use
     * @throws IllegalArgumentException if wrapped field's minimum value is
     * not zero
     */
    public ZeroIsMaxDateTimeField(DateTimeField field, DateTimeFieldType type)
    {
        checkWrapped(field, type);
        if (field.getMinimumValue() != 0)
        {
            throw new IllegalArgumentException("Wrapped field's minumum value must be zero");
        }
        myField = field;
        myType = type;
    }


    //=========================================================================

    public DateTimeFieldType getType()
    {
        return myType;
    }

    @Override
    public boolean isLenient()
    {
        return myField.isLenient();
    }

    public int get(long instant)
    {
        int value = myField.get(instant);
        if (value == 0)
        {
            value = getMaximumValue();
        }
        return value;
    }

    /**
     * @throws com.amazon.chrono.IllegalFieldValueException if the value is
     * not in {@code [1, max]}.
     */
    public long set(long instant, int value)
    {
        int max = getMaximumValue();
        FieldUtils.verifyValueBounds(this, value, 1, max);
        if (value == max)
        {
            value = 0;
        }
        return myField.set(instant, value);
    }

    @Override
    public long add(long instant, int value)
    {
        return myField.add(instant, value);
    }

    @Override
    public long add(long instant, long value)
    {
        return myField.add(instant, value);
    }

    @Override
    public long addWrapField(long instant, int value)
    {
        return myField.addWrapField(instant, value);
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifference(minuendInstant, subtrahendInstant);
    }

    @Override
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifferenceAsLong(minuendInstant, subtrahendInstant);
    }

    public DurationField getDurationField()
    {
        return myField.getDurationField();
    }

    public DurationField getRangeDurationField()
    {
        return myField.getRangeDurationField();
    }

    @Override
    public boolean isLeap(long instant)
    {
        return myField.isLeap(instant);
    }

    @Override
    public int getLeapAmount(long instant)
    {
        return myField.getLeapAmount(instant);
    }

    @Override
    public DurationField getLeapDurationField()
    {
        return myField.getLeapDurationField();
    }

    /**
     * Always returns 1.
     *
     * @return the minimum value of 1
     */
    public int getMinimumValue()
    {
        return 1;
    }

    @Override
    public int getMinimumValue(long instant)
    {
        return 1;
    }

    @Override
    public int getMinimumValue(ReadablePartial partial)
    {
        return 1;
    }

    @Override
    public int getMinimumValue(ReadablePartial partial, int[] values)
    {
        return 1;
    }

    /**
     * Get the maximum value for the field, which is one more than the wrapped
     * field's maximum value.
     *
     * @return the maximum value
     */
    public int getMaximumValue()
    {
        return myField.getMaximumValue() + 1;
    }

    @Override
    public int getMaximumValue(long instant)
    {
        return myField.getMaximumValue(instant) + 1;
    }

    @Override
    public int getMaximumValue(ReadablePartial partial)
    {
        return myField.getMaximumValue(partial) + 1;
    }

    @Override
    public int getMaximumValue(ReadablePartial partial, int[] values)
    {
        return myField.getMaximumValue(partial, values) + 1;
    }

    public long roundFloor(long instant)
    {
        return myField.roundFloor(instant);
    }

    @Override
    public long roundCeiling(long instant)
    {
        return myField.roundCeiling(instant);
    }

    @Override
    public long roundHalfFloor(long instant)
    {
        return myField.roundHalfFloor(instant);
    }

    @Override
    public long roundHalfCeiling(long instant)
    {
        return myField.roundHalfCeiling(instant);
    }

    @Override
    public long roundHalfEven(long instant)
    {
        return myField.roundHalfEven(instant);
    }

    @Override
    public long remainder(long instant)
    {
        return myField.remainder(instant);
    }

    /**
     * Gets the field whose zero is reported as the maximum.
     */
    public DateTimeField getWrappedField()
    {
        return myField;
    }

    @Override
    public String toString()
    {
        return "DateTimeField[" + getName() + ']';
    }
}
