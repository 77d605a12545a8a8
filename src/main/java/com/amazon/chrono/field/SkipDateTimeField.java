// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.IllegalFieldValueException;
import com.amazon.chrono.ReadablePartial;


/**
 * Omits one value from the sequence of another field, typically zero, so
 * that a proleptic year sequence {@code ..., -1, 0, 1, ...} becomes the
 * historical {@code ..., -2, -1, 1, 2, ...} with no year zero.
 * <p>
 * Wrapped values at or below the skipped value are reported one lower.
 * The skipped value itself is never reported and cannot be set.
 * {@link SkipUndoDateTimeField} reverses this transformation.
 * <p>
 * Partial arithmetic runs in the wrapped field's sequence; the value at the
 * field's own index is translated on the way in and out.
 */
public final class SkipDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;

    /** The value to skip. */
    private final int mySkip;

    /** The calculated minimum value. */
    private final int myMinValue;


    /**
     * Constructor that skips zero.
     *
     * @param field the field to use
     */
    public SkipDateTimeField(DateTimeField field)
    {
        this(field, 0);
    }

    /**
     * Constructor.
     *
     * @param field the field to use
     * @param skip the value to skip
     */
    public SkipDateTimeField(DateTimeField field, int skip)
    {
        if (field == null)
        {
            throw new IllegalArgumentException("The field must not be null");
        }
        if (!field.isSupported())
        {
            throw new IllegalArgumentException("The field must be supported");
        }
        myField = field;

        int min = field.getMinimumValue();
        if (min < skip)
        {
            myMinValue = min - 1;
        }
        else if (min == skip)
        {
            myMinValue = skip + 1;
        }
        else
        {
            myMinValue = min;
        }
        mySkip = skip;
    }


    //=========================================================================

    public DateTimeFieldType getType()
    {
        return myField.getType();
    }

    @Override
    public boolean isLenient()
    {
        return myField.isLenient();
    }

    public int get(long instant)
    {
        int value = myField.get(instant);
        if (value <= mySkip)
        {
            value--;
        }
        return value;
    }

    /**
     * @throws IllegalFieldValueException if the value is out of bounds or
     * is the skipped value.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, myMinValue, getMaximumValue());
        if (value <= mySkip)
        {
            if (value == mySkip)
            {
                throw new IllegalFieldValueException(getType(), Integer.valueOf(value),
                                                     "the value " + mySkip + " is skipped");
            }
            value++;
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

    /**
     * Adds in the wrapped field's unbroken sequence, so that stepping past
     * the skipped value moves straight to its neighbour.
     */
    @Override
    public int[] add(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        values[fieldIndex] = toWrapped(values[fieldIndex]);
        try
        {
            return myField.add(partial, fieldIndex, values, valueToAdd);
        }
        finally
        {
            values[fieldIndex] = fromWrapped(values[fieldIndex]);
        }
    }

    @Override
    public int[] addWrapPartial(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        values[fieldIndex] = toWrapped(values[fieldIndex]);
        try
        {
            return myField.addWrapPartial(partial, fieldIndex, values, valueToAdd);
        }
        finally
        {
            values[fieldIndex] = fromWrapped(values[fieldIndex]);
        }
    }

    @Override
    public long addWrapField(long instant, int value)
    {
        return myField.addWrapField(instant, value);
    }

    @Override
    public int[] addWrapField(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        int wrapped = FieldUtils.getWrappedValue(toWrapped(values[fieldIndex]), valueToAdd,
                                                 toWrapped(getMinimumValue(partial)),
                                                 myField.getMaximumValue(partial));
        return set(partial, fieldIndex, values, fromWrapped(wrapped));
    }

    /**
     * @throws IllegalFieldValueException if the value is out of bounds or
     * is the skipped value.
     */
    @Override
    public int[] set(ReadablePartial partial, int fieldIndex, int[] values, int newValue)
    {
        FieldUtils.verifyValueBounds(this, newValue,
                                     getMinimumValue(partial, values),
                                     getMaximumValue(partial, values));
        if (newValue == mySkip)
        {
            throw new IllegalFieldValueException(getType(), Integer.valueOf(newValue),
                                                 "the value " + mySkip + " is skipped");
        }
        int[] result = myField.set(partial, fieldIndex, values, toWrapped(newValue));
        result[fieldIndex] = newValue;
        return result;
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

    public int getMinimumValue()
    {
        return myMinValue;
    }

    public int getMaximumValue()
    {
        return myField.getMaximumValue();
    }

    @Override
    public int getMaximumValue(long instant)
    {
        return myField.getMaximumValue(instant);
    }

    @Override
    public int getMaximumValue(ReadablePartial partial)
    {
        return myField.getMaximumValue(partial);
    }

    @Override
    public int getMaximumValue(ReadablePartial partial, int[] values)
    {
        return myField.getMaximumValue(partial, values);
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

    private int toWrapped(int value)
    {
        return value < mySkip ? value + 1 : value;
    }

    private int fromWrapped(int value)
    {
        return value <= mySkip ? value - 1 : value;
    }

    /**
     * Gets the value this field never reports.
     */
    public int getSkip()
    {
        return mySkip;
    }

    /**
     * Gets the field whose sequence is being altered.
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
