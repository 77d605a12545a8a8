// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.IllegalFieldValueException;
import com.amazon.chrono.ReadablePartial;


/**
 * Re-inserts the value that a {@link SkipDateTimeField} omits, turning a
 * sequence with no year zero back into a proleptic one: wrapped values below
 * the skipped value are reported one higher.
 * <p>
 * The minimum is derived differently from the skip field's: a wrapped
 * minimum one above the skipped value becomes the skipped value itself.
 * Applied to a skip field with the same skipped value, this field
 * reproduces the input sequence.
 * <p>
 * The restored sequence has no gap, so partial arithmetic runs over this
 * field's own bounds.
 */
public final class SkipUndoDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;

    /** The value to restore. */
    private final int mySkip;

    /** The calculated minimum value. */
    private final int myMinValue;


    /**
     * Constructor that restores zero.
     *
     * @param field the field to use
     */
    public SkipUndoDateTimeField(DateTimeField field)
    {
        this(field, 0);
    }

    /**
     * Constructor.
     *
     * @param field the field to use
     * @param skip the value to restore
     */
    public SkipUndoDateTimeField(DateTimeField field, int skip)
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
            myMinValue = min + 1;
        }
        else if (min == skip + 1)
        {
            myMinValue = skip;
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
        if (value < mySkip)
        {
            value++;
        }
        return value;
    }

    /**
     * @throws IllegalFieldValueException if the value is out of bounds.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, myMinValue, getMaximumValue());
        if (value <= mySkip)
        {
            value--;
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

    /**
     * Gets the value this field restores.
     */
    public int getSkip()
    {
        return mySkip;
    }

    /**
     * Gets the field whose sequence is being restored.
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
