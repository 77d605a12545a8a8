// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.ReadablePartial;


/**
 * Makes a lenient field strict: {@link #set(long, int)} rejects any value
 * outside the bounds of the field at the given instant. All other
 * operations behave exactly as the wrapped field's.
 */
public final class StrictDateTimeField
    implements DateTimeField
{
    /**
     * Returns a strict version of the given field. Fields that are already
     * strict, and null, are returned unchanged.
     *
     * @param field the field to wrap, may be null
     * @return a strict field, or null if {@code field} is null
     */
    public static DateTimeField getInstance(DateTimeField field)
    {
        if (field == null)
        {
            return null;
        }
        if (!field.isLenient())
        {
            return field;
        }
        return new StrictDateTimeField(field);
    }


    //=========================================================================

    private final DateTimeField myField;

    private StrictDateTimeField(DateTimeField field)
    {
        myField = field;
    }

    public DateTimeFieldType getType()
    {
        return myField.getType();
    }

    @Override
    public boolean isSupported()
    {
        return myField.isSupported();
    }

    /**
     * @return false always
     */
    @Override
    public boolean isLenient()
    {
        return false;
    }

    public int get(long instant)
    {
        return myField.get(instant);
    }

    /**
     * Does a bounds check before setting the value.
     *
     * @throws com.amazon.chrono.IllegalFieldValueException if the value is
     * invalid for the field at the instant.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value,
                                     getMinimumValue(instant), getMaximumValue(instant));
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
    public int[] add(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return myField.add(partial, fieldIndex, values, valueToAdd);
    }

    @Override
    public int[] addWrapPartial(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return myField.addWrapPartial(partial, fieldIndex, values, valueToAdd);
    }

    @Override
    public long addWrapField(long instant, int value)
    {
        return myField.addWrapField(instant, value);
    }

    @Override
    public int[] addWrapField(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return myField.addWrapField(partial, fieldIndex, values, valueToAdd);
    }

    @Override
    public int[] set(ReadablePartial partial, int fieldIndex, int[] values, int newValue)
    {
        return myField.set(partial, fieldIndex, values, newValue);
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
        return myField.getMinimumValue();
    }

    @Override
    public int getMinimumValue(long instant)
    {
        return myField.getMinimumValue(instant);
    }

    @Override
    public int getMinimumValue(ReadablePartial partial)
    {
        return myField.getMinimumValue(partial);
    }

    @Override
    public int getMinimumValue(ReadablePartial partial, int[] values)
    {
        return myField.getMinimumValue(partial, values);
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
     * Gets the field whose bounds checking has been altered.
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
