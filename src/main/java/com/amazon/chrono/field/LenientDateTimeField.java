// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.ReadablePartial;
import com.amazon.chrono.ZonedFieldContext;


/**
 * Makes a strict field lenient: {@link #set(long, int)} accepts any value
 * and rolls the excess into larger fields. Setting day-of-month 32 in
 * January yields February 1st.
 * <p>
 * The set is performed as an addition of {@code value - get(instant)} on
 * the local time line of the supplied {@link ZonedFieldContext}, then
 * converted back to UTC. All other operations behave exactly as the wrapped
 * field's.
 */
public final class LenientDateTimeField
    implements DateTimeField
{
    /**
     * Returns a lenient version of the given field. Fields that are already
     * lenient, and null, are returned unchanged.
     *
     * @param field the field to wrap, may be null
     * @param context the calendar supplying local time conversions
     * @return a lenient field, or null if {@code field} is null
     *
     * @throws IllegalArgumentException if a field must be wrapped and
     * {@code context} is null.
     */
    public static DateTimeField getInstance(DateTimeField field, ZonedFieldContext context)
    {
        if (field == null)
        {
            return null;
        }
        if (field.isLenient())
        {
            return field;
        }
        return new LenientDateTimeField(field, context);
    }


    //=========================================================================

    private final DateTimeField myField;
    private final ZonedFieldContext myContext;

    private LenientDateTimeField(DateTimeField field, ZonedFieldContext context)
    {
        if (context == null)
        {
            throw new IllegalArgumentException("The context must not be null");
        }
        myField = field;
        myContext = context;
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
     * @return true always
     */
    @Override
    public boolean isLenient()
    {
        return true;
    }

    public int get(long instant)
    {
        return myField.get(instant);
    }

    /**
     * Sets any value, including one outside the field's bounds, by adding
     * the difference from the current value in local time.
     *
     * @throws ArithmeticException if the adjustment overflows.
     */
    public long set(long instant, int value)
    {
        long localInstant = myContext.convertUTCToLocal(instant);
        long difference = FieldUtils.safeSubtract(value, get(instant));
        localInstant = myContext.getLocalField(getType()).add(localInstant, difference);
        return myContext.convertLocalToUTC(localInstant, false, instant);
    }

    /**
     * Gets the calendar this field resolves local time against.
     */
    public ZonedFieldContext getContext()
    {
        return myContext;
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
