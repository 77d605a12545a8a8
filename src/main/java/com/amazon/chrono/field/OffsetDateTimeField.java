// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.field.DividedDateTimeField.checkWrapped;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;


/**
 * Shifts the values of another field by a constant, such as a Buddhist
 * year that is 543 more than the Gregorian one.
 * <p>
 * The bounds are the wrapped field's bounds plus the offset, optionally
 * narrowed further by the caller. Rounding and leap queries go straight to
 * the wrapped field.
 */
public final class OffsetDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;
    private final DateTimeFieldType myType;
    private final int myOffset;

    private final int myMin;
    private final int myMax;


    /**
     * Constructor.
     *
     * @param field the field to wrap, like "year()".
     * @param offset offset to add to field values
     * @throws IllegalArgumentException if offset is zero
     */
    public OffsetDateTimeField(DateTimeField field, int offset)
    {
        this(field, (field == null ? null : field.getType()), offset,
             Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Constructor.
     *
     * @param field the field to wrap, like "year()".
     * @param type the field type this field actually uses
     * @param offset offset to add to field values
     * @throws IllegalArgumentException if offset is zero
     */
    public OffsetDateTimeField(DateTimeField field, DateTimeFieldType type, int offset)
    {
        this(field, type, offset, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Constructor.
     *
     * @param field the field to wrap, like "year()".
     * @param type the field type this field actually uses
     * @param offset offset to add to field values
     * @param minValue minimum allowed value
     * @param maxValue maximum allowed value
     * @throws IllegalArgumentException if offset is zero, or the limits leave
     * no value in range
     */
    public OffsetDateTimeField(DateTimeField field, DateTimeFieldType type, int offset,
                               int minValue, int maxValue)
    {
        checkWrapped(field, type);
        if (offset == 0)
        {
            throw new IllegalArgumentException("The offset cannot be zero");
        }

        myField = field;
        myType = type;
        myOffset = offset;

        long fieldMin = (long) field.getMinimumValue() + offset;
        long fieldMax = (long) field.getMaximumValue() + offset;
        myMin = (int) Math.max(minValue, fieldMin);
        myMax = (int) Math.min(maxValue, fieldMax);

        if (myMin > myMax)
        {
            throw new IllegalArgumentException
                ("The offset bounds are empty: [" + myMin + ',' + myMax + ']');
        }
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

    /**
     * Get the amount of offset units from the specified time instant.
     *
     * @param instant the time instant in millis to query.
     * @return the amount of units extracted from the input.
     */
    public int get(long instant)
    {
        return myField.get(instant) + myOffset;
    }

    /**
     * Add the specified amount of offset units to the specified time
     * instant. The amount added may be negative.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of units to add (can be negative).
     * @return the updated time instant.
     * @throws com.amazon.chrono.IllegalFieldValueException if the result
     * leaves the bounds of this field.
     */
    @Override
    public long add(long instant, int amount)
    {
        instant = myField.add(instant, amount);
        FieldUtils.verifyValueBounds(this, get(instant), myMin, myMax);
        return instant;
    }

    /**
     * Add the specified amount of offset units to the specified time
     * instant. The amount added may be negative.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of units to add (can be negative).
     * @return the updated time instant.
     * @throws com.amazon.chrono.IllegalFieldValueException if the result
     * leaves the bounds of this field.
     */
    @Override
    public long add(long instant, long amount)
    {
        instant = myField.add(instant, amount);
        FieldUtils.verifyValueBounds(this, get(instant), myMin, myMax);
        return instant;
    }

    /**
     * Add to the offset component of the specified time instant,
     * wrapping around within that component if necessary.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of units to add (can be negative).
     * @return the updated time instant.
     */
    @Override
    public long addWrapField(long instant, int amount)
    {
        return set(instant, FieldUtils.getWrappedValue(get(instant), amount, myMin, myMax));
    }

    /**
     * Set the specified amount of offset units to the specified time instant.
     *
     * @param instant the time instant in millis to update.
     * @param value value of units to set.
     * @return the updated time instant.
     * @throws com.amazon.chrono.IllegalFieldValueException if value is too
     * large or too small.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, myMin, myMax);
        return myField.set(instant, value - myOffset);
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
     * Get the minimum value for the field.
     *
     * @return the minimum value
     */
    public int getMinimumValue()
    {
        return myMin;
    }

    /**
     * Get the maximum value for the field.
     *
     * @return the maximum value
     */
    public int getMaximumValue()
    {
        return myMax;
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
     * Returns the offset added to the field values.
     *
     * @return the offset
     */
    public int getOffset()
    {
        return myOffset;
    }

    /**
     * Gets the field being offset.
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
