// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import static com.amazon.chrono.field.DividedDateTimeField.checkWrapped;
import static com.amazon.chrono.field.DividedDateTimeField.floorDivide;
import static com.amazon.chrono.field.DividedDateTimeField.floorRemainder;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;


/**
 * Counts the value of another field modulo a fixed divisor, such as
 * year-of-century from year-of-era with a divisor of 100.
 * <p>
 * Values run from zero to {@code divisor - 1}, also for negative values of
 * the wrapped field: with a divisor of 100, year -43 has year-of-century 57.
 * Together with the {@link DividedDateTimeField} of the same divisor,
 * {@code divided * divisor + remainder} always equals the wrapped value.
 * Setting a value keeps the divided part of the wrapped field.
 */
public final class RemainderDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;
    private final DateTimeFieldType myType;
    // Shared with a DividedDateTimeField built from this one.
    final int myDivisor;
    final DurationField myRangeField;
    private final DurationField myDurationField;


    /**
     * Constructor.
     *
     * @param field the field to wrap; must be supported.
     * @param type the field type this field will actually use.
     * @param divisor divisor, such as 100 years in a century.
     *
     * @throws IllegalArgumentException if divisor is less than two, or the
     * type has no range unit to scale.
     */
    public RemainderDateTimeField(DateTimeField field,
                                  DateTimeFieldType type, int divisor)
    {
        checkWrapped(field, type);
        if (divisor < 2)
        {
            throw new IllegalArgumentException("The divisor must be at least 2");
        }

        DurationField unitField = field.getDurationField();
        if (unitField == null)
        {
            myRangeField = null;
        }
        else
        {
            myRangeField = new ScaledDurationField(unitField, type.getRangeDurationType(), divisor);
        }

        myField = field;
        myType = type;
        myDurationField = unitField;
        myDivisor = divisor;
    }

    /**
     * Constructor.
     *
     * @param field the field to wrap; must be supported.
     * @param rangeField the range field.
     * @param type the field type this field will actually use.
     * @param divisor divisor, such as 100 years in a century.
     *
     * @throws IllegalArgumentException if divisor is less than two.
     */
    public RemainderDateTimeField(DateTimeField field, DurationField rangeField,
                                  DateTimeFieldType type, int divisor)
    {
        checkWrapped(field, type);
        if (divisor < 2)
        {
            throw new IllegalArgumentException("The divisor must be at least 2");
        }

        myField = field;
        myType = type;
        myRangeField = rangeField;
        myDurationField = field.getDurationField();
        myDivisor = divisor;
    }

    /**
     * Construct a RemainderDateTimeField that complements the given
     * DividedDateTimeField.
     *
     * @param dividedField complimentary divided field, like "century()".
     */
    public RemainderDateTimeField(DividedDateTimeField dividedField)
    {
        this(dividedField, dividedField.getType());
    }

    /**
     * Construct a RemainderDateTimeField that complements the given
     * DividedDateTimeField.
     *
     * @param dividedField complimentary divided field, like "century()".
     * @param type the field type this field will actually use.
     */
    public RemainderDateTimeField(DividedDateTimeField dividedField,
                                  DateTimeFieldType type)
    {
        this(dividedField, dividedField.getWrappedField().getDurationField(), type);
    }

    /**
     * Construct a RemainderDateTimeField that complements the given
     * DividedDateTimeField. This field's range is the divided field's unit.
     *
     * @param dividedField complimentary divided field, like "century()".
     * @param durationField the duration field.
     * @param type the field type this field will actually use.
     */
    public RemainderDateTimeField(DividedDateTimeField dividedField,
                                  DurationField durationField,
                                  DateTimeFieldType type)
    {
        DateTimeField field = dividedField.getWrappedField();
        checkWrapped(field, type);

        myField = field;
        myType = type;
        myDivisor = dividedField.myDivisor;
        myDurationField = durationField;
        myRangeField = dividedField.myDurationField;
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
     * Get the remainder from the specified time instant.
     *
     * @param instant the time instant in millis to query.
     * @return the remainder extracted from the input.
     */
    public int get(long instant)
    {
        return floorRemainder(myField.get(instant), myDivisor);
    }

    /**
     * Add the specified amount to the specified time instant, wrapping
     * around within the remainder range if necessary. The amount added may
     * be negative.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount to add (can be negative).
     * @return the updated time instant.
     */
    @Override
    public long addWrapField(long instant, int amount)
    {
        return set(instant, FieldUtils.getWrappedValue(get(instant), amount, 0, myDivisor - 1));
    }

    /**
     * Set the specified amount of remainder units to the specified time
     * instant.
     *
     * @param instant the time instant in millis to update.
     * @param value value of remainder units to set.
     * @return the updated time instant.
     * @throws com.amazon.chrono.IllegalFieldValueException if value is too
     * large or too small.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, 0, myDivisor - 1);
        int divided = floorDivide(myField.get(instant), myDivisor);
        return myField.set(instant, divided * myDivisor + value);
    }

    public DurationField getDurationField()
    {
        return myDurationField;
    }

    /**
     * Returns a scaled version of the wrapped field's unit duration field.
     */
    public DurationField getRangeDurationField()
    {
        return myRangeField;
    }

    /**
     * Get the minimum value for the field, which is always zero.
     *
     * @return the minimum value of zero.
     */
    public int getMinimumValue()
    {
        return 0;
    }

    /**
     * Get the maximum value for the field, which is always one less than the
     * divisor.
     *
     * @return the maximum value
     */
    public int getMaximumValue()
    {
        return myDivisor - 1;
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
     * Returns the divisor applied, in the field's units.
     *
     * @return the divisor
     */
    public int getDivisor()
    {
        return myDivisor;
    }

    /**
     * Gets the field being divided.
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
