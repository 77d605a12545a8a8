// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;


/**
 * Divides the value of another field by a fixed divisor, such as
 * century-of-era from year-of-era with a divisor of 100.
 * <p>
 * Division floors, so negative values of the wrapped field map to the
 * divided value below them: with a divisor of 100, year -43 is in century
 * -1. Setting a value keeps the wrapped field's remainder, so setting the
 * century of 1969 to 20 gives 2069. The complementary field is
 * {@link RemainderDateTimeField}.
 */
public final class DividedDateTimeField
    implements DateTimeField
{
    private final DateTimeField myField;
    private final DateTimeFieldType myType;
    // Shared with a RemainderDateTimeField built from this one.
    final int myDivisor;
    final DurationField myDurationField;
    private final DurationField myRangeDurationField;

    private final int myMin;
    private final int myMax;


    /**
     * Constructor.
     *
     * @param field the field to wrap; must be supported.
     * @param type the field type this field will actually use.
     * @param divisor divisor, such as 100 years in a century.
     *
     * @throws IllegalArgumentException if divisor is less than two.
     */
    public DividedDateTimeField(DateTimeField field,
                                DateTimeFieldType type, int divisor)
    {
        this(field, field == null ? null : field.getRangeDurationField(), type, divisor);
    }

    /**
     * Constructor.
     *
     * @param field the field to wrap; must be supported.
     * @param rangeField the range field, null to use the wrapped field's.
     * @param type the field type this field will actually use.
     * @param divisor divisor, such as 100 years in a century.
     *
     * @throws IllegalArgumentException if divisor is less than two.
     */
    public DividedDateTimeField(DateTimeField field, DurationField rangeField,
                                DateTimeFieldType type, int divisor)
    {
        checkWrapped(field, type);
        if (divisor < 2)
        {
            throw new IllegalArgumentException("The divisor must be at least 2");
        }

        myField = field;
        myType = type;
        myDivisor = divisor;

        DurationField unitField = field.getDurationField();
        if (unitField == null)
        {
            myDurationField = null;
        }
        else
        {
            myDurationField = new ScaledDurationField(unitField, type.getDurationType(), divisor);
        }
        myRangeDurationField = rangeField;

        myMin = floorDivide(field.getMinimumValue(), divisor);
        myMax = floorDivide(field.getMaximumValue(), divisor);
    }

    /**
     * Constructs the complement of a remainder field, sharing its wrapped
     * field and divisor.
     *
     * @param remainderField the remainder field to complement.
     * @param type the field type this field will actually use.
     */
    public DividedDateTimeField(RemainderDateTimeField remainderField,
                                DateTimeFieldType type)
    {
        this(remainderField, null, type);
    }

    /**
     * Constructs the complement of a remainder field, sharing its wrapped
     * field and divisor. This field's unit is the remainder field's range.
     *
     * @param remainderField the remainder field to complement.
     * @param rangeField the range field, null to use the wrapped field's.
     * @param type the field type this field will actually use.
     */
    public DividedDateTimeField(RemainderDateTimeField remainderField,
                                DurationField rangeField,
                                DateTimeFieldType type)
    {
        if (remainderField == null)
        {
            throw new IllegalArgumentException("The field must not be null");
        }
        DateTimeField field = remainderField.getWrappedField();
        checkWrapped(field, type);

        int divisor = remainderField.myDivisor;
        myField = field;
        myType = type;
        myDivisor = divisor;
        myDurationField = remainderField.myRangeField;
        myRangeDurationField = rangeField;

        myMin = floorDivide(field.getMinimumValue(), divisor);
        myMax = floorDivide(field.getMaximumValue(), divisor);
    }

    static void checkWrapped(DateTimeField field, DateTimeFieldType type)
    {
        if (field == null)
        {
            throw new IllegalArgumentException("The field must not be null");
        }
        if (!field.isSupported())
        {
            throw new IllegalArgumentException("The field must be supported");
        }
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
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
     * Get the amount of scaled units from the specified time instant.
     *
     * @param instant the time instant in millis to query.
     * @return the amount of scaled units extracted from the input.
     */
    public int get(long instant)
    {
        return floorDivide(myField.get(instant), myDivisor);
    }

    /**
     * Add the specified amount of scaled units to the specified time
     * instant. The amount added may be negative.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of scaled units to add (can be negative).
     * @return the updated time instant.
     */
    @Override
    public long add(long instant, int amount)
    {
        return myField.add(instant, FieldUtils.safeMultiply(amount, myDivisor));
    }

    /**
     * Add the specified amount of scaled units to the specified time
     * instant. The amount added may be negative.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of scaled units to add (can be negative).
     * @return the updated time instant.
     */
    @Override
    public long add(long instant, long amount)
    {
        return myField.add(instant, FieldUtils.safeMultiply(amount, myDivisor));
    }

    /**
     * Add to the scaled component of the specified time instant,
     * wrapping around within that component if necessary.
     *
     * @param instant the time instant in millis to update.
     * @param amount the amount of scaled units to add (can be negative).
     * @return the updated time instant.
     */
    @Override
    public long addWrapField(long instant, int amount)
    {
        return set(instant, FieldUtils.getWrappedValue(get(instant), amount, myMin, myMax));
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifference(minuendInstant, subtrahendInstant) / myDivisor;
    }

    @Override
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifferenceAsLong(minuendInstant, subtrahendInstant) / myDivisor;
    }

    /**
     * Set the specified amount of scaled units to the specified time instant.
     *
     * @param instant the time instant in millis to update.
     * @param value value of scaled units to set.
     * @return the updated time instant.
     * @throws com.amazon.chrono.IllegalFieldValueException if value is too
     * large or too small.
     */
    public long set(long instant, int value)
    {
        FieldUtils.verifyValueBounds(this, value, myMin, myMax);
        int remainder = floorRemainder(myField.get(instant), myDivisor);
        return myField.set(instant, value * myDivisor + remainder);
    }

    /**
     * Returns a scaled version of the wrapped field's unit duration field.
     */
    public DurationField getDurationField()
    {
        return myDurationField;
    }

    public DurationField getRangeDurationField()
    {
        if (myRangeDurationField != null)
        {
            return myRangeDurationField;
        }
        return myField.getRangeDurationField();
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
        DateTimeField field = myField;
        return field.roundFloor(field.set(instant, get(instant) * myDivisor));
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


    //=========================================================================

    static int floorDivide(int value, int divisor)
    {
        if (value >= 0)
        {
            return value / divisor;
        }
        return ((value + 1) / divisor) - 1;
    }

    static int floorRemainder(int value, int divisor)
    {
        if (value >= 0)
        {
            return value % divisor;
        }
        return (divisor - 1) + ((value + 1) % divisor);
    }
}
