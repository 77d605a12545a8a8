// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;


/**
 * A duration field whose unit is a fixed multiple of another field's unit,
 * such as centuries from years.
 * <p>
 * Values and differences are the wrapped field's divided by the scalar
 * (rounding toward zero); millisecond conversions and additions multiply by
 * it first.
 */
public final class ScaledDurationField
    implements DurationField
{
    private final DurationField myField;
    private final DurationFieldType myType;
    private final int myScalar;


    /**
     * @param field the field to scale; must be supported.
     * @param type the type this field represents; must not be null.
     * @param scalar the multiple of the wrapped unit; neither 0 nor 1.
     *
     * @throws IllegalArgumentException if an argument is invalid.
     */
    public ScaledDurationField(DurationField field, DurationFieldType type, int scalar)
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
        if (scalar == 0 || scalar == 1)
        {
            throw new IllegalArgumentException("The scalar must not be 0 or 1");
        }
        myField = field;
        myType = type;
        myScalar = scalar;
    }

    /**
     * Gets the field being scaled.
     */
    public DurationField getWrappedField()
    {
        return myField;
    }

    /**
     * Gets the multiple of the wrapped unit that makes one unit of this field.
     */
    public int getScalar()
    {
        return myScalar;
    }

    public DurationFieldType getType()
    {
        return myType;
    }

    public boolean isPrecise()
    {
        return myField.isPrecise();
    }

    public long getUnitMillis()
    {
        return FieldUtils.safeMultiply(myField.getUnitMillis(), myScalar);
    }


    //=========================================================================

    @Override
    public int getValue(long duration)
    {
        return myField.getValue(duration) / myScalar;
    }

    @Override
    public long getValueAsLong(long duration)
    {
        return myField.getValueAsLong(duration) / myScalar;
    }

    @Override
    public int getValue(long duration, long instant)
    {
        return myField.getValue(duration, instant) / myScalar;
    }

    public long getValueAsLong(long duration, long instant)
    {
        return myField.getValueAsLong(duration, instant) / myScalar;
    }

    @Override
    public long getMillis(int value)
    {
        long scaled = ((long) value) * ((long) myScalar);
        return myField.getMillis(scaled);
    }

    @Override
    public long getMillis(long value)
    {
        long scaled = FieldUtils.safeMultiply(value, myScalar);
        return myField.getMillis(scaled);
    }

    public long getMillis(int value, long instant)
    {
        long scaled = ((long) value) * ((long) myScalar);
        return myField.getMillis(scaled, instant);
    }

    public long getMillis(long value, long instant)
    {
        long scaled = FieldUtils.safeMultiply(value, myScalar);
        return myField.getMillis(scaled, instant);
    }

    public long add(long instant, int value)
    {
        long scaled = ((long) value) * ((long) myScalar);
        return myField.add(instant, scaled);
    }

    public long add(long instant, long value)
    {
        long scaled = FieldUtils.safeMultiply(value, myScalar);
        return myField.add(instant, scaled);
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifference(minuendInstant, subtrahendInstant) / myScalar;
    }

    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifferenceAsLong(minuendInstant, subtrahendInstant) / myScalar;
    }


    //=========================================================================

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }
        if (obj instanceof ScaledDurationField)
        {
            ScaledDurationField other = (ScaledDurationField) obj;
            return (myField.equals(other.myField))
                && (myType.equals(other.myType))
                && (myScalar == other.myScalar);
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        long scalar = myScalar;
        int hash = (int) (scalar ^ (scalar >>> 32));
        hash += myType.hashCode();
        hash += myField.hashCode();
        return hash;
    }

    @Override
    public String toString()
    {
        return "DurationField[" + getName() + ']';
    }
}
