// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;


/**
 * Passes every call to another duration field, optionally reporting a
 * different type. Calendar assemblers use it to expose one unit under
 * another name, such as weekyears counted by years.
 */
public final class DelegatedDurationField
    implements DurationField
{
    private final DurationField myField;
    private final DurationFieldType myType;


    /**
     * @param field the field to delegate to; must not be null.
     */
    public DelegatedDurationField(DurationField field)
    {
        this(field, null);
    }

    /**
     * @param field the field to delegate to; must not be null.
     * @param type the type to report, null to use the wrapped field's.
     */
    public DelegatedDurationField(DurationField field, DurationFieldType type)
    {
        if (field == null)
        {
            throw new IllegalArgumentException("The field must not be null");
        }
        myField = field;
        myType = (type == null ? field.getType() : type);
    }

    public DurationField getWrappedField()
    {
        return myField;
    }

    public DurationFieldType getType()
    {
        return myType;
    }

    @Override
    public boolean isSupported()
    {
        return myField.isSupported();
    }

    public boolean isPrecise()
    {
        return myField.isPrecise();
    }

    public long getUnitMillis()
    {
        return myField.getUnitMillis();
    }

    @Override
    public int getValue(long duration)
    {
        return myField.getValue(duration);
    }

    @Override
    public long getValueAsLong(long duration)
    {
        return myField.getValueAsLong(duration);
    }

    @Override
    public int getValue(long duration, long instant)
    {
        return myField.getValue(duration, instant);
    }

    public long getValueAsLong(long duration, long instant)
    {
        return myField.getValueAsLong(duration, instant);
    }

    @Override
    public long getMillis(int value)
    {
        return myField.getMillis(value);
    }

    @Override
    public long getMillis(long value)
    {
        return myField.getMillis(value);
    }

    public long getMillis(int value, long instant)
    {
        return myField.getMillis(value, instant);
    }

    public long getMillis(long value, long instant)
    {
        return myField.getMillis(value, instant);
    }

    public long add(long instant, int value)
    {
        return myField.add(instant, value);
    }

    public long add(long instant, long value)
    {
        return myField.add(instant, value);
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifference(minuendInstant, subtrahendInstant);
    }

    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return myField.getDifferenceAsLong(minuendInstant, subtrahendInstant);
    }

    @Override
    public int compareTo(DurationField otherField)
    {
        return myField.compareTo(otherField);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }
        if (obj instanceof DelegatedDurationField)
        {
            DelegatedDurationField other = (DelegatedDurationField) obj;
            return myField.equals(other.myField) && myType.equals(other.myType);
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        return myField.hashCode() ^ myType.hashCode();
    }

    @Override
    public String toString()
    {
        return "DurationField[" + getName() + ']';
    }
}
