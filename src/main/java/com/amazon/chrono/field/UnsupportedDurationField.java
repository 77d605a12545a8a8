// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;
import com.amazon.chrono.UnsupportedFieldException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;


/**
 * Stands in for a unit that a calendar does not have. Every conversion and
 * arithmetic operation throws {@link UnsupportedFieldException}.
 * <p>
 * Instances are shared: one per type, created on first request and cached
 * for the life of the process.
 */
public final class UnsupportedDurationField
    implements DurationField
{
    // Populated on first use of each type and never evicted.
    private static final ConcurrentMap<DurationFieldType, UnsupportedDurationField> CACHE =
        new ConcurrentHashMap<DurationFieldType, UnsupportedDurationField>();

    /**
     * Gets the shared instance for the given type.
     *
     * @param type the type of the unsupported unit; must not be null.
     *
     * @throws IllegalArgumentException if {@code type} is null.
     */
    public static UnsupportedDurationField getInstance(DurationFieldType type)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }

        UnsupportedDurationField field = CACHE.get(type);
        if (field == null)
        {
            field = new UnsupportedDurationField(type);
            final UnsupportedDurationField existingField = CACHE.putIfAbsent(type, field);
            if (existingField != null)
            {
                field = existingField;
            }
        }
        return field;
    }


    //=========================================================================

    private final DurationFieldType myType;

    private UnsupportedDurationField(DurationFieldType type)
    {
        myType = type;
    }

    public DurationFieldType getType()
    {
        return myType;
    }

    /**
     * @return false always
     */
    @Override
    public boolean isSupported()
    {
        return false;
    }

    /**
     * @return true always
     */
    public boolean isPrecise()
    {
        return true;
    }

    /**
     * @return zero always
     */
    public long getUnitMillis()
    {
        return 0;
    }

    @Override
    public int getValue(long duration)
    {
        throw unsupported();
    }

    @Override
    public long getValueAsLong(long duration)
    {
        throw unsupported();
    }

    @Override
    public int getValue(long duration, long instant)
    {
        throw unsupported();
    }

    public long getValueAsLong(long duration, long instant)
    {
        throw unsupported();
    }

    @Override
    public long getMillis(int value)
    {
        throw unsupported();
    }

    @Override
    public long getMillis(long value)
    {
        throw unsupported();
    }

    public long getMillis(int value, long instant)
    {
        throw unsupported();
    }

    public long getMillis(long value, long instant)
    {
        throw unsupported();
    }

    public long add(long instant, int value)
    {
        throw unsupported();
    }

    public long add(long instant, long value)
    {
        throw unsupported();
    }

    @Override
    public long subtract(long instant, int value)
    {
        throw unsupported();
    }

    @Override
    public long subtract(long instant, long value)
    {
        throw unsupported();
    }

    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        throw unsupported();
    }

    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        throw unsupported();
    }

    /**
     * Always returns zero, indicating that sort order is not relevant.
     */
    @Override
    public int compareTo(DurationField durationField)
    {
        return 0;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
        {
            return true;
        }
        if (obj instanceof UnsupportedDurationField)
        {
            return myType.equals(((UnsupportedDurationField) obj).myType);
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        return myType.hashCode();
    }

    @Override
    public String toString()
    {
        return "UnsupportedDurationField[" + getName() + ']';
    }

    private UnsupportedFieldException unsupported()
    {
        return new UnsupportedFieldException(getName());
    }
}
