// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.ReadablePartial;
import com.amazon.chrono.UnsupportedFieldException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;


/**
 * Stands in for a field that a calendar does not have. Reading, setting,
 * rounding and bounds queries throw {@link UnsupportedFieldException}.
 * <p>
 * Adding and differencing go through the duration field supplied at
 * creation, which may itself be supported: a calendar without a
 * week-of-weekyear field can still add weeks.
 * <p>
 * Instances are shared per type and duration field, and are never evicted.
 */
public final class UnsupportedDateTimeField
    implements DateTimeField
{
    private static final ConcurrentMap<Key, UnsupportedDateTimeField> CACHE =
        new ConcurrentHashMap<Key, UnsupportedDateTimeField>();

    /**
     * Gets the shared instance for the given type and duration field.
     *
     * @param type the type of the unsupported field; must not be null.
     * @param durationField the unit the field would count; must not be null.
     *
     * @throws IllegalArgumentException if either argument is null.
     */
    public static UnsupportedDateTimeField getInstance(DateTimeFieldType type,
                                                       DurationField durationField)
    {
        if (type == null || durationField == null)
        {
            throw new IllegalArgumentException("The type and duration field must not be null");
        }

        Key key = new Key(type, durationField);
        UnsupportedDateTimeField field = CACHE.get(key);
        if (field == null)
        {
            field = new UnsupportedDateTimeField(type, durationField);
            final UnsupportedDateTimeField existingField = CACHE.putIfAbsent(key, field);
            if (existingField != null)
            {
                field = existingField;
            }
        }
        return field;
    }


    /**
     * Cache key. Duration fields are compared by identity, since an
     * imprecise unit belongs to the one field that created it.
     */
    private static final class Key
    {
        private final DateTimeFieldType myType;
        private final DurationField myDurationField;

        Key(DateTimeFieldType type, DurationField durationField)
        {
            myType = type;
            myDurationField = durationField;
        }

        @Override
        public boolean equals(Object obj)
        {
            if (this == obj)
            {
                return true;
            }
            if (obj instanceof Key)
            {
                Key other = (Key) obj;
                return myType.equals(other.myType)
                    && myDurationField == other.myDurationField;
            }
            return false;
        }

        @Override
        public int hashCode()
        {
            return 31 * myType.hashCode() + System.identityHashCode(myDurationField);
        }
    }


    //=========================================================================

    private final DateTimeFieldType myType;
    private final DurationField myDurationField;

    private UnsupportedDateTimeField(DateTimeFieldType type, DurationField durationField)
    {
        myType = type;
        myDurationField = durationField;
    }

    public DateTimeFieldType getType()
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
     * @return false always
     */
    @Override
    public boolean isLenient()
    {
        return false;
    }

    public int get(long instant)
    {
        throw unsupported();
    }

    public long set(long instant, int value)
    {
        throw unsupported();
    }

    /**
     * Delegates to the duration field.
     */
    @Override
    public long add(long instant, int value)
    {
        return myDurationField.add(instant, value);
    }

    /**
     * Delegates to the duration field.
     */
    @Override
    public long add(long instant, long value)
    {
        return myDurationField.add(instant, value);
    }

    @Override
    public int[] add(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        throw unsupported();
    }

    @Override
    public int[] addWrapPartial(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        throw unsupported();
    }

    @Override
    public long addWrapField(long instant, int value)
    {
        throw unsupported();
    }

    @Override
    public int[] addWrapField(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        throw unsupported();
    }

    @Override
    public int[] set(ReadablePartial partial, int fieldIndex, int[] values, int newValue)
    {
        throw unsupported();
    }

    /**
     * Delegates to the duration field.
     */
    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return myDurationField.getDifference(minuendInstant, subtrahendInstant);
    }

    /**
     * Delegates to the duration field.
     */
    @Override
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return myDurationField.getDifferenceAsLong(minuendInstant, subtrahendInstant);
    }

    public DurationField getDurationField()
    {
        return myDurationField;
    }

    /**
     * @return null always
     */
    public DurationField getRangeDurationField()
    {
        return null;
    }

    @Override
    public boolean isLeap(long instant)
    {
        throw unsupported();
    }

    @Override
    public int getLeapAmount(long instant)
    {
        throw unsupported();
    }

    /**
     * @return null always
     */
    @Override
    public DurationField getLeapDurationField()
    {
        return null;
    }

    public int getMinimumValue()
    {
        throw unsupported();
    }

    @Override
    public int getMinimumValue(long instant)
    {
        throw unsupported();
    }

    @Override
    public int getMinimumValue(ReadablePartial partial)
    {
        throw unsupported();
    }

    @Override
    public int getMinimumValue(ReadablePartial partial, int[] values)
    {
        throw unsupported();
    }

    public int getMaximumValue()
    {
        throw unsupported();
    }

    @Override
    public int getMaximumValue(long instant)
    {
        throw unsupported();
    }

    @Override
    public int getMaximumValue(ReadablePartial partial)
    {
        throw unsupported();
    }

    @Override
    public int getMaximumValue(ReadablePartial partial, int[] values)
    {
        throw unsupported();
    }

    public long roundFloor(long instant)
    {
        throw unsupported();
    }

    @Override
    public long roundCeiling(long instant)
    {
        throw unsupported();
    }

    @Override
    public long roundHalfFloor(long instant)
    {
        throw unsupported();
    }

    @Override
    public long roundHalfCeiling(long instant)
    {
        throw unsupported();
    }

    @Override
    public long roundHalfEven(long instant)
    {
        throw unsupported();
    }

    @Override
    public long remainder(long instant)
    {
        throw unsupported();
    }

    @Override
    public String toString()
    {
        return "UnsupportedDateTimeField";
    }

    private UnsupportedFieldException unsupported()
    {
        return new UnsupportedFieldException(myType.getName());
    }
}
