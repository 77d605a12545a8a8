// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;


/**
 * Base for calendar fields whose unit varies in length, such as
 * month-of-year or year.
 * <p>
 * Subclasses implement the calendar rules in {@link #get}, {@link #set},
 * {@link #add(long, int)} and {@link #roundFloor}. In return this class
 * supplies the field's unit {@linkplain #getDurationField() duration field},
 * which routes every conversion back through this field's own
 * {@code add} and {@code getDifference}, and a difference computation that
 * is exact even though the unit length it starts from is only an average.
 */
public abstract class ImpreciseDateTimeField
    implements DateTimeField
{
    private final DateTimeFieldType myType;
    final long myUnitMillis;
    private final DurationField myDurationField;


    /**
     * @param type the field type.
     * @param unitMillis the average length of one unit in milliseconds, used
     * as the starting estimate for differences.
     *
     * @throws IllegalArgumentException if the type is null or
     * {@code unitMillis} is less than 1.
     */
    public ImpreciseDateTimeField(DateTimeFieldType type, long unitMillis)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }
        if (unitMillis < 1)
        {
            throw new IllegalArgumentException("The unit milliseconds must be at least 1");
        }
        myType = type;
        myUnitMillis = unitMillis;
        myDurationField = new LinkedDurationField(type.getDurationType());
    }

    public final DateTimeFieldType getType()
    {
        return myType;
    }

    public abstract int get(long instant);

    public abstract long set(long instant, int value);

    /**
     * Adds according to the calendar rules. Must not delegate to the
     * duration field, which delegates back here.
     */
    @Override
    public abstract long add(long instant, int value);

    /**
     * Adds according to the calendar rules. Must not delegate to the
     * duration field, which delegates back here.
     */
    @Override
    public abstract long add(long instant, long value);

    /**
     * Computes the difference between two instants, as measured in the units
     * of this field. Any fractional units are dropped from the result.
     *
     * @throws ArithmeticException if the result does not fit in an int.
     */
    @Override
    public int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return FieldUtils.safeToInt(getDifferenceAsLong(minuendInstant, subtrahendInstant));
    }

    /**
     * Computes the difference between two instants, as measured in the units
     * of this field. Any fractional units are dropped from the result.
     * <p>
     * Starts from the estimate given by the average unit length, then steps
     * one unit at a time using {@link #add(long, long)} until the estimate
     * is the largest count of units that does not pass the minuend.
     * Subclasses may override with a faster exact computation.
     */
    @Override
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        if (minuendInstant < subtrahendInstant)
        {
            return -getDifferenceAsLong(subtrahendInstant, minuendInstant);
        }

        long difference =
            FieldUtils.safeSubtract(minuendInstant, subtrahendInstant) / myUnitMillis;
        if (add(subtrahendInstant, difference) < minuendInstant)
        {
            do
            {
                difference++;
            }
            while (add(subtrahendInstant, difference) <= minuendInstant);
            difference--;
        }
        else if (add(subtrahendInstant, difference) > minuendInstant)
        {
            do
            {
                difference--;
            }
            while (add(subtrahendInstant, difference) > minuendInstant);
        }
        return difference;
    }

    public final DurationField getDurationField()
    {
        return myDurationField;
    }

    public abstract DurationField getRangeDurationField();

    public abstract long roundFloor(long instant);

    protected final long getDurationUnitMillis()
    {
        return myUnitMillis;
    }

    @Override
    public String toString()
    {
        return "DateTimeField[" + getName() + ']';
    }


    //=========================================================================

    /**
     * The unit duration field of an imprecise calendar field. It has no
     * arithmetic of its own; every operation is answered by the owning field.
     */
    private final class LinkedDurationField
        implements DurationField
    {
        private final DurationFieldType myDurationType;

        LinkedDurationField(DurationFieldType type)
        {
            myDurationType = type;
        }

        public DurationFieldType getType()
        {
            return myDurationType;
        }

        public boolean isPrecise()
        {
            return false;
        }

        public long getUnitMillis()
        {
            return myUnitMillis;
        }

        @Override
        public int getValue(long duration, long instant)
        {
            return ImpreciseDateTimeField.this.getDifference(instant + duration, instant);
        }

        public long getValueAsLong(long duration, long instant)
        {
            return ImpreciseDateTimeField.this.getDifferenceAsLong(instant + duration, instant);
        }

        public long getMillis(int value, long instant)
        {
            return ImpreciseDateTimeField.this.add(instant, value) - instant;
        }

        public long getMillis(long value, long instant)
        {
            return ImpreciseDateTimeField.this.add(instant, value) - instant;
        }

        public long add(long instant, int value)
        {
            return ImpreciseDateTimeField.this.add(instant, value);
        }

        public long add(long instant, long value)
        {
            return ImpreciseDateTimeField.this.add(instant, value);
        }

        @Override
        public int getDifference(long minuendInstant, long subtrahendInstant)
        {
            return ImpreciseDateTimeField.this.getDifference(minuendInstant, subtrahendInstant);
        }

        public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
        {
            return ImpreciseDateTimeField.this.getDifferenceAsLong(minuendInstant, subtrahendInstant);
        }

        @Override
        public String toString()
        {
            return "DurationField[" + getName() + ']';
        }
    }
}
