// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

import com.amazon.chrono.field.FieldUtils;


/**
 * A unit of elapsed time, such as "months" or "hours", that converts between
 * a millisecond duration and a count of units.
 * <p>
 * A <em>precise</em> field has a fixed length of {@link #getUnitMillis()}
 * milliseconds. An <em>imprecise</em> field (such as "months") varies in
 * length, so its conversions are made relative to an instant and its
 * {@link #getUnitMillis() unit length} is only an average.
 * <p>
 * Implementations must be immutable and safe for use by multiple threads.
 * The default methods of this interface assume a precise field; imprecise
 * implementations override them.
 */
public interface DurationField
    extends Comparable<DurationField>
{
    /**
     * Gets the type of unit this field represents.
     */
    public DurationFieldType getType();

    /**
     * Gets the name of this field, for example "months".
     */
    public default String getName()
    {
        return getType().getName();
    }

    /**
     * Returns true if this field is supported by the calendar it came from.
     * Only the unsupported sentinel returns false.
     */
    public default boolean isSupported()
    {
        return true;
    }

    /**
     * Indicates whether this field has a fixed length in milliseconds.
     */
    public boolean isPrecise();

    /**
     * Returns the length of one unit of this field in milliseconds. For
     * imprecise fields this is an average and is used only as an estimate.
     */
    public long getUnitMillis();


    //=========================================================================
    // Conversion

    /**
     * Gets the number of whole units in the given duration, rounding toward
     * zero.
     *
     * @throws ArithmeticException if the result does not fit in an int.
     */
    public default int getValue(long duration)
    {
        return FieldUtils.safeToInt(getValueAsLong(duration));
    }

    /**
     * Gets the number of whole units in the given duration, rounding toward
     * zero.
     */
    public default long getValueAsLong(long duration)
    {
        return duration / getUnitMillis();
    }

    /**
     * Gets the number of whole units in the given duration measured forward
     * from the given instant.
     *
     * @throws ArithmeticException if the result does not fit in an int.
     */
    public default int getValue(long duration, long instant)
    {
        return FieldUtils.safeToInt(getValueAsLong(duration, instant));
    }

    /**
     * Gets the number of whole units in the given duration measured forward
     * from the given instant.
     */
    public long getValueAsLong(long duration, long instant);

    /**
     * Gets the duration in milliseconds of the given number of units.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long getMillis(int value)
    {
        return FieldUtils.safeMultiply(getUnitMillis(), value);
    }

    /**
     * Gets the duration in milliseconds of the given number of units.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long getMillis(long value)
    {
        return FieldUtils.safeMultiply(value, getUnitMillis());
    }

    /**
     * Gets the duration in milliseconds of the given number of units added
     * to the given instant.
     */
    public long getMillis(int value, long instant);

    /**
     * Gets the duration in milliseconds of the given number of units added
     * to the given instant.
     */
    public long getMillis(long value, long instant);


    //=========================================================================
    // Arithmetic

    /**
     * Adds a number of units to the given instant.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public long add(long instant, int value);

    /**
     * Adds a number of units to the given instant.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public long add(long instant, long value);

    /**
     * Subtracts a number of units from the given instant.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long subtract(long instant, int value)
    {
        if (value == Integer.MIN_VALUE)
        {
            return subtract(instant, (long) value);
        }
        return add(instant, -value);
    }

    /**
     * Subtracts a number of units from the given instant.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long subtract(long instant, long value)
    {
        if (value == Long.MIN_VALUE)
        {
            throw new ArithmeticException("Long.MIN_VALUE cannot be negated");
        }
        return add(instant, -value);
    }

    /**
     * Computes the number of whole units between two instants, such that
     * {@code getDifference(add(b, n), b) == n}.
     *
     * @param minuendInstant the instant to subtract from
     * @param subtrahendInstant the instant to subtract
     *
     * @throws ArithmeticException if the result does not fit in an int.
     */
    public default int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return FieldUtils.safeToInt(getDifferenceAsLong(minuendInstant, subtrahendInstant));
    }

    /**
     * Computes the number of whole units between two instants.
     *
     * @param minuendInstant the instant to subtract from
     * @param subtrahendInstant the instant to subtract
     */
    public long getDifferenceAsLong(long minuendInstant, long subtrahendInstant);


    /**
     * Compares this field with another by the length of one unit. Precision
     * plays no part in the comparison.
     */
    @Override
    public default int compareTo(DurationField otherField)
    {
        long otherMillis = otherField.getUnitMillis();
        long thisMillis = getUnitMillis();
        if (thisMillis == otherMillis)
        {
            return 0;
        }
        return (thisMillis < otherMillis) ? -1 : 1;
    }
}
