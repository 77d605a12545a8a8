// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

import com.amazon.chrono.field.FieldUtils;
import com.amazon.chrono.field.PartialArithmetic;


/**
 * A calendar component, such as "month of year", that is read from and
 * written to an instant or a partial.
 * <p>
 * Instants are milliseconds from a fixed epoch; the field gives them calendar
 * meaning. A field counts in units of its {@linkplain #getDurationField()
 * duration field} and, when bounded, within one unit of its
 * {@linkplain #getRangeDurationField() range duration field}: month-of-year
 * counts months within a year.
 * <p>
 * Only a handful of methods are abstract. The remaining behavior is derived
 * from them by the default methods here:
 * <ul>
 *   <li>every {@code roundXxx} method and {@link #remainder(long)} is defined
 *       in terms of {@link #roundFloor(long)};</li>
 *   <li>{@link #add(long, int)} and {@link #getDifference(long, long)} go
 *       through the duration field;</li>
 *   <li>the bounds overloads for an instant or a partial return the
 *       field-intrinsic bound;</li>
 *   <li>the partial operations implement the carry algorithm of
 *       {@link PartialArithmetic}.</li>
 * </ul>
 * Implementations must be immutable and safe for use by multiple threads.
 *
 * @see DurationField
 * @see ReadablePartial
 */
public interface DateTimeField
{
    /**
     * Gets the type of this field.
     */
    public DateTimeFieldType getType();

    /**
     * Gets the name of this field, for example "monthOfYear".
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
     * Returns true if {@link #set(long, int)} accepts values outside the
     * field's bounds by rolling them into larger fields.
     */
    public default boolean isLenient()
    {
        return false;
    }


    //=========================================================================
    // Instant access

    /**
     * Gets the value of this field from the given instant.
     */
    public int get(long instant);

    /**
     * Sets the value of this field in the given instant. Larger fields are
     * unchanged; smaller fields may be adjusted to remain valid, for example
     * setting February on the 31st moves the day to the end of February.
     *
     * @return the updated instant.
     *
     * @throws IllegalFieldValueException if {@code value} is outside the
     * bounds of this field for the instant, unless the field is lenient.
     */
    public long set(long instant, int value);

    /**
     * Adds a number of units of this field to the given instant. Larger
     * fields change as needed.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long add(long instant, int value)
    {
        return getDurationField().add(instant, value);
    }

    /**
     * Adds a number of units of this field to the given instant. Larger
     * fields change as needed.
     *
     * @throws ArithmeticException if the result overflows a long.
     */
    public default long add(long instant, long value)
    {
        return getDurationField().add(instant, value);
    }

    /**
     * Adds a number of units to this field only, wrapping within the field's
     * bounds. Larger fields never change: adding 5 days to April 30th gives
     * April 5th.
     */
    public default long addWrapField(long instant, int value)
    {
        int current = get(instant);
        int wrapped = FieldUtils.getWrappedValue(current, value,
                                                 getMinimumValue(instant),
                                                 getMaximumValue(instant));
        return set(instant, wrapped);
    }

    /**
     * Computes the number of whole units of this field between two instants.
     *
     * @throws ArithmeticException if the result does not fit in an int.
     */
    public default int getDifference(long minuendInstant, long subtrahendInstant)
    {
        return getDurationField().getDifference(minuendInstant, subtrahendInstant);
    }

    /**
     * Computes the number of whole units of this field between two instants.
     */
    public default long getDifferenceAsLong(long minuendInstant, long subtrahendInstant)
    {
        return getDurationField().getDifferenceAsLong(minuendInstant, subtrahendInstant);
    }


    //=========================================================================
    // Partial access

    /**
     * Adds to the value of this field in a partial, carrying into the next
     * larger field when this field overflows. The values array is modified
     * in place.
     *
     * @param partial the layout of the partial.
     * @param fieldIndex the index of this field in the partial.
     * @param values the values of the partial, largest field first.
     * @param valueToAdd the amount to add.
     *
     * @return the {@code values} array.
     *
     * @throws IncompatibleFieldsException if the addition would carry past
     * the largest field, or into a field whose unit is not this field's range.
     */
    public default int[] add(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return PartialArithmetic.add(this, partial, fieldIndex, values, valueToAdd);
    }

    /**
     * Adds to the value of this field in a partial, carrying into larger
     * fields and wrapping the largest field around when it overflows. The
     * values array is modified in place.
     *
     * @return the {@code values} array.
     *
     * @throws IncompatibleFieldsException if the addition would carry into a
     * field whose unit is not this field's range.
     */
    public default int[] addWrapPartial(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return PartialArithmetic.addWrapPartial(this, partial, fieldIndex, values, valueToAdd);
    }

    /**
     * Adds to the value of this field in a partial, wrapping within this
     * field's bounds. Larger fields never change. The values array is
     * modified in place.
     *
     * @return the {@code values} array.
     */
    public default int[] addWrapField(ReadablePartial partial, int fieldIndex, int[] values, int valueToAdd)
    {
        return PartialArithmetic.addWrapField(this, partial, fieldIndex, values, valueToAdd);
    }

    /**
     * Sets the value of this field in a partial and clamps every smaller
     * field into its new bounds. The values array is modified in place.
     *
     * @return the {@code values} array.
     *
     * @throws IllegalFieldValueException if {@code newValue} is outside the
     * bounds of this field for the partial.
     */
    public default int[] set(ReadablePartial partial, int fieldIndex, int[] values, int newValue)
    {
        return PartialArithmetic.set(this, partial, fieldIndex, values, newValue);
    }


    //=========================================================================
    // Related fields

    /**
     * Gets the unit this field counts, for example months for month-of-year.
     */
    public DurationField getDurationField();

    /**
     * Gets the unit of the range this field counts within, for example
     * years for month-of-year.
     *
     * @return the range field, or null if this field is unbounded.
     */
    public DurationField getRangeDurationField();

    /**
     * Returns true if the value of this field at the given instant is a
     * leap value, such as February 29th.
     */
    public default boolean isLeap(long instant)
    {
        return false;
    }

    /**
     * Gets the amount by which this field is leap at the given instant.
     */
    public default int getLeapAmount(long instant)
    {
        return 0;
    }

    /**
     * Gets the unit that leap values are measured in, for example days for
     * a year field.
     *
     * @return the leap unit, or null if this field has no leap values.
     */
    public default DurationField getLeapDurationField()
    {
        return null;
    }


    //=========================================================================
    // Bounds

    /**
     * Gets the smallest value this field can take at any instant.
     */
    public int getMinimumValue();

    public default int getMinimumValue(long instant)
    {
        return getMinimumValue();
    }

    public default int getMinimumValue(ReadablePartial partial)
    {
        return getMinimumValue();
    }

    /**
     * Gets the smallest value this field can take given the other values of
     * a partial.
     */
    public default int getMinimumValue(ReadablePartial partial, int[] values)
    {
        return getMinimumValue(partial);
    }

    /**
     * Gets the largest value this field can take at any instant.
     */
    public int getMaximumValue();

    public default int getMaximumValue(long instant)
    {
        return getMaximumValue();
    }

    public default int getMaximumValue(ReadablePartial partial)
    {
        return getMaximumValue();
    }

    /**
     * Gets the largest value this field can take given the other values of
     * a partial, for example 29 for day-of-month in a leap February.
     */
    public default int getMaximumValue(ReadablePartial partial, int[] values)
    {
        return getMaximumValue(partial);
    }


    //=========================================================================
    // Rounding

    /**
     * Rounds down to the largest instant not after the given one whose
     * smaller fields are all at their minimum.
     */
    public long roundFloor(long instant);

    /**
     * Rounds up to the smallest instant not before the given one whose
     * smaller fields are all at their minimum.
     */
    public default long roundCeiling(long instant)
    {
        long newInstant = roundFloor(instant);
        if (newInstant != instant)
        {
            instant = add(newInstant, 1);
        }
        return instant;
    }

    /**
     * Rounds to the nearer of floor and ceiling, preferring the floor on a
     * tie.
     */
    public default long roundHalfFloor(long instant)
    {
        long floor = roundFloor(instant);
        long ceiling = roundCeiling(instant);

        long diffFromFloor = instant - floor;
        long diffToCeiling = ceiling - instant;

        return (diffFromFloor <= diffToCeiling) ? floor : ceiling;
    }

    /**
     * Rounds to the nearer of floor and ceiling, preferring the ceiling on a
     * tie.
     */
    public default long roundHalfCeiling(long instant)
    {
        long floor = roundFloor(instant);
        long ceiling = roundCeiling(instant);

        long diffFromFloor = instant - floor;
        long diffToCeiling = ceiling - instant;

        return (diffToCeiling <= diffFromFloor) ? ceiling : floor;
    }

    /**
     * Rounds to the nearer of floor and ceiling; on a tie, picks whichever
     * gives this field an even value.
     */
    public default long roundHalfEven(long instant)
    {
        long floor = roundFloor(instant);
        long ceiling = roundCeiling(instant);

        long diffFromFloor = instant - floor;
        long diffToCeiling = ceiling - instant;

        if (diffFromFloor < diffToCeiling)
        {
            return floor;
        }
        if (diffToCeiling < diffFromFloor)
        {
            return ceiling;
        }
        // Exactly halfway
        if ((get(ceiling) & 1) == 0)
        {
            return ceiling;
        }
        return floor;
    }

    /**
     * Returns the portion of the instant that {@link #roundFloor(long)}
     * discards.
     */
    public default long remainder(long instant)
    {
        return instant - roundFloor(instant);
    }
}
