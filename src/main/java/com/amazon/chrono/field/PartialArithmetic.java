// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.IncompatibleFieldsException;
import com.amazon.chrono.ReadablePartial;


/**
 * The carry algorithm behind the partial operations of {@link DateTimeField}.
 * <p>
 * A partial is a {@link ReadablePartial} layout plus a caller-owned
 * {@code int[]} of values, largest field first. Each method here mutates that
 * array in place and returns it.
 * <p>
 * When an addition overflows a field, the excess is carried into the field at
 * the next smaller index, one unit at a time, and the overflowing field
 * restarts from its new minimum (or maximum, when subtracting). Carrying is
 * only meaningful when the larger field counts the unit that bounds the
 * smaller one, so month-of-year may carry into year but day-of-week may not
 * carry into month-of-year. Two policies govern what happens at index 0:
 * {@link #add bounded} fails, {@link #addWrapPartial wrapped} wraps around.
 */
public final class PartialArithmetic
{
    private PartialArithmetic() { }


    /**
     * Adds to a field of a partial with the bounded policy.
     *
     * @throws IncompatibleFieldsException if the addition would carry past the
     * largest field, or into a field whose unit does not match the range of
     * {@code field}.
     */
    public static int[] add(DateTimeField field, ReadablePartial partial,
                            int fieldIndex, int[] values, int valueToAdd)
    {
        return add(field, partial, fieldIndex, values, valueToAdd, false);
    }

    /**
     * Adds to a field of a partial with the wrapped policy: an overflow of
     * the largest field wraps it back into its range.
     *
     * @throws IncompatibleFieldsException if the addition would carry into a
     * field whose unit does not match the range of {@code field}.
     */
    public static int[] addWrapPartial(DateTimeField field, ReadablePartial partial,
                                       int fieldIndex, int[] values, int valueToAdd)
    {
        return add(field, partial, fieldIndex, values, valueToAdd, true);
    }

    private static int[] add(DateTimeField field, ReadablePartial partial,
                             int fieldIndex, int[] values, int valueToAdd,
                             boolean wrap)
    {
        if (valueToAdd == 0)
        {
            return values;
        }

        // Long arithmetic throughout, so that partial sums never overflow.
        long remaining = valueToAdd;
        DateTimeField nextField = null;

        while (remaining > 0)
        {
            int max = field.getMaximumValue(partial, values);
            long proposed = values[fieldIndex] + remaining;
            if (proposed <= max)
            {
                values[fieldIndex] = (int) proposed;
                break;
            }
            remaining -= (max + 1L) - values[fieldIndex];
            if (fieldIndex == 0)
            {
                if (!wrap)
                {
                    throw new IncompatibleFieldsException
                        ("Maximum value exceeded for add on " + field.getName());
                }
                values[fieldIndex] = field.getMinimumValue(partial, values);
                continue;
            }
            if (nextField == null)
            {
                nextField = carryField(field, partial, fieldIndex);
            }
            if (wrap)
            {
                nextField.addWrapPartial(partial, fieldIndex - 1, values, 1);
            }
            else
            {
                nextField.add(partial, fieldIndex - 1, values, 1);
            }
            values[fieldIndex] = field.getMinimumValue(partial, values);
        }

        while (remaining < 0)
        {
            int min = field.getMinimumValue(partial, values);
            long proposed = values[fieldIndex] + remaining;
            if (proposed >= min)
            {
                values[fieldIndex] = (int) proposed;
                break;
            }
            remaining -= (min - 1L) - values[fieldIndex];
            if (fieldIndex == 0)
            {
                if (!wrap)
                {
                    throw new IncompatibleFieldsException
                        ("Minimum value exceeded for add on " + field.getName());
                }
                values[fieldIndex] = field.getMaximumValue(partial, values);
                continue;
            }
            if (nextField == null)
            {
                nextField = carryField(field, partial, fieldIndex);
            }
            if (wrap)
            {
                nextField.addWrapPartial(partial, fieldIndex - 1, values, -1);
            }
            else
            {
                nextField.add(partial, fieldIndex - 1, values, -1);
            }
            values[fieldIndex] = field.getMaximumValue(partial, values);
        }

        return field.set(partial, fieldIndex, values, values[fieldIndex]);
    }

    /**
     * Finds the field that receives carries from the field at
     * {@code fieldIndex}, verifying that it counts the unit that bounds it.
     */
    private static DateTimeField carryField(DateTimeField field,
                                            ReadablePartial partial,
                                            int fieldIndex)
    {
        DateTimeField nextField = partial.getField(fieldIndex - 1);
        DurationField range = field.getRangeDurationField();
        DurationField nextUnit = nextField.getDurationField();
        if (range == null || nextUnit == null
            || !range.getType().equals(nextUnit.getType()))
        {
            throw new IncompatibleFieldsException
                ("Fields invalid for add: " + field.getName()
                 + " cannot carry into " + nextField.getName());
        }
        return nextField;
    }


    //=========================================================================

    /**
     * Adds to a field of a partial, wrapping within that field's bounds.
     * Larger fields never change; smaller fields are clamped as by
     * {@link #set}.
     */
    public static int[] addWrapField(DateTimeField field, ReadablePartial partial,
                                     int fieldIndex, int[] values, int valueToAdd)
    {
        int current = values[fieldIndex];
        int wrapped = FieldUtils.getWrappedValue(current, valueToAdd,
                                                 field.getMinimumValue(partial),
                                                 field.getMaximumValue(partial));
        return field.set(partial, fieldIndex, values, wrapped);
    }

    /**
     * Sets a field of a partial, then clamps every smaller field into the
     * bounds that the new value implies. A clamped value moves only as far
     * as the nearer bound.
     *
     * @throws com.amazon.chrono.IllegalFieldValueException if
     * {@code newValue} is out of bounds.
     */
    public static int[] set(DateTimeField field, ReadablePartial partial,
                            int fieldIndex, int[] values, int newValue)
    {
        FieldUtils.verifyValueBounds(field, newValue,
                                     field.getMinimumValue(partial, values),
                                     field.getMaximumValue(partial, values));
        values[fieldIndex] = newValue;

        // may need to adjust smaller fields
        for (int i = fieldIndex + 1; i < partial.size(); i++)
        {
            DateTimeField smaller = partial.getField(i);
            int max = smaller.getMaximumValue(partial, values);
            if (values[i] > max)
            {
                values[i] = max;
            }
            int min = smaller.getMinimumValue(partial, values);
            if (values[i] < min)
            {
                values[i] = min;
            }
        }
        return values;
    }
}
