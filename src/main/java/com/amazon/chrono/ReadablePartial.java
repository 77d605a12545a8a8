// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * Describes the layout of a partial: an ordered subset of calendar fields
 * without a full instant, such as year, month-of-year and day-of-month.
 * <p>
 * Fields are ordered largest first. The values of a partial are held in a
 * separate {@code int[]} owned by the caller, where index {@code i} holds
 * the value of {@link #getField(int) getField(i)}. The partial operations
 * of {@link DateTimeField} mutate that array in place and return it.
 */
public interface ReadablePartial
{
    /**
     * Gets the number of fields in this partial.
     */
    public int size();

    /**
     * Gets the field at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    public DateTimeField getField(int index);

    /**
     * Gets the type of the field at the given index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    public default DateTimeFieldType getFieldType(int index)
    {
        return getField(index).getType();
    }

    /**
     * Gets the index of the field with the given type.
     *
     * @return the index, or -1 if this partial has no such field.
     */
    public default int indexOf(DateTimeFieldType type)
    {
        for (int i = 0, size = size(); i < size; i++)
        {
            if (getFieldType(i).equals(type))
            {
                return i;
            }
        }
        return -1;
    }
}
