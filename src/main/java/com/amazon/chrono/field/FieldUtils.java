// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.field;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.IllegalFieldValueException;


/**
 * Overflow-checked integer arithmetic and bounds checks shared by the field
 * implementations.
 * <p>
 * Every arithmetic method throws {@link ArithmeticException} when the
 * mathematical result cannot be represented; none of them wrap silently.
 */
public final class FieldUtils
{
    /** You no touchy. */
    private FieldUtils() { }


    //=========================================================================
    // Safe arithmetic

    /**
     * Negates the input, throwing an exception if it can't be negated.
     */
    public static int safeNegate(int value)
    {
        if (value == Integer.MIN_VALUE)
        {
            throw new ArithmeticException("Integer.MIN_VALUE cannot be negated");
        }
        return -value;
    }

    public static int safeAdd(int val1, int val2)
    {
        int sum = val1 + val2;
        // If there is a sign change, but the two values have the same sign...
        if ((val1 ^ sum) < 0 && (val1 ^ val2) >= 0)
        {
            throw new ArithmeticException
                ("The calculation caused an overflow: " + val1 + " + " + val2);
        }
        return sum;
    }

    public static long safeAdd(long val1, long val2)
    {
        long sum = val1 + val2;
        if ((val1 ^ sum) < 0 && (val1 ^ val2) >= 0)
        {
            throw new ArithmeticException
                ("The calculation caused an overflow: " + val1 + " + " + val2);
        }
        return sum;
    }

    public static long safeSubtract(long val1, long val2)
    {
        long diff = val1 - val2;
        // If there is a sign change, but the two values have different signs...
        if ((val1 ^ diff) < 0 && (val1 ^ val2) < 0)
        {
            throw new ArithmeticException
                ("The calculation caused an overflow: " + val1 + " - " + val2);
        }
        return diff;
    }

    public static int safeMultiply(int val1, int val2)
    {
        long total = (long) val1 * (long) val2;
        if (total < Integer.MIN_VALUE || total > Integer.MAX_VALUE)
        {
            throw new ArithmeticException
                ("Multiplication overflows an int: " + val1 + " * " + val2);
        }
        return (int) total;
    }

    public static long safeMultiply(long val1, int val2)
    {
        switch (val2)
        {
            case -1:
                if (val1 == Long.MIN_VALUE)
                {
                    throw new ArithmeticException
                        ("Multiplication overflows a long: " + val1 + " * " + val2);
                }
                return -val1;
            case 0:
                return 0L;
            case 1:
                return val1;
        }
        long total = val1 * val2;
        if (total / val2 != val1)
        {
            throw new ArithmeticException
                ("Multiplication overflows a long: " + val1 + " * " + val2);
        }
        return total;
    }

    public static long safeMultiply(long val1, long val2)
    {
        if (val2 == 1) return val1;
        if (val1 == 1) return val2;
        if (val1 == 0 || val2 == 0) return 0;

        long total = val1 * val2;
        if (total / val2 != val1
            || (val1 == Long.MIN_VALUE && val2 == -1)
            || (val2 == Long.MIN_VALUE && val1 == -1))
        {
            throw new ArithmeticException
                ("Multiplication overflows a long: " + val1 + " * " + val2);
        }
        return total;
    }

    /**
     * Divides, rounding toward zero.
     *
     * @throws ArithmeticException if the quotient overflows or the divisor
     * is zero.
     */
    public static long safeDivide(long dividend, long divisor)
    {
        if (dividend == Long.MIN_VALUE && divisor == -1L)
        {
            throw new ArithmeticException
                ("Division overflows a long: " + dividend + " / " + divisor);
        }
        return dividend / divisor;
    }

    public static int safeToInt(long value)
    {
        if (Integer.MIN_VALUE <= value && value <= Integer.MAX_VALUE)
        {
            return (int) value;
        }
        throw new ArithmeticException("Value cannot fit in an int: " + value);
    }

    public static int safeMultiplyToInt(long val1, long val2)
    {
        return safeToInt(safeMultiply(val1, val2));
    }


    //=========================================================================
    // Bounds

    /**
     * Verifies that the value is within the inclusive bounds.
     *
     * @throws IllegalFieldValueException if the value is out of bounds.
     */
    public static void verifyValueBounds(DateTimeField field,
                                         int value, int lowerBound, int upperBound)
    {
        verifyValueBounds(field.getType(), value, lowerBound, upperBound);
    }

    /**
     * Verifies that the value is within the inclusive bounds.
     *
     * @throws IllegalFieldValueException if the value is out of bounds.
     */
    public static void verifyValueBounds(DateTimeFieldType fieldType,
                                         int value, int lowerBound, int upperBound)
    {
        if ((value < lowerBound) || (value > upperBound))
        {
            throw new IllegalFieldValueException(fieldType,
                                                 Integer.valueOf(value),
                                                 Integer.valueOf(lowerBound),
                                                 Integer.valueOf(upperBound));
        }
    }

    /**
     * Verifies that the value is within the inclusive bounds.
     *
     * @throws IllegalFieldValueException if the value is out of bounds.
     */
    public static void verifyValueBounds(String fieldName,
                                         int value, int lowerBound, int upperBound)
    {
        if ((value < lowerBound) || (value > upperBound))
        {
            throw new IllegalFieldValueException(fieldName,
                                                 Integer.valueOf(value),
                                                 Integer.valueOf(lowerBound),
                                                 Integer.valueOf(upperBound));
        }
    }


    //=========================================================================
    // Wrapping

    /**
     * Adds {@code wrapValue} to {@code currentValue} and wraps the sum into
     * the inclusive range {@code [minValue, maxValue]}.
     *
     * @throws IllegalArgumentException if {@code minValue >= maxValue}.
     */
    public static int getWrappedValue(int currentValue, int wrapValue,
                                      int minValue, int maxValue)
    {
        return wrap((long) currentValue + wrapValue, minValue, maxValue);
    }

    /**
     * Wraps the value into the inclusive range {@code [minValue, maxValue]},
     * returning the value in range that is congruent to it modulo the size
     * of the range. Negative values wrap from the top of the range.
     *
     * @throws IllegalArgumentException if {@code minValue >= maxValue}.
     */
    public static int getWrappedValue(int value, int minValue, int maxValue)
    {
        return wrap(value, minValue, maxValue);
    }

    private static int wrap(long value, int minValue, int maxValue)
    {
        if (minValue >= maxValue)
        {
            throw new IllegalArgumentException("MIN > MAX");
        }

        long wrapRange = (long) maxValue - minValue + 1;
        value -= minValue;

        if (value >= 0)
        {
            return (int) ((value % wrapRange) + minValue);
        }

        long remByRange = (-value) % wrapRange;

        if (remByRange == 0)
        {
            return minValue;
        }
        return (int) ((wrapRange - remByRange) + minValue);
    }
}
