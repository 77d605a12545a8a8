// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * An error caused by a field value that lies outside the bounds the field
 * permits for the instant or partial at hand.
 * <p>
 * The exception records which field rejected the value, the value itself,
 * and the bounds it was checked against. Either bound may be null when the
 * value was rejected for another reason (for example a value that a
 * {@linkplain com.amazon.chrono.field.SkipDateTimeField skip field} omits).
 */
public class IllegalFieldValueException
    extends ChronoException
{
    private static final long serialVersionUID = 6305711765985447737L;

    private static String createMessage(String fieldName, Number value,
                                        Number lowerBound, Number upperBound,
                                        String explain)
    {
        StringBuilder buf = new StringBuilder()
            .append("Value ")
            .append(value)
            .append(" for ")
            .append(fieldName)
            .append(' ');

        if (lowerBound == null)
        {
            if (upperBound == null)
            {
                buf.append("is not supported");
            }
            else
            {
                buf.append("must not be larger than ").append(upperBound);
            }
        }
        else if (upperBound == null)
        {
            buf.append("must not be smaller than ").append(lowerBound);
        }
        else
        {
            buf.append("must be in the range [")
               .append(lowerBound)
               .append(',')
               .append(upperBound)
               .append(']');
        }
        if (explain != null)
        {
            buf.append(": ").append(explain);
        }
        return buf.toString();
    }


    private final DateTimeFieldType myDateTimeFieldType;
    private final DurationFieldType myDurationFieldType;
    private final String myFieldName;
    private final Number myNumberValue;
    private final Number myLowerBound;
    private final Number myUpperBound;


    /**
     * @param fieldType type of field being set
     * @param value illegal value being set
     * @param lowerBound lower legal field value, or null if not applicable
     * @param upperBound upper legal field value, or null if not applicable
     */
    public IllegalFieldValueException(DateTimeFieldType fieldType,
                                      Number value,
                                      Number lowerBound,
                                      Number upperBound)
    {
        super(createMessage(fieldType.getName(), value, lowerBound, upperBound, null));
        myDateTimeFieldType = fieldType;
        myDurationFieldType = null;
        myFieldName = fieldType.getName();
        myNumberValue = value;
        myLowerBound = lowerBound;
        myUpperBound = upperBound;
    }

    /**
     * @param fieldType type of field being set
     * @param value illegal value being set
     * @param explain an explanation
     */
    public IllegalFieldValueException(DateTimeFieldType fieldType,
                                      Number value,
                                      String explain)
    {
        super(createMessage(fieldType.getName(), value, null, null, explain));
        myDateTimeFieldType = fieldType;
        myDurationFieldType = null;
        myFieldName = fieldType.getName();
        myNumberValue = value;
        myLowerBound = null;
        myUpperBound = null;
    }

    /**
     * @param fieldType type of field being set
     * @param value illegal value being set
     * @param lowerBound lower legal field value, or null if not applicable
     * @param upperBound upper legal field value, or null if not applicable
     */
    public IllegalFieldValueException(DurationFieldType fieldType,
                                      Number value,
                                      Number lowerBound,
                                      Number upperBound)
    {
        super(createMessage(fieldType.getName(), value, lowerBound, upperBound, null));
        myDateTimeFieldType = null;
        myDurationFieldType = fieldType;
        myFieldName = fieldType.getName();
        myNumberValue = value;
        myLowerBound = lowerBound;
        myUpperBound = upperBound;
    }

    /**
     * @param fieldName name of field being set
     * @param value illegal value being set
     * @param lowerBound lower legal field value, or null if not applicable
     * @param upperBound upper legal field value, or null if not applicable
     */
    public IllegalFieldValueException(String fieldName,
                                      Number value,
                                      Number lowerBound,
                                      Number upperBound)
    {
        super(createMessage(fieldName, value, lowerBound, upperBound, null));
        myDateTimeFieldType = null;
        myDurationFieldType = null;
        myFieldName = fieldName;
        myNumberValue = value;
        myLowerBound = lowerBound;
        myUpperBound = upperBound;
    }


    /**
     * Returns the DateTimeFieldType whose value was invalid, or null if not
     * applicable.
     */
    public DateTimeFieldType getDateTimeFieldType()
    {
        return myDateTimeFieldType;
    }

    /**
     * Returns the DurationFieldType whose value was invalid, or null if not
     * applicable.
     */
    public DurationFieldType getDurationFieldType()
    {
        return myDurationFieldType;
    }

    /**
     * Returns the name of the field whose value was invalid.
     */
    public String getFieldName()
    {
        return myFieldName;
    }

    /**
     * Returns the illegal value assigned to the field.
     */
    public Number getIllegalNumberValue()
    {
        return myNumberValue;
    }

    /**
     * Returns the lower bound of the legal value range, or null if not
     * applicable.
     */
    public Number getLowerBound()
    {
        return myLowerBound;
    }

    /**
     * Returns the upper bound of the legal value range, or null if not
     * applicable.
     */
    public Number getUpperBound()
    {
        return myUpperBound;
    }
}
