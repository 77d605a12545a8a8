// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.system;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;
import com.amazon.chrono.ZonedFieldContext;
import com.amazon.chrono.field.LenientDateTimeField;
import com.amazon.chrono.field.StrictDateTimeField;
import com.amazon.chrono.field.UnsupportedDateTimeField;
import com.amazon.chrono.field.UnsupportedDurationField;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;


/**
 * An immutable collection of fields forming one calendar, looked up by
 * type. Types the calendar lacks resolve to the shared unsupported
 * sentinels rather than null.
 * <p>
 * Instances are built by {@link FieldSetBuilder} and are safe for use by
 * multiple threads.
 */
public final class FieldSet
{
    private final Map<DateTimeFieldType, DateTimeField> myFields;
    private final Map<DurationFieldType, DurationField> myDurationFields;


    FieldSet(Map<DateTimeFieldType, DateTimeField> fields,
             Map<DurationFieldType, DurationField> durationFields)
    {
        myFields =
            Collections.unmodifiableMap(new LinkedHashMap<DateTimeFieldType, DateTimeField>(fields));
        myDurationFields =
            Collections.unmodifiableMap(new LinkedHashMap<DurationFieldType, DurationField>(durationFields));
    }


    //=========================================================================

    /**
     * Gets the field of the given type.
     *
     * @return the registered field, or an {@link UnsupportedDateTimeField}
     * counting in this set's unit for the type.
     *
     * @throws IllegalArgumentException if {@code type} is null.
     */
    public DateTimeField getField(DateTimeFieldType type)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }
        DateTimeField field = myFields.get(type);
        if (field == null)
        {
            field = UnsupportedDateTimeField.getInstance(type,
                                                         getDurationField(type.getDurationType()));
        }
        return field;
    }

    /**
     * Gets the unit of the given type.
     *
     * @return the registered unit, or an {@link UnsupportedDurationField}.
     *
     * @throws IllegalArgumentException if {@code type} is null.
     */
    public DurationField getDurationField(DurationFieldType type)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("The type must not be null");
        }
        DurationField field = myDurationFields.get(type);
        if (field == null)
        {
            field = UnsupportedDurationField.getInstance(type);
        }
        return field;
    }

    public boolean isSupported(DateTimeFieldType type)
    {
        return myFields.containsKey(type);
    }

    public boolean isSupported(DurationFieldType type)
    {
        return myDurationFields.containsKey(type);
    }

    /**
     * Gets the fields for a partial with the given layout, largest first.
     * Types the calendar lacks are returned as unsupported sentinels.
     */
    public DateTimeField[] getFields(DateTimeFieldType... types)
    {
        DateTimeField[] fields = new DateTimeField[types.length];
        for (int i = 0; i < types.length; i++)
        {
            fields[i] = getField(types[i]);
        }
        return fields;
    }

    /**
     * Gets the types of the supported fields, in registration order.
     */
    public Set<DateTimeFieldType> getFieldTypes()
    {
        return myFields.keySet();
    }

    public Set<DurationFieldType> getDurationFieldTypes()
    {
        return myDurationFields.keySet();
    }


    //=========================================================================

    /**
     * Returns a copy of this set whose fields reject out-of-range values in
     * {@link DateTimeField#set(long, int)}.
     */
    public FieldSet toStrict()
    {
        Map<DateTimeFieldType, DateTimeField> fields =
            new LinkedHashMap<DateTimeFieldType, DateTimeField>();
        for (Map.Entry<DateTimeFieldType, DateTimeField> entry : myFields.entrySet())
        {
            fields.put(entry.getKey(), StrictDateTimeField.getInstance(entry.getValue()));
        }
        return new FieldSet(fields, myDurationFields);
    }

    /**
     * Returns a copy of this set whose fields accept out-of-range values in
     * {@link DateTimeField#set(long, int)}, resolving them against the
     * local time line of the given context.
     *
     * @throws IllegalArgumentException if {@code context} is null and this
     * set has a field that is not already lenient.
     */
    public FieldSet toLenient(ZonedFieldContext context)
    {
        Map<DateTimeFieldType, DateTimeField> fields =
            new LinkedHashMap<DateTimeFieldType, DateTimeField>();
        for (Map.Entry<DateTimeFieldType, DateTimeField> entry : myFields.entrySet())
        {
            fields.put(entry.getKey(), LenientDateTimeField.getInstance(entry.getValue(), context));
        }
        return new FieldSet(fields, myDurationFields);
    }

    @Override
    public String toString()
    {
        return "FieldSet" + myFields.keySet();
    }
}
