// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono.system;

import com.amazon.chrono.DateTimeField;
import com.amazon.chrono.DateTimeFieldType;
import com.amazon.chrono.DurationField;
import com.amazon.chrono.DurationFieldType;
import com.amazon.chrono.field.StrictDateTimeField;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * The bootstrap builder for creating a {@link FieldSet}.
 * Most applications start from {@link #standard()}, register their fields
 * on a mutable copy, and call {@link #build()}.
 * <p>
 * Configuration properties follow the standard JavaBeans idiom in order to
 * be friendly to dependency injection systems. They also provide
 * alternative {@code with...} mutation methods that enable a more fluid
 * style:
 *<pre>
 *    FieldSet fields = FieldSetBuilder.standard()
 *                                     .withField(hourOfDay)
 *                                     .withField(minuteOfHour)
 *                                     .withStrict(true)
 *                                     .build();
 *</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * This class is not thread-safe, but immutable instances are. Use
 * {@link #immutable()} to get an instance that can be shared.
 *
 * <h2>Defaults</h2>
 *
 * The default for {@link #isStrict()} is read from the system property
 * {@value #STRICT_PROPERTY}, and is false when the property is absent or
 * cannot be read.
 */
public class FieldSetBuilder
{
    /**
     * The system property that supplies the default for
     * {@link #isStrict()}.
     */
    public static final String STRICT_PROPERTY =
        "com.amazon.chrono.system.FieldSetBuilder.strict";


    private static final FieldSetBuilder STANDARD = new FieldSetBuilder();

    /**
     * The standard builder of {@link FieldSet}s.
     * See the class documentation for the standard configuration.
     * <p>
     * The returned instance is immutable.
     */
    public static FieldSetBuilder standard()
    {
        return STANDARD;
    }


    //=========================================================================

    Map<DateTimeFieldType, DateTimeField> myFields =
        new LinkedHashMap<DateTimeFieldType, DateTimeField>();
    Map<DurationFieldType, DurationField> myDurationFields =
        new LinkedHashMap<DurationFieldType, DurationField>();
    boolean myStrict = false;


    /** You no touchy. */
    private FieldSetBuilder()
    {
        try
        {
            myStrict = Boolean.getBoolean(STRICT_PROPERTY);
        }
        catch (final SecurityException e)
        {
            // NO-OP in the case where system properties are not accessible.
        }
    }

    private FieldSetBuilder(FieldSetBuilder that)
    {
        this.myFields =
            new LinkedHashMap<DateTimeFieldType, DateTimeField>(that.myFields);
        this.myDurationFields =
            new LinkedHashMap<DurationFieldType, DurationField>(that.myDurationFields);
        this.myStrict = that.myStrict;
    }


    //=========================================================================

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public final FieldSetBuilder copy()
    {
        return new Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this instance, if immutable;
     * otherwise an immutable copy of this instance.
     */
    public FieldSetBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public FieldSetBuilder mutable()
    {
        return copy();
    }

    void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================
    // Fields

    /**
     * Gets the field registered for the given type.
     *
     * @return the field, or null if none has been registered.
     */
    public final DateTimeField getField(DateTimeFieldType type)
    {
        return myFields.get(type);
    }

    /**
     * Registers a field under its own type, replacing any field previously
     * registered for that type.
     *
     * @throws UnsupportedOperationException if this is immutable.
     * @throws IllegalArgumentException if {@code field} is null or
     * unsupported.
     *
     * @see #withField(DateTimeField)
     */
    public final void setField(DateTimeField field)
    {
        mutationCheck();
        if (field == null || !field.isSupported())
        {
            throw new IllegalArgumentException("The field must be supported: " + field);
        }
        myFields.put(field.getType(), field);
    }

    /**
     * Declares a field to register, returning a new mutable builder if
     * this is immutable.
     *
     * @see #setField(DateTimeField)
     */
    public final FieldSetBuilder withField(DateTimeField field)
    {
        FieldSetBuilder b = mutable();
        b.setField(field);
        return b;
    }


    //=========================================================================
    // Duration fields

    public final DurationField getDurationField(DurationFieldType type)
    {
        return myDurationFields.get(type);
    }

    /**
     * Registers a unit under its own type, replacing any unit previously
     * registered for that type.
     *
     * @throws UnsupportedOperationException if this is immutable.
     * @throws IllegalArgumentException if {@code field} is null or
     * unsupported.
     */
    public final void setDurationField(DurationField field)
    {
        mutationCheck();
        if (field == null || !field.isSupported())
        {
            throw new IllegalArgumentException("The duration field must be supported: " + field);
        }
        myDurationFields.put(field.getType(), field);
    }

    public final FieldSetBuilder withDurationField(DurationField field)
    {
        FieldSetBuilder b = mutable();
        b.setDurationField(field);
        return b;
    }


    //=========================================================================

    /**
     * Registers every supported field and unit of an existing set. Entries
     * already registered here are replaced.
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public final void copyFieldsFrom(FieldSet fields)
    {
        mutationCheck();
        for (DurationFieldType type : fields.getDurationFieldTypes())
        {
            DurationField field = fields.getDurationField(type);
            if (field.isSupported())
            {
                myDurationFields.put(type, field);
            }
        }
        for (DateTimeFieldType type : fields.getFieldTypes())
        {
            DateTimeField field = fields.getField(type);
            if (field.isSupported())
            {
                myFields.put(type, field);
            }
        }
    }

    public final FieldSetBuilder withFieldsFrom(FieldSet fields)
    {
        FieldSetBuilder b = mutable();
        b.copyFieldsFrom(fields);
        return b;
    }


    //=========================================================================

    /**
     * Indicates whether built fields reject out-of-range values.
     */
    public final boolean isStrict()
    {
        return myStrict;
    }

    /**
     * Declares whether every built field is wrapped to reject out-of-range
     * values in {@link DateTimeField#set(long, int)}.
     *
     * @throws UnsupportedOperationException if this is immutable.
     *
     * @see StrictDateTimeField
     */
    public final void setStrict(boolean strict)
    {
        mutationCheck();
        myStrict = strict;
    }

    public final FieldSetBuilder withStrict(boolean strict)
    {
        FieldSetBuilder b = mutable();
        b.setStrict(strict);
        return b;
    }


    //=========================================================================

    /**
     * Builds a new field set based on this builder's configuration
     * properties. Each field's unit and range are registered as duration
     * fields unless a unit of the same type was registered explicitly.
     */
    public final FieldSet build()
    {
        Map<DurationFieldType, DurationField> durationFields =
            new LinkedHashMap<DurationFieldType, DurationField>(myDurationFields);
        Map<DateTimeFieldType, DateTimeField> fields =
            new LinkedHashMap<DateTimeFieldType, DateTimeField>();

        for (DateTimeField field : myFields.values())
        {
            registerUnit(durationFields, field.getDurationField());
            registerUnit(durationFields, field.getRangeDurationField());

            if (myStrict)
            {
                field = StrictDateTimeField.getInstance(field);
            }
            fields.put(field.getType(), field);
        }

        return new FieldSet(fields, durationFields);
    }

    private static void registerUnit(Map<DurationFieldType, DurationField> durationFields,
                                     DurationField unit)
    {
        if (unit != null && unit.isSupported() && !durationFields.containsKey(unit.getType()))
        {
            durationFields.put(unit.getType(), unit);
        }
    }


    //=========================================================================

    private static final class Mutable
        extends FieldSetBuilder
    {
        private Mutable(FieldSetBuilder that)
        {
            super(that);
        }

        @Override
        public FieldSetBuilder immutable()
        {
            return new FieldSetBuilder(this);
        }

        @Override
        public FieldSetBuilder mutable()
        {
            return this;
        }

        @Override
        void mutationCheck()
        {
        }
    }
}
