// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * Identifies a unit of elapsed time, such as "months" or "hours".
 * <p>
 * The standard units are available as constants. Calendars that need a unit
 * this class does not define may create one with {@link #custom(String)}.
 * Two types are equal when their names are equal.
 * <p>
 * Instances of this class are immutable and safe for use by multiple threads.
 */
public final class DurationFieldType
{
    public static final DurationFieldType ERAS      = new DurationFieldType("eras");
    public static final DurationFieldType CENTURIES = new DurationFieldType("centuries");
    public static final DurationFieldType WEEKYEARS = new DurationFieldType("weekyears");
    public static final DurationFieldType YEARS     = new DurationFieldType("years");
    public static final DurationFieldType MONTHS    = new DurationFieldType("months");
    public static final DurationFieldType WEEKS     = new DurationFieldType("weeks");
    public static final DurationFieldType DAYS      = new DurationFieldType("days");
    public static final DurationFieldType HALFDAYS  = new DurationFieldType("halfdays");
    public static final DurationFieldType HOURS     = new DurationFieldType("hours");
    public static final DurationFieldType MINUTES   = new DurationFieldType("minutes");
    public static final DurationFieldType SECONDS   = new DurationFieldType("seconds");
    public static final DurationFieldType MILLIS    = new DurationFieldType("millis");

    private static final DurationFieldType[] STANDARD = {
        ERAS, CENTURIES, WEEKYEARS, YEARS, MONTHS, WEEKS,
        DAYS, HALFDAYS, HOURS, MINUTES, SECONDS, MILLIS
    };


    /**
     * Returns the standard type with the given name, or a new custom type
     * if there is no such standard type.
     *
     * @param name the name of the unit; must not be null or empty.
     *
     * @throws IllegalArgumentException if {@code name} is null or empty.
     */
    public static DurationFieldType custom(String name)
    {
        if (name == null || name.isEmpty())
        {
            throw new IllegalArgumentException("The name must not be empty");
        }
        for (DurationFieldType type : STANDARD)
        {
            if (type.myName.equals(name)) return type;
        }
        return new DurationFieldType(name);
    }

    /**
     * Returns the standard types, largest first.
     */
    public static DurationFieldType[] standardTypes()
    {
        return STANDARD.clone();
    }


    //=========================================================================

    private final String myName;

    private DurationFieldType(String name)
    {
        myName = name;
    }

    /**
     * Gets the name of this unit, for example "months".
     */
    public String getName()
    {
        return myName;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof DurationFieldType)) return false;
        return myName.equals(((DurationFieldType) other).myName);
    }

    @Override
    public int hashCode()
    {
        return myName.hashCode();
    }

    @Override
    public String toString()
    {
        return myName;
    }
}
