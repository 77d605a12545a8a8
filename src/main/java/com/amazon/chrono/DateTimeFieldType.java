// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

import static com.amazon.chrono.DurationFieldType.CENTURIES;
import static com.amazon.chrono.DurationFieldType.DAYS;
import static com.amazon.chrono.DurationFieldType.ERAS;
import static com.amazon.chrono.DurationFieldType.HALFDAYS;
import static com.amazon.chrono.DurationFieldType.HOURS;
import static com.amazon.chrono.DurationFieldType.MILLIS;
import static com.amazon.chrono.DurationFieldType.MINUTES;
import static com.amazon.chrono.DurationFieldType.MONTHS;
import static com.amazon.chrono.DurationFieldType.SECONDS;
import static com.amazon.chrono.DurationFieldType.WEEKS;
import static com.amazon.chrono.DurationFieldType.WEEKYEARS;
import static com.amazon.chrono.DurationFieldType.YEARS;

import java.util.Objects;


/**
 * Identifies a calendar component, such as "month of year", by its name,
 * the unit it counts and the range within which it counts.
 * <p>
 * The unit of "month of year" is months and its range is years; a field
 * with no enclosing range (such as "year" or "era") has a null range type.
 * Two types are equal when their name, unit and range are equal.
 * <p>
 * Instances of this class are immutable and safe for use by multiple threads.
 */
public final class DateTimeFieldType
{
    public static final DateTimeFieldType ERA =
        new DateTimeFieldType("era", ERAS, null);
    public static final DateTimeFieldType YEAR_OF_ERA =
        new DateTimeFieldType("yearOfEra", YEARS, ERAS);
    public static final DateTimeFieldType CENTURY_OF_ERA =
        new DateTimeFieldType("centuryOfEra", CENTURIES, ERAS);
    public static final DateTimeFieldType YEAR_OF_CENTURY =
        new DateTimeFieldType("yearOfCentury", YEARS, CENTURIES);
    public static final DateTimeFieldType YEAR =
        new DateTimeFieldType("year", YEARS, null);
    public static final DateTimeFieldType DAY_OF_YEAR =
        new DateTimeFieldType("dayOfYear", DAYS, YEARS);
    public static final DateTimeFieldType MONTH_OF_YEAR =
        new DateTimeFieldType("monthOfYear", MONTHS, YEARS);
    public static final DateTimeFieldType DAY_OF_MONTH =
        new DateTimeFieldType("dayOfMonth", DAYS, MONTHS);
    public static final DateTimeFieldType WEEKYEAR_OF_CENTURY =
        new DateTimeFieldType("weekyearOfCentury", WEEKYEARS, CENTURIES);
    public static final DateTimeFieldType WEEKYEAR =
        new DateTimeFieldType("weekyear", WEEKYEARS, null);
    public static final DateTimeFieldType WEEK_OF_WEEKYEAR =
        new DateTimeFieldType("weekOfWeekyear", WEEKS, WEEKYEARS);
    public static final DateTimeFieldType DAY_OF_WEEK =
        new DateTimeFieldType("dayOfWeek", DAYS, WEEKS);
    public static final DateTimeFieldType HALFDAY_OF_DAY =
        new DateTimeFieldType("halfdayOfDay", HALFDAYS, DAYS);
    public static final DateTimeFieldType HOUR_OF_HALFDAY =
        new DateTimeFieldType("hourOfHalfday", HOURS, HALFDAYS);
    public static final DateTimeFieldType CLOCKHOUR_OF_HALFDAY =
        new DateTimeFieldType("clockhourOfHalfday", HOURS, HALFDAYS);
    public static final DateTimeFieldType CLOCKHOUR_OF_DAY =
        new DateTimeFieldType("clockhourOfDay", HOURS, DAYS);
    public static final DateTimeFieldType HOUR_OF_DAY =
        new DateTimeFieldType("hourOfDay", HOURS, DAYS);
    public static final DateTimeFieldType MINUTE_OF_DAY =
        new DateTimeFieldType("minuteOfDay", MINUTES, DAYS);
    public static final DateTimeFieldType MINUTE_OF_HOUR =
        new DateTimeFieldType("minuteOfHour", MINUTES, HOURS);
    public static final DateTimeFieldType SECOND_OF_DAY =
        new DateTimeFieldType("secondOfDay", SECONDS, DAYS);
    public static final DateTimeFieldType SECOND_OF_MINUTE =
        new DateTimeFieldType("secondOfMinute", SECONDS, MINUTES);
    public static final DateTimeFieldType MILLIS_OF_DAY =
        new DateTimeFieldType("millisOfDay", MILLIS, DAYS);
    public static final DateTimeFieldType MILLIS_OF_SECOND =
        new DateTimeFieldType("millisOfSecond", MILLIS, SECONDS);

    private static final DateTimeFieldType[] STANDARD = {
        ERA, YEAR_OF_ERA, CENTURY_OF_ERA, YEAR_OF_CENTURY, YEAR,
        DAY_OF_YEAR, MONTH_OF_YEAR, DAY_OF_MONTH,
        WEEKYEAR_OF_CENTURY, WEEKYEAR, WEEK_OF_WEEKYEAR, DAY_OF_WEEK,
        HALFDAY_OF_DAY, HOUR_OF_HALFDAY, CLOCKHOUR_OF_HALFDAY,
        CLOCKHOUR_OF_DAY, HOUR_OF_DAY, MINUTE_OF_DAY, MINUTE_OF_HOUR,
        SECOND_OF_DAY, SECOND_OF_MINUTE, MILLIS_OF_DAY, MILLIS_OF_SECOND
    };


    /**
     * Creates a field type that none of the standard constants describe,
     * such as "quarter of year".
     *
     * @param name the name of the field; must not be null or empty.
     * @param durationType the unit of the field; must not be null.
     * @param rangeType the unit of the enclosing range, or null if the field
     * is unbounded.
     *
     * @throws IllegalArgumentException if {@code name} is empty or
     * {@code durationType} is null.
     */
    public static DateTimeFieldType custom(String name,
                                           DurationFieldType durationType,
                                           DurationFieldType rangeType)
    {
        if (name == null || name.isEmpty())
        {
            throw new IllegalArgumentException("The name must not be empty");
        }
        if (durationType == null)
        {
            throw new IllegalArgumentException("The duration type must not be null");
        }
        return new DateTimeFieldType(name, durationType, rangeType);
    }

    /**
     * Returns the standard types, in order from era down to millisecond.
     */
    public static DateTimeFieldType[] standardTypes()
    {
        return STANDARD.clone();
    }


    //=========================================================================

    private final String myName;
    private final DurationFieldType myDurationType;
    private final DurationFieldType myRangeDurationType;

    private DateTimeFieldType(String name,
                              DurationFieldType durationType,
                              DurationFieldType rangeType)
    {
        myName = name;
        myDurationType = durationType;
        myRangeDurationType = rangeType;
    }

    /**
     * Gets the name of this field, for example "monthOfYear".
     */
    public String getName()
    {
        return myName;
    }

    /**
     * Gets the unit counted by this field.
     */
    public DurationFieldType getDurationType()
    {
        return myDurationType;
    }

    /**
     * Gets the unit of the range this field counts within.
     *
     * @return the range unit, or null if the field is unbounded.
     */
    public DurationFieldType getRangeDurationType()
    {
        return myRangeDurationType;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof DateTimeFieldType)) return false;
        DateTimeFieldType that = (DateTimeFieldType) other;
        return myName.equals(that.myName)
            && myDurationType.equals(that.myDurationType)
            && Objects.equals(myRangeDurationType, that.myRangeDurationType);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(myName, myDurationType, myRangeDurationType);
    }

    @Override
    public String toString()
    {
        return myName;
    }
}
