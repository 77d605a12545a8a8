// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * The time-zone capability a {@linkplain com.amazon.chrono.field.LenientDateTimeField
 * lenient field} needs from the calendar it belongs to.
 * <p>
 * Local instants are milliseconds on the calendar's local time line; UTC
 * instants are milliseconds from the epoch. The fields returned by
 * {@link #getLocalField(DateTimeFieldType)} operate on local instants with no
 * zone adjustment.
 */
public interface ZonedFieldContext
{
    /**
     * Converts a UTC instant to a local instant.
     */
    public long convertUTCToLocal(long instant);

    /**
     * Converts a local instant back to a UTC instant.
     *
     * @param localInstant the local instant to convert.
     * @param strict whether a local instant that falls in a zone transition
     * gap must be rejected rather than adjusted.
     * @param originalInstant the UTC instant the local instant was derived
     * from, used to resolve ambiguous local times.
     */
    public long convertLocalToUTC(long localInstant, boolean strict, long originalInstant);

    /**
     * Gets the non-lenient field of the given type that operates on local
     * instants.
     *
     * @throws UnsupportedFieldException if the calendar has no such field.
     */
    public DateTimeField getLocalField(DateTimeFieldType type);
}
