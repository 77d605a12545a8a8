// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * An error caused by invoking an operation on a field that the assembled
 * calendar does not support.
 *
 * @see DateTimeField#isSupported()
 * @see DurationField#isSupported()
 */
public class UnsupportedFieldException
    extends ChronoException
{
    private static final long serialVersionUID = 1L;

    private final String myFieldName;


    /**
     * @param fieldName the name of the unsupported field.
     */
    public UnsupportedFieldException(String fieldName)
    {
        super(fieldName + " field is unsupported");
        myFieldName = fieldName;
    }

    /**
     * Gets the name of the field that is not supported.
     */
    public String getFieldName()
    {
        return myFieldName;
    }
}
