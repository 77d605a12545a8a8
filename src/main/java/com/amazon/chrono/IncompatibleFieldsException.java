// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;


/**
 * An error caused by an addition to a partial that must carry into a larger
 * field, when there is no larger field or the larger field's unit does not
 * match the range of the field being added to.
 */
public class IncompatibleFieldsException
    extends ChronoException
{
    private static final long serialVersionUID = 1L;


    /**
     * @param message
     */
    public IncompatibleFieldsException(String message)
    {
        super(message);
    }
}
