// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.chrono;

/**
 * Base class for exceptions thrown throughout this library.
 * <p>
 * Arithmetic overflow is reported with {@link ArithmeticException} and invalid
 * construction arguments with {@link IllegalArgumentException}; every other
 * failure raised by a field is a subclass of this type.
 */
public class ChronoException extends RuntimeException
{
    private static final long serialVersionUID = -4613385744532137621L;

    public ChronoException() { super(); }
    public ChronoException(String message) { super(message); }
    public ChronoException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the given cause, copying the message
     * from the cause into this instance.
     * @param cause
     *     the root cause of the exception; must not be null.
     */
    public ChronoException(Throwable cause) { super(cause.getMessage(), cause); }
}
