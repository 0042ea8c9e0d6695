package com.multigallery.core.convert;

/**
 * Thrown when an external document conversion fails.
 */
public class ConversionException extends Exception {

    /**
     * Creates an exception with a message.
     *
     * @param message description of the failure
     */
    public ConversionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message description of the failure
     * @param cause underlying exception
     */
    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
