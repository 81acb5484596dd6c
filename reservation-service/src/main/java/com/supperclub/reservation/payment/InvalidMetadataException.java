package com.supperclub.reservation.payment;

/**
 * Checkout metadata is missing or unreadable; the payment cannot be tied to a table.
 */
public class InvalidMetadataException extends RuntimeException {

    public InvalidMetadataException(String message) {
        super(message);
    }

    public InvalidMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
