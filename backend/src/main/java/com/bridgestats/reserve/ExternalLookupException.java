package com.bridgestats.reserve;

/**
 * Thrown when an external custody balance cannot be fetched or parsed.
 */
public class ExternalLookupException extends RuntimeException {

    public ExternalLookupException(String message) {
        super(message);
    }

    public ExternalLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
