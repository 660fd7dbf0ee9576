package com.bridgestats.alert;

/**
 * Thrown when the alert webhook rejects or does not answer a post.
 */
public class AlertDeliveryException extends RuntimeException {

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
