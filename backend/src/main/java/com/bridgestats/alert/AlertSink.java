package com.bridgestats.alert;

/**
 * Outbound alert delivery.
 */
public interface AlertSink {

    /**
     * Deliver the message unless an identical one was delivered recently.
     *
     * @return true when the message was posted, false when suppressed as a duplicate
     * @throws AlertDeliveryException when delivery fails; the message is not marked as delivered
     */
    boolean send(AlertMessage message);
}
