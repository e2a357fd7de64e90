package com.z254.butterfly.scout.exception;

/**
 * The message broker has been shut down and no longer accepts publishes or subscriptions.
 */
public class BrokerClosedException extends ScoutException {

    public BrokerClosedException() {
        super("Message broker is shut down");
    }
}
