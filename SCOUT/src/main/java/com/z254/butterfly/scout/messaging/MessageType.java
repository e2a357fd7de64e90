package com.z254.butterfly.scout.messaging;

/**
 * Types of messages exchanged through the broker.
 */
public enum MessageType {

    /**
     * Delivered to every subscriber of the topic.
     */
    BROADCAST,

    /**
     * Delivered only to the named recipient.
     */
    DIRECT,

    /**
     * Orchestrator announcement of an agent or run state change.
     */
    LIFECYCLE,

    /**
     * Request expecting a {@link #RESPONSE} addressed back to the sender.
     */
    REQUEST,

    /**
     * Response to a request; {@code replyTo} holds the request id.
     */
    RESPONSE
}
