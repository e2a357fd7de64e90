package com.z254.butterfly.scout.messaging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Represents a message exchanged between agents (or the orchestrator) through the broker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    /**
     * Unique identifier for this message.
     */
    private String id;

    /**
     * Topic the message is published on.
     */
    private String topic;

    /**
     * Name of the sending agent or component.
     */
    private String sender;

    /**
     * Name of the receiving agent.
     * Null for broadcast messages.
     */
    private String recipient;

    /**
     * Type of message.
     */
    private MessageType type;

    /**
     * Opaque payload.
     */
    private Object payload;

    /**
     * ID of the request this message answers.
     */
    private String replyTo;

    /**
     * When this message was published.
     */
    private Instant timestamp;

    /**
     * Check if this is a broadcast message.
     */
    public boolean isBroadcast() {
        return recipient == null;
    }

    /**
     * Check if this is a reply to another message.
     */
    public boolean isReply() {
        return replyTo != null;
    }

    // Factory methods for common message types

    public static AgentMessage broadcast(String topic, String sender, Object payload) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic)
                .sender(sender)
                .type(MessageType.BROADCAST)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    public static AgentMessage direct(String topic, String sender, String recipient, Object payload) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic)
                .sender(sender)
                .recipient(recipient)
                .type(MessageType.DIRECT)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    public static AgentMessage lifecycle(String topic, String sender, Object payload) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic)
                .sender(sender)
                .type(MessageType.LIFECYCLE)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    public static AgentMessage request(String topic, String sender, String recipient, Object payload) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic)
                .sender(sender)
                .recipient(recipient)
                .type(MessageType.REQUEST)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Create the response to a request, addressed back to the request's sender.
     */
    public static AgentMessage response(AgentMessage request, String sender, Object payload) {
        return AgentMessage.builder()
                .id(UUID.randomUUID().toString())
                .topic(request.getTopic())
                .sender(sender)
                .recipient(request.getSender())
                .replyTo(request.getId())
                .type(MessageType.RESPONSE)
                .payload(payload)
                .timestamp(Instant.now())
                .build();
    }
}
