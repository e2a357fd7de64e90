package com.z254.butterfly.scout.messaging;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Topic-based publish/subscribe bus with point-to-point delivery by recipient name.
 *
 * <p>A message without a recipient is delivered to every subscription registered for its topic
 * (and to {@link #WILDCARD} subscriptions). A message with a recipient is delivered only to
 * subscriptions registered under that name, whatever its topic; if there is none it is dropped.
 * Delivery is at most once per subscription per publish, and in publish order for a given
 * sender and subscriber.
 */
public interface MessageBroker {

    /**
     * Subscription key that receives every broadcast.
     */
    String WILDCARD = "*";

    /**
     * Publish a message. Fire-and-forget.
     *
     * @param topic     the topic
     * @param payload   the payload
     * @param sender    the sender identity
     * @param recipient the recipient name, or null to broadcast
     * @throws com.z254.butterfly.scout.exception.BrokerClosedException if the broker is shut down
     */
    void publish(String topic, Object payload, String sender, String recipient);

    /**
     * Broadcast a message on a topic.
     */
    default void publish(String topic, Object payload, String sender) {
        publish(topic, payload, sender, null);
    }

    /**
     * Publish a prepared message. Missing id, timestamp and type are filled in; a message whose
     * id was already published is ignored.
     */
    void publish(AgentMessage message);

    /**
     * Subscribe under a single key, acting both as recipient name and as topic.
     *
     * @param topicOrRecipient the key
     * @return stream of messages, registered on subscribe and running until cancelled
     */
    Flux<AgentMessage> subscribe(String topicOrRecipient);

    /**
     * Subscribe as an agent: direct messages addressed to the agent plus broadcasts on the
     * given topics, each publish delivered at most once.
     *
     * @param agentName the recipient name
     * @param topics    topics to receive broadcasts for
     * @return stream of messages, registered on subscribe and running until cancelled
     */
    Flux<AgentMessage> subscribe(String agentName, Collection<String> topics);

    /**
     * Publish a request and wait for the first response whose {@code replyTo} is the request id.
     *
     * @param request the request; its sender receives the response
     * @param timeout how long to wait
     * @return the response, or empty on timeout
     */
    Mono<AgentMessage> request(AgentMessage request, Duration timeout);

    /**
     * Published messages still held in the bounded history, oldest first.
     * Null filters match everything.
     */
    List<AgentMessage> history(String sender, String recipient, String topic);

    /**
     * Get statistics about the broker.
     */
    Map<String, Object> getStats();

    boolean isShutdown();

    /**
     * Complete every subscription and refuse further publishes.
     */
    void shutdown();
}
