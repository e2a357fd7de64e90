package com.z254.butterfly.scout.messaging;

import com.z254.butterfly.scout.config.ScoutProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.scout.exception.BrokerClosedException;
import com.z254.butterfly.scout.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process message broker for inter-agent communication.
 * Provides reactive message passing between agents with support for:
 * - Point-to-point messaging by recipient name
 * - Topic broadcast messaging
 * - Request/response correlation
 * - Bounded publish history
 */
@Service
@Slf4j
public class InMemoryMessageBroker implements MessageBroker {

    // Subscriptions by key (recipient name or topic)
    private final Map<String, Set<Subscription>> subscriptionsByKey = new ConcurrentHashMap<>();

    // Message history and deduplication
    private final Deque<AgentMessage> history = new ArrayDeque<>();
    private final Set<String> processedMessageIds = ConcurrentHashMap.newKeySet();
    private final int historySize;

    private final Scheduler deliveryScheduler;
    private final StructuredLogger structuredLogger;
    private final Counter publishedCounter;
    private final Counter droppedCounter;
    private final AtomicLong publishedTotal = new AtomicLong();
    private final AtomicLong droppedTotal = new AtomicLong();
    private volatile boolean shutdown;

    public InMemoryMessageBroker() {
        this(new ScoutProperties(), new SimpleMeterRegistry(), new StructuredLogger(new ObjectMapper()));
    }

    @Autowired
    public InMemoryMessageBroker(ScoutProperties scoutProperties, MeterRegistry meterRegistry,
                                 StructuredLogger structuredLogger) {
        this.structuredLogger = structuredLogger;
        this.historySize = Math.max(0, scoutProperties.getBroker().getHistorySize());
        this.deliveryScheduler = Schedulers.boundedElastic();
        this.publishedCounter = Counter.builder("scout.broker.published")
                .description("Total messages published")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("scout.broker.dropped")
                .description("Direct messages dropped for lack of a subscriber")
                .register(meterRegistry);
        log.info("Initialized InMemoryMessageBroker (history size {})", historySize);
    }

    @Override
    public void publish(String topic, Object payload, String sender, String recipient) {
        AgentMessage message = recipient == null
                ? AgentMessage.broadcast(topic, sender, payload)
                : AgentMessage.direct(topic, sender, recipient, payload);
        publish(message);
    }

    @Override
    public void publish(AgentMessage message) {
        if (shutdown) {
            throw new BrokerClosedException();
        }
        if (message == null) {
            return;
        }

        // Validate and prepare message
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        }
        if (message.getType() == null) {
            message.setType(message.getRecipient() == null ? MessageType.BROADCAST : MessageType.DIRECT);
        }

        // Check for duplicates
        if (!processedMessageIds.add(message.getId())) {
            log.debug("Duplicate message ignored: {}", message.getId());
            return;
        }

        storeMessage(message);
        publishedCounter.increment();
        publishedTotal.incrementAndGet();

        int delivered = routeMessage(message);

        if (delivered == 0 && !message.isBroadcast()) {
            droppedCounter.increment();
            droppedTotal.incrementAndGet();
            structuredLogger.logMessageDropped(message.getId(), message.getTopic(), message.getRecipient());
        }

        log.debug("Message published: {} -> {} on '{}' (type: {}, delivered: {})",
                message.getSender(),
                message.getRecipient() != null ? message.getRecipient() : "broadcast",
                message.getTopic(),
                message.getType(),
                delivered);
    }

    @Override
    public Flux<AgentMessage> subscribe(String topicOrRecipient) {
        return subscribe(topicOrRecipient, List.of());
    }

    @Override
    public Flux<AgentMessage> subscribe(String agentName, Collection<String> topics) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(agentName);
        keys.addAll(topics);
        return Flux.defer(() -> {
            if (shutdown) {
                return Flux.error(new BrokerClosedException());
            }
            Subscription subscription = new Subscription(keys);
            keys.forEach(key -> subscriptionsByKey
                    .computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet())
                    .add(subscription));
            if (shutdown) {
                // shutdown() ran between the check above and the registration
                subscription.complete();
                unregister(subscription);
            }
            log.debug("Subscribed to message broker: {}", keys);
            return subscription.sink.asFlux()
                    .publishOn(deliveryScheduler)
                    .doFinally(signal -> {
                        subscription.cancel();
                        unregister(subscription);
                        log.debug("Unsubscribed from message broker: {} ({})", keys, signal);
                    });
        });
    }

    @Override
    public Mono<AgentMessage> request(AgentMessage request, Duration timeout) {
        if (request.getId() == null) {
            request.setId(UUID.randomUUID().toString());
        }
        request.setType(MessageType.REQUEST);
        String requestId = request.getId();

        // The reply subscription is registered before the request goes out
        return subscribe(request.getSender())
                .filter(m -> m.getType() == MessageType.RESPONSE)
                .filter(m -> requestId.equals(m.getReplyTo()))
                .next()
                .doOnSubscribe(s -> publish(request))
                .timeout(timeout, Mono.empty());
    }

    @Override
    public List<AgentMessage> history(String sender, String recipient, String topic) {
        List<AgentMessage> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        return snapshot.stream()
                .filter(m -> sender == null || sender.equals(m.getSender()))
                .filter(m -> recipient == null || recipient.equals(m.getRecipient()))
                .filter(m -> topic == null || topic.equals(m.getTopic()))
                .toList();
    }

    /**
     * Get statistics about the message broker.
     */
    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalMessages", publishedTotal.get());
        stats.put("droppedMessages", droppedTotal.get());
        stats.put("subscriptionKeys", subscriptionsByKey.size());
        synchronized (history) {
            stats.put("storedMessages", history.size());
        }
        stats.put("shutdown", shutdown);
        return stats;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        Set<Subscription> all = new HashSet<>();
        subscriptionsByKey.values().forEach(all::addAll);
        all.forEach(Subscription::complete);
        subscriptionsByKey.clear();
        log.info("Message broker shut down, completed {} subscriptions", all.size());
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private int routeMessage(AgentMessage message) {
        Set<Subscription> targets = new LinkedHashSet<>();
        if (!message.isBroadcast()) {
            // Route to the addressed agent only
            targets.addAll(subscriptionsByKey.getOrDefault(message.getRecipient(), Set.of()));
        } else {
            // Broadcast to topic subscribers and wildcard listeners
            if (message.getTopic() != null) {
                targets.addAll(subscriptionsByKey.getOrDefault(message.getTopic(), Set.of()));
            }
            targets.addAll(subscriptionsByKey.getOrDefault(WILDCARD, Set.of()));
        }

        int delivered = 0;
        for (Subscription subscription : targets) {
            if (subscription.deliver(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    private void storeMessage(AgentMessage message) {
        if (historySize == 0) {
            processedMessageIds.remove(message.getId());
            return;
        }
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historySize) {
                AgentMessage evicted = history.removeFirst();
                processedMessageIds.remove(evicted.getId());
            }
        }
    }

    private void unregister(Subscription subscription) {
        for (String key : subscription.keys) {
            subscriptionsByKey.computeIfPresent(key, (k, set) -> {
                set.remove(subscription);
                return set.isEmpty() ? null : set;
            });
        }
    }

    /**
     * One subscriber. Deliveries are serialized so messages from one publishing thread keep
     * their order.
     */
    private static final class Subscription {

        final Set<String> keys;
        final Sinks.Many<AgentMessage> sink = Sinks.many().unicast().onBackpressureBuffer();
        private boolean cancelled;

        Subscription(Set<String> keys) {
            this.keys = keys;
        }

        synchronized boolean deliver(AgentMessage message) {
            if (cancelled) {
                return false;
            }
            Sinks.EmitResult result = sink.tryEmitNext(message);
            if (result.isFailure()) {
                log.warn("Failed to deliver message {} to {}: {}", message.getId(), keys, result);
                return false;
            }
            return true;
        }

        synchronized void cancel() {
            cancelled = true;
        }

        synchronized void complete() {
            cancelled = true;
            sink.tryEmitComplete();
        }
    }
}
