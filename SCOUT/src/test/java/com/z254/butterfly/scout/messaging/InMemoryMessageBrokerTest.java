package com.z254.butterfly.scout.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.exception.BrokerClosedException;
import com.z254.butterfly.scout.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for InMemoryMessageBroker.
 */
class InMemoryMessageBrokerTest {

    private SimpleMeterRegistry meterRegistry;
    private InMemoryMessageBroker broker;

    @BeforeEach
    void setUp() {
        ScoutProperties properties = new ScoutProperties();
        properties.getBroker().setHistorySize(3);
        meterRegistry = new SimpleMeterRegistry();
        broker = new InMemoryMessageBroker(properties, meterRegistry, new StructuredLogger(new ObjectMapper()));
    }

    @Test
    void shouldDeliverBroadcastToTopicSubscribers() {
        // Given
        Flux<AgentMessage> first = broker.subscribe("repo/ready");
        Flux<AgentMessage> second = broker.subscribe("security_analyst", List.of("repo/ready"));

        // Then
        StepVerifier.create(Flux.merge(first.take(1), second.take(1)))
                .then(() -> broker.publish("repo/ready", Map.of("files", 3), "repository_cloner"))
                .assertNext(message -> assertThat(message.getPayload()).isEqualTo(Map.of("files", 3)))
                .assertNext(message -> {
                    assertThat(message.getType()).isEqualTo(MessageType.BROADCAST);
                    assertThat(message.getSender()).isEqualTo("repository_cloner");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldRouteDirectMessagesOnlyToRecipient() {
        // Given
        Flux<AgentMessage> recipient = broker.subscribe("reporter", List.of("notes"));

        // Then
        StepVerifier.create(recipient.take(1))
                .then(() -> {
                    broker.publish("notes", "for someone else", "code_reviewer", "security_analyst");
                    broker.publish("notes", "for the reporter", "code_reviewer", "reporter");
                })
                .assertNext(message -> {
                    assertThat(message.getPayload()).isEqualTo("for the reporter");
                    assertThat(message.getType()).isEqualTo(MessageType.DIRECT);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldCountDirectMessagesWithoutRecipientAsDropped() {
        // When
        broker.publish("notes", "nobody listens", "code_reviewer", "missing_agent");

        // Then
        assertThat(broker.getStats()).containsEntry("droppedMessages", 1L);
        assertThat(meterRegistry.counter("scout.broker.dropped").count()).isEqualTo(1.0);
    }

    @Test
    void shouldDeliverEveryBroadcastToWildcard() {
        StepVerifier.create(broker.subscribe(MessageBroker.WILDCARD).take(2))
                .then(() -> {
                    broker.publish("a", 1, "x");
                    broker.publish("b", 2, "y");
                })
                .assertNext(message -> assertThat(message.getTopic()).isEqualTo("a"))
                .assertNext(message -> assertThat(message.getTopic()).isEqualTo("b"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldDeliverOnceWhenSubscribedUnderSeveralMatchingKeys() {
        Flux<AgentMessage> subscription = broker.subscribe("reporter", List.of("repo/ready", MessageBroker.WILDCARD));

        StepVerifier.create(subscription.take(Duration.ofMillis(500)))
                .then(() -> broker.publish("repo/ready", "once", "repository_cloner"))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldIgnoreDuplicateMessageIds() {
        // Given
        AgentMessage message = AgentMessage.broadcast("topic", "sender", "payload");

        // When
        broker.publish(message);
        broker.publish(message);

        // Then
        assertThat(broker.history(null, null, "topic")).hasSize(1);
        assertThat(broker.getStats()).containsEntry("totalMessages", 1L);
    }

    @Test
    void shouldKeepBoundedFilterableHistory() {
        broker.publish("t1", 1, "a");
        broker.publish("t2", 2, "b");
        broker.publish("t1", 3, "a");
        broker.publish("t1", 4, "b");

        assertThat(broker.history(null, null, null)).hasSize(3);
        assertThat(broker.history("a", null, "t1"))
                .extracting(AgentMessage::getPayload)
                .containsExactly(3);
    }

    @Test
    void shouldReturnFirstMatchingResponse() {
        // Given
        broker.subscribe("security_analyst")
                .filter(message -> message.getType() == MessageType.REQUEST)
                .subscribe(request -> broker.publish(AgentMessage.response(request, "security_analyst", "HIGH")));

        // When
        AgentMessage request = AgentMessage.request("risk", "reporter", "security_analyst", "risk level?");

        // Then
        StepVerifier.create(broker.request(request, Duration.ofSeconds(5)))
                .assertNext(response -> {
                    assertThat(response.getPayload()).isEqualTo("HIGH");
                    assertThat(response.getReplyTo()).isEqualTo(request.getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldCompleteEmptyWhenRequestTimesOut() {
        AgentMessage request = AgentMessage.request("risk", "reporter", "nobody", "hello?");

        StepVerifier.create(broker.request(request, Duration.ofMillis(100)))
                .verifyComplete();
    }

    @Test
    void shouldCompleteSubscriptionsAndRejectPublishesAfterShutdown() {
        StepVerifier.create(broker.subscribe("topic"))
                .then(broker::shutdown)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(broker.isShutdown()).isTrue();
        assertThatThrownBy(() -> broker.publish("topic", "late", "sender"))
                .isInstanceOf(BrokerClosedException.class);
    }

    @Test
    void shouldDeliverMessagesFromOneSenderInPublishOrder() {
        // Given
        Flux<AgentMessage> recipient = broker.subscribe("reporter", List.of("progress"));

        // Then
        StepVerifier.create(recipient.map(AgentMessage::getPayload).take(50).collectList())
                .then(() -> {
                    for (int i = 0; i < 50; i++) {
                        broker.publish("progress", i, "code_reviewer", i % 2 == 0 ? null : "reporter");
                    }
                })
                .assertNext(payloads -> assertThat(payloads)
                        .containsExactlyElementsOf(IntStream.range(0, 50).boxed().toList()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldTerminateSubscriptionsRacingShutdown() throws Exception {
        ScoutProperties properties = new ScoutProperties();
        StructuredLogger structuredLogger = new StructuredLogger(new ObjectMapper());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            for (int i = 0; i < 200; i++) {
                InMemoryMessageBroker racing = new InMemoryMessageBroker(properties, new SimpleMeterRegistry(),
                        structuredLogger);
                CountDownLatch terminated = new CountDownLatch(1);
                Future<?> subscriber = executor.submit(() -> racing.subscribe("late_agent")
                        .doFinally(signal -> terminated.countDown())
                        .subscribe(message -> { }, error -> { }));
                racing.shutdown();
                subscriber.get(5, TimeUnit.SECONDS);

                assertThat(terminated.await(5, TimeUnit.SECONDS))
                        .as("subscription %d terminated", i)
                        .isTrue();
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
