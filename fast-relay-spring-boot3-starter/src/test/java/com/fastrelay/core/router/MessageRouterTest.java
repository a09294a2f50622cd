package com.fastrelay.core.router;

import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.backoff.BackoffRegistry;
import com.fastrelay.core.backoff.RetryScheduler;
import com.fastrelay.core.dlq.DeadLetterManager;
import com.fastrelay.core.dlq.InMemoryDeadLetterStore;
import com.fastrelay.core.failure.RouterFailureClassifier;
import com.fastrelay.core.failure.classifier.CircuitOpenCaseHandler;
import com.fastrelay.core.failure.classifier.ClassifiedCaseHandler;
import com.fastrelay.core.failure.classifier.PermanentCaseHandler;
import com.fastrelay.core.failure.classifier.TimeoutCaseHandler;
import com.fastrelay.core.failure.classifier.UnknownCaseHandler;
import com.fastrelay.core.guard.CircuitBreakerGuard;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.tracker.DeliveryTracker;
import com.fastrelay.core.tracker.RetryHeaders;
import com.fastrelay.core.transform.IdentityTransformer;
import com.fastrelay.core.transform.JsonPayloadTransformer;
import com.fastrelay.core.transform.TransformationRegistry;
import com.fastrelay.exception.MessageHandlingException;
import com.fastrelay.exception.PermanentMessageException;
import com.fastrelay.exception.PublishException;
import com.fastrelay.model.AckHandle;
import com.fastrelay.model.DeadLetterFilter;
import com.fastrelay.model.DeadLetterRecord;
import com.fastrelay.model.Delivery;
import com.fastrelay.model.FailureEntry;
import com.fastrelay.model.Message;
import com.fastrelay.model.RetryPolicy;
import com.fastrelay.model.RetryState;
import com.fastrelay.model.enums.RoutingOutcome;
import com.fastrelay.support.ScriptedHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("MessageRouter")
class MessageRouterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Broker broker;

    private DeliveryTracker tracker;

    private RetryPolicy policy;

    private RelayGuardProperties guardProps;

    private TransformationRegistry transforms;

    private InMemoryDeadLetterStore store;

    private RelayMetrics metrics;

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        broker = mock(Broker.class);
        tracker = new DeliveryTracker();
        policy = RetryPolicy.builder()
                .maxRetries(3)
                .initialInterval(Duration.ofSeconds(1))
                .maxInterval(Duration.ofMinutes(1))
                .multiplier(2.0)
                .jitterFactor(0)
                .build();
        guardProps = new RelayGuardProperties();
        guardProps.getCircuitBreaker().setFailureThreshold(100);
        metrics = RelayMetrics.simple();
        transforms = new TransformationRegistry(new IdentityTransformer(), metrics);
        store = new InMemoryDeadLetterStore();
        router = newRouter();
    }

    private MessageRouter newRouter() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RelayProperties.Destinations destinations = new RelayProperties.Destinations();
        CircuitBreakerGuard guard = new CircuitBreakerGuard(guardProps, NotifyingFacade.disabled(), metrics, "test-node");
        RouterFailureClassifier classifier = new RouterFailureClassifier(List.of(
                new CircuitOpenCaseHandler(), new PermanentCaseHandler(), new ClassifiedCaseHandler(),
                new TimeoutCaseHandler(), new UnknownCaseHandler()));
        DeadLetterManager deadLetters = new DeadLetterManager(broker, store, tracker, destinations, policy,
                NotifyingFacade.disabled(), metrics, clock, "test-node");
        return new MessageRouter(broker, tracker, new RetryScheduler(new BackoffRegistry()), policy, guard,
                classifier, transforms, deadLetters, destinations, NotifyingFacade.disabled(), metrics, clock,
                "test-node");
    }

    private final AtomicInteger tags = new AtomicInteger();

    private Delivery delivery(Message m) {
        return new Delivery(m, new AckHandle("main", "tag-" + tags.incrementAndGet()));
    }

    private Message atAttempt(Message m, int attempt) {
        RetryState s = RetryState.initial();
        for (int i = 0; i < attempt; i++) {
            s = s.nextFailure(NOW.minusSeconds(60 - i), "timeout");
        }
        return tracker.stamp(m, s);
    }

    private Message capturePublished(String destination) throws PublishException {
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(broker).publish(eq(destination), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("success acknowledges and publishes nothing")
    void successAcks() throws Exception {
        Delivery d = delivery(Message.of("{}"));

        RoutingOutcome outcome = router.handle(d, ScriptedHandler.succeeding("orders"));

        assertThat(outcome).isEqualTo(RoutingOutcome.ACKNOWLEDGED);
        verify(broker).ack(d.getHandle());
        verify(broker, never()).publish(any(), any());
        assertThat(metrics.count("relay.ack")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("transient failure republishes to retry.0 with updated metadata, then acks")
    void transientFailureRetries() throws Exception {
        Delivery d = delivery(Message.of("{}"));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        assertThat(outcome).isEqualTo(RoutingOutcome.RETRIED);
        Message out = capturePublished("retry.0");
        RetryState s = tracker.read(out);
        assertThat(s.getAttempt()).isEqualTo(1);
        assertThat(s.getFirstFailureAt()).isEqualTo(NOW);
        assertThat(s.getLastErrorClass()).isEqualTo("timeout");
        assertThat(s.getFailureHistory()).containsExactly(new FailureEntry(NOW, "timeout", 0));
        assertThat(out.getAttribute(RetryHeaders.RETRY_DELAY_MS)).isEqualTo("1000");
        verify(broker).ack(d.getHandle());
    }

    @Test
    @DisplayName("delays follow 1s, 2s, 4s as the message moves through the retry levels")
    void retryLevelsAndDelays() throws Exception {
        ScriptedHandler handler = ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow"));
        Message current = Message.of("{}");
        List<String> delays = new ArrayList<>();

        for (int level = 0; level < 3; level++) {
            broker = mock(Broker.class);
            router = newRouter();
            router.handle(delivery(current), handler);
            current = capturePublished("retry." + level);
            delays.add(current.getAttribute(RetryHeaders.RETRY_DELAY_MS));
        }

        assertThat(delays).containsExactly("1000", "2000", "4000");
        assertThat(tracker.read(current).getAttempt()).isEqualTo(3);
    }

    @Test
    @DisplayName("exhausting every attempt produces exactly one dead-letter record")
    void exhaustionDeadLettersOnce() throws Exception {
        ScriptedHandler handler = ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow"));
        Message current = Message.of("{\"order\":42}");
        List<RoutingOutcome> outcomes = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            broker = mock(Broker.class);
            router = newRouter();
            RoutingOutcome o = router.handle(delivery(current), handler);
            outcomes.add(o);
            if (o == RoutingOutcome.RETRIED) {
                current = capturePublished("retry." + i);
            }
        }

        assertThat(outcomes).containsExactly(RoutingOutcome.RETRIED, RoutingOutcome.RETRIED,
                RoutingOutcome.RETRIED, RoutingOutcome.DEAD_LETTERED);
        List<DeadLetterRecord> records = store.list(DeadLetterFilter.all());
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getFailureHistory())
                .extracting(FailureEntry::getAttempt)
                .containsExactly(0, 1, 2, 3);
        assertThat(records.get(0).getOriginalMessage().getPayloadAsString()).isEqualTo("{\"order\":42}");
        verify(broker, never()).publish(eq("retry.3"), any());
        verify(broker).publish(eq("dead-letter"), any());
    }

    @Test
    @DisplayName("a message at attempt == maxRetries never enters a retry destination")
    void terminalAttemptGoesToDeadLetter() throws Exception {
        Delivery d = delivery(atAttempt(Message.of("{}"), 3));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        assertThat(outcome).isEqualTo(RoutingOutcome.DEAD_LETTERED);
        Message dead = capturePublished("dead-letter");
        assertThat(dead.getAttribute(RetryHeaders.RETRY_DELAY_MS)).isNull();
        verify(broker).ack(d.getHandle());
        assertThat(store.countPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("permanent failure dead-letters on the first attempt")
    void permanentDeadLettersImmediately() throws Exception {
        Delivery d = delivery(Message.of("not json"));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new PermanentMessageException("bad_json", "malformed")));

        assertThat(outcome).isEqualTo(RoutingOutcome.DEAD_LETTERED);
        DeadLetterRecord r = store.list(DeadLetterFilter.all()).get(0);
        assertThat(r.getErrorClass()).isEqualTo("bad_json");
        assertThat(r.getFailureHistory()).hasSize(1);
        verify(broker, never()).publish(eq("retry.0"), any());
    }

    @Test
    @DisplayName("retry publish failure nacks with requeue and never acks")
    void publishFailureRequeues() throws Exception {
        doThrow(new PublishException("retry.0", "broker down")).when(broker).publish(eq("retry.0"), any());
        Delivery d = delivery(Message.of("{}"));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        assertThat(outcome).isEqualTo(RoutingOutcome.REQUEUED);
        verify(broker).nack(d.getHandle(), true);
        verify(broker, never()).ack(any());
    }

    @Test
    @DisplayName("unreachable dead-letter destination requeues and stores nothing")
    void deadLetterPublishFailureRequeues() throws Exception {
        doThrow(new PublishException("dead-letter", "broker down")).when(broker).publish(eq("dead-letter"), any());
        Delivery d = delivery(atAttempt(Message.of("{}"), 3));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        assertThat(outcome).isEqualTo(RoutingOutcome.REQUEUED);
        assertThat(store.countPending()).isZero();
        verify(broker).nack(d.getHandle(), true);
        verify(broker, never()).ack(any());
    }

    @Test
    @DisplayName("open circuit defers to the same level without spending an attempt or calling the handler")
    void circuitOpenDefersWithoutConsumingAttempt() throws Exception {
        guardProps.getCircuitBreaker().setFailureThreshold(1);
        guardProps.getCircuitBreaker().setResetTimeout(Duration.ofMinutes(5));
        router = newRouter();
        ScriptedHandler handler = ScriptedHandler.failing("payments", new MessageHandlingException("timeout", "slow"));

        router.handle(delivery(Message.of("first")), handler);
        Delivery second = delivery(atAttempt(Message.of("second"), 1));
        RoutingOutcome outcome = router.handle(second, handler);

        assertThat(outcome).isEqualTo(RoutingOutcome.RETRIED);
        assertThat(handler.invocations()).isEqualTo(1);
        Message deferred = capturePublished("retry.1");
        RetryState s = tracker.read(deferred);
        assertThat(s.getAttempt()).isEqualTo(1);
        assertThat(s.getLastErrorClass()).isEqualTo("circuit_open");
        assertThat(s.getFailureHistory()).hasSize(1);
        assertThat(deferred.getAttribute(RetryHeaders.RETRY_DELAY_MS)).isEqualTo("2000");
        assertThat(deferred.getPayloadAsString()).isEqualTo("second");
        verify(broker).ack(second.getHandle());
        assertThat(metrics.count("relay.circuit.rejected")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("open circuit on a terminal attempt requeues instead of retrying")
    void circuitOpenOnTerminalAttemptRequeues() throws Exception {
        guardProps.getCircuitBreaker().setFailureThreshold(1);
        guardProps.getCircuitBreaker().setResetTimeout(Duration.ofMinutes(5));
        router = newRouter();
        ScriptedHandler handler = ScriptedHandler.failing("payments", new MessageHandlingException("timeout", "slow"));
        router.handle(delivery(Message.of("first")), handler);

        Delivery terminal = delivery(atAttempt(Message.of("late"), 3));
        RoutingOutcome outcome = router.handle(terminal, handler);

        assertThat(outcome).isEqualTo(RoutingOutcome.REQUEUED);
        verify(broker).nack(terminal.getHandle(), true);
        verify(broker, never()).publish(eq("retry.3"), any());
    }

    @Test
    @DisplayName("schema_version transformer upgrades the payload and the retry succeeds")
    void schemaVersionTransformation() throws Exception {
        transforms.register("schema_version", new JsonPayloadTransformer(Set.of("schema_version"),
                (node, err) -> node.put("v", 2)));
        router = newRouter();
        ScriptedHandler handler = new ScriptedHandler("orders", (payload, message) -> {
            if (message.getPayloadAsString().contains("\"v\":1")) {
                throw new MessageHandlingException("schema_version", "v1 no longer supported");
            }
        });

        RoutingOutcome first = router.handle(delivery(Message.of("{\"v\":1}")), handler);
        Message upgraded = capturePublished("retry.0");
        RoutingOutcome second = router.handle(new Delivery(upgraded, new AckHandle("retry.0", "tag-2")), handler);

        assertThat(first).isEqualTo(RoutingOutcome.RETRIED);
        assertThat(upgraded.getPayloadAsString()).isEqualTo("{\"v\":2}");
        assertThat(second).isEqualTo(RoutingOutcome.ACKNOWLEDGED);
        assertThat(handler.invocations()).isEqualTo(2);
    }

    @Test
    @DisplayName("duplicate deliveries of the same message produce the same decision")
    void idempotentDecisions() throws Exception {
        ScriptedHandler handler = ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow"));
        Message m = atAttempt(Message.of("{}"), 1);

        RoutingOutcome a = router.handle(delivery(m), handler);
        RoutingOutcome b = router.handle(delivery(m), handler);

        assertThat(a).isEqualTo(b).isEqualTo(RoutingOutcome.RETRIED);
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(broker, times(2)).publish(eq("retry.1"), captor.capture());
        assertThat(captor.getAllValues().get(0)).isEqualTo(captor.getAllValues().get(1));
    }

    @Test
    @DisplayName("an interrupted handler is abandoned unacked for redelivery")
    void interruptedHandlerIsAbandoned() throws Exception {
        Delivery d = delivery(Message.of("{}"));
        try {
            RoutingOutcome outcome = router.handle(d,
                    ScriptedHandler.failing("orders", new InterruptedException("shutdown")));

            assertThat(outcome).isEqualTo(RoutingOutcome.REQUEUED);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(broker).nack(d.getHandle(), true);
            verify(broker, never()).ack(any());
            verify(broker, never()).publish(any(), any());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("requeue never publishes a second copy")
    void requeueOnlyNacks() throws Exception {
        doThrow(new PublishException("retry.0", "down")).when(broker).publish(eq("retry.0"), any());

        router.handle(delivery(Message.of("{}")),
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        verify(broker, times(1)).nack(any(), anyBoolean());
        assertThat(metrics.count("relay.requeue")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a handler throwing an Error is retried like any other failure")
    void handlerErrorIsRetried() throws Exception {
        Delivery d = delivery(Message.of("{\"id\":7}"));
        ScriptedHandler handler = new ScriptedHandler("orders", (p, m) -> {
            throw new AssertionError("bad");
        });

        RoutingOutcome outcome = router.handle(d, handler);

        assertThat(outcome).isEqualTo(RoutingOutcome.RETRIED);
        Message retried = capturePublished("retry.0");
        assertThat(tracker.read(retried).getAttempt()).isEqualTo(1);
        assertThat(tracker.read(retried).getLastErrorClass()).isEqualTo("AssertionError");
        verify(broker).ack(d.getHandle());
        verify(broker, never()).nack(any(), anyBoolean());
    }

    @Test
    @DisplayName("a transformer throwing an Error falls back to the original payload")
    void transformerErrorKeepsPayload() throws Exception {
        transforms.register("boom", (payload, error) -> {
            throw new StackOverflowError();
        });
        Delivery d = delivery(Message.of("{\"deep\":true}"));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("boom", "nested too deep")));

        assertThat(outcome).isEqualTo(RoutingOutcome.RETRIED);
        assertThat(capturePublished("retry.0").getPayloadAsString()).isEqualTo("{\"deep\":true}");
        assertThat(metrics.count("relay.transform.failed")).isEqualTo(1.0);
        verify(broker).ack(d.getHandle());
    }

    @Test
    @DisplayName("an unexpected routing error nacks for redelivery instead of stranding the message")
    void routingErrorRequeues() throws Exception {
        doThrow(new IllegalStateException("store full")).when(broker).publish(eq("retry.0"), any());
        Delivery d = delivery(Message.of("{}"));

        RoutingOutcome outcome = router.handle(d,
                ScriptedHandler.failing("orders", new MessageHandlingException("timeout", "slow")));

        assertThat(outcome).isEqualTo(RoutingOutcome.REQUEUED);
        verify(broker).nack(d.getHandle(), true);
        verify(broker, never()).ack(any());
    }
}
