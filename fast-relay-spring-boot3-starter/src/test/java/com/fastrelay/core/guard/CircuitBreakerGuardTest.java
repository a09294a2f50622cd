package com.fastrelay.core.guard;

import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.AsyncNotifyingService;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.exception.CircuitOpenException;
import com.fastrelay.exception.MessageHandlingException;
import com.fastrelay.exception.PermanentMessageException;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.BreakerState;
import com.fastrelay.model.enums.NotifyEventType;
import com.fastrelay.model.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("CircuitBreakerGuard")
class CircuitBreakerGuardTest {

    private static final Duration RESET = Duration.ofMillis(200);

    private RelayGuardProperties props;

    private AsyncNotifyingService notifyService;

    private RelayMetrics metrics;

    private CircuitBreakerGuard guard;

    @BeforeEach
    void setUp() {
        props = new RelayGuardProperties();
        props.getCircuitBreaker().setFailureThreshold(3);
        props.getCircuitBreaker().setResetTimeout(RESET);
        notifyService = mock(AsyncNotifyingService.class);
        metrics = RelayMetrics.simple();
        guard = new CircuitBreakerGuard(props, new NotifyingFacade(() -> notifyService), metrics, "test-node");
    }

    private void failOnce(String key) {
        assertThatThrownBy(() -> guard.execute(key, () -> {
            throw new MessageHandlingException("downstream", "boom");
        })).isInstanceOf(MessageHandlingException.class);
    }

    @Test
    @DisplayName("opens after 3 consecutive failures and rejects without calling the operation")
    void opensAfterThreshold() {
        failOnce("payments");
        failOnce("payments");
        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(guard.state("payments").getConsecutiveFailures()).isEqualTo(2);

        failOnce("payments");

        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.OPEN);
        assertThat(guard.state("payments").getLastFailureAt()).isNotNull();

        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> guard.execute("payments", calls::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).getKey()).isEqualTo("payments"));
        assertThat(calls).hasValue(0);
        assertThat(metrics.count("relay.circuit.rejected")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a success in between resets the consecutive counter")
    void successResetsCounter() throws Exception {
        failOnce("payments");
        failOnce("payments");
        guard.execute("payments", () -> "ok");
        failOnce("payments");
        failOnce("payments");

        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    @DisplayName("after the reset timeout one trial succeeds and closes the circuit")
    void halfOpenTrialSuccessCloses() throws Exception {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");

        Thread.sleep(RESET.toMillis() + 150);

        assertThat(guard.execute("payments", () -> "ok")).isEqualTo("ok");
        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(guard.state("payments").getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("a failed trial reopens the circuit")
    void halfOpenTrialFailureReopens() throws Exception {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");

        Thread.sleep(RESET.toMillis() + 150);
        failOnce("payments");

        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.OPEN);
        assertThatThrownBy(() -> guard.execute("payments", () -> "ok"))
                .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    @DisplayName("half-open admits a single trial, concurrent callers are rejected")
    void halfOpenAdmitsSingleTrial() throws Exception {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");
        Thread.sleep(RESET.toMillis() + 150);

        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = pool.submit(() -> guard.execute("payments", () -> {
                trialStarted.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "trial";
            }));
            assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.HALF_OPEN);
            assertThatThrownBy(() -> guard.execute("payments", () -> "concurrent"))
                    .isInstanceOf(CircuitOpenException.class);

            release.countDown();
            assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("trial");
            assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("permanent message errors do not count against the dependency")
    void permanentErrorsIgnored() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> guard.execute("payments", () -> {
                throw new PermanentMessageException("bad_json", "malformed");
            })).isInstanceOf(PermanentMessageException.class);
        }

        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(guard.state("payments").getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("keys are isolated from each other")
    void keysAreIndependent() throws Exception {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");

        assertThat(guard.execute("inventory", () -> "ok")).isEqualTo("ok");
        assertThat(guard.state("inventory").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(guard.state("unknown").getState()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    @DisplayName("per-handler override changes the threshold for that key only")
    void perHandlerOverride() {
        RelayGuardProperties.CbConfig strict = new RelayGuardProperties.CbConfig();
        strict.setFailureThreshold(1);
        strict.setResetTimeout(Duration.ofMinutes(1));
        props.setCbPerHandler(Map.of("fragile", strict));

        failOnce("fragile");

        assertThat(guard.state("fragile").getState()).isEqualTo(BreakerState.OPEN);
        assertThat(guard.state("fragile").getFailureThreshold()).isEqualTo(1);
    }

    @Test
    @DisplayName("opening fires a CIRCUIT_OPENED notification")
    void notifiesOnOpen() {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");

        ArgumentCaptor<NotifyContext> ctx = ArgumentCaptor.forClass(NotifyContext.class);
        verify(notifyService, times(1)).fire(ctx.capture(), eq(Severity.WARNING));
        assertThat(ctx.getValue().getType()).isEqualTo(NotifyEventType.CIRCUIT_OPENED);
        assertThat(ctx.getValue().getHandler()).isEqualTo("payments");
    }

    @Test
    @DisplayName("reset forces the circuit back to closed")
    void operatorReset() throws Exception {
        failOnce("payments");
        failOnce("payments");
        failOnce("payments");

        guard.reset("payments");

        assertThat(guard.state("payments").getState()).isEqualTo(BreakerState.CLOSED);
        assertThat(guard.execute("payments", () -> "ok")).isEqualTo("ok");
    }

    @Test
    @DisplayName("disabled guard passes every call through")
    void disabledPassesThrough() throws Exception {
        props.setEnabled(false);
        for (int i = 0; i < 10; i++) {
            failOnce("payments");
        }

        assertThat(guard.execute("payments", () -> "ok")).isEqualTo("ok");
        verify(notifyService, times(0)).fire(any(), any());
    }

    @Test
    @DisplayName("an Error from the operation is rethrown unchanged and counts as a failure")
    void errorPassesThroughAsFailure() {
        AssertionError broken = new AssertionError("broken");

        assertThatThrownBy(() -> guard.execute("ledger", () -> {
            throw broken;
        })).isSameAs(broken);

        assertThat(guard.state("ledger").getConsecutiveFailures()).isEqualTo(1);
    }
}
