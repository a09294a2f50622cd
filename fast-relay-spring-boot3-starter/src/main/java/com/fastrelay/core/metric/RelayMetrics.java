package com.fastrelay.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public final class RelayMetrics {
    private final MeterRegistry reg;
    private final Counter acked;
    private final Counter retried;
    private final Counter dlq;
    private final Counter requeued;
    private final Counter failed;
    private final Counter transformFailed;
    private final Counter circuitRejected;
    private final Counter dlqReplayed;
    private final Counter engineErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RelayMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.acked    = Counter.builder("relay.ack").description("messages acknowledged").register(reg);
        this.retried  = Counter.builder("relay.retry").description("messages republished to retry").register(reg);
        this.dlq      = Counter.builder("relay.dlq").description("messages dead-lettered").register(reg);
        this.requeued = Counter.builder("relay.requeue").description("messages nacked for redelivery").register(reg);
        this.failed   = Counter.builder("relay.handler.failed").description("handler invocations failed").register(reg);
        this.transformFailed = Counter.builder("relay.transform.failed").description("payload transformations failed").register(reg);
        this.circuitRejected = Counter.builder("relay.circuit.rejected").description("calls rejected by open circuit").register(reg);
        this.dlqReplayed = Counter.builder("relay.dlq.replay").description("dead letters replayed").register(reg);
        this.engineErr = Counter.builder("relay.engine.error").description("worker loop errors").register(reg);
        this.attempts = DistributionSummary.builder("relay.attempts")
                .description("attempt count at final outcome").baseUnit("times").register(reg);
        this.notifySuppressed = Counter.builder("relay.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("relay.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("relay.notify.failed").description("notify failed").register(reg);
        this.execTimer = Timer.builder("relay.exec.time").description("handler execution time").register(reg);
    }

    public static RelayMetrics create(MeterRegistry reg) { return new RelayMetrics(reg); }

    /** 测试/非 Spring 场景 */
    public static RelayMetrics simple() { return new RelayMetrics(new SimpleMeterRegistry()); }

    public MeterRegistry registry() { return reg; }

    public void incAcked(){ acked.increment(); }
    public void incRetried(){ retried.increment(); }
    public void incDlq(){ dlq.increment(); }
    public void incRequeued(){ requeued.increment(); }
    public void incFailed(){ failed.increment(); }
    public void incTransformFailed(){ transformFailed.increment(); }
    public void incCircuitRejected(){ circuitRejected.increment(); }
    public void incDlqReplayed(){ dlqReplayed.increment(); }
    public void incEngineErr(){ engineErr.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment();}
    public void incNotifyFailed(){ notifyFailed.increment();}
    public void incNotifySent(){ notifySent.increment();}
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public void bindDlqOccupancy(Supplier<Number> occupancy) {
        Gauge.builder("relay.dlq.occupancy", occupancy, s -> s.get().doubleValue())
                .description("dead letters not yet replayed")
                .register(reg);
    }

    public double count(String name) {
        Counter c = reg.find(name).counter();
        return c == null ? 0 : c.count();
    }
}
