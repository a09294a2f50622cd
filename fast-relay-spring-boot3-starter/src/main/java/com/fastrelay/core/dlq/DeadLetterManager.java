package com.fastrelay.core.dlq;

import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyContexts;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.spi.DeadLetterStore;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.core.tracker.DeliveryTracker;
import com.fastrelay.core.tracker.RetryHeaders;
import com.fastrelay.exception.DeadLetterNotFoundException;
import com.fastrelay.exception.PublishException;
import com.fastrelay.model.DeadLetterFilter;
import com.fastrelay.model.DeadLetterRecord;
import com.fastrelay.model.Message;
import com.fastrelay.model.RetryPolicy;
import com.fastrelay.model.RetryState;
import com.fastrelay.model.enums.FailureKind;
import com.fastrelay.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 死信归档、查询与运维重放
 * 记录只追加, 重放不改变归档内容, 只记录 replayedAt
 */
@Slf4j
public class DeadLetterManager {

    private static final int MAX_ERROR_LEN = 4000;

    private final Broker broker;

    private final DeadLetterStore store;

    private final DeliveryTracker tracker;

    private final RelayProperties.Destinations destinations;

    private final RetryPolicy policy;

    private final NotifyingFacade notifier;

    private final RelayMetrics metrics;

    private final Clock clock;

    private final String nodeId;

    public DeadLetterManager(Broker broker, DeadLetterStore store, DeliveryTracker tracker,
                             RelayProperties.Destinations destinations, RetryPolicy policy,
                             NotifyingFacade notifier, RelayMetrics metrics, Clock clock, String nodeId) {
        this.broker = broker;
        this.store = store;
        this.tracker = tracker;
        this.destinations = destinations;
        this.policy = policy;
        this.notifier = notifier;
        this.metrics = metrics;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    public DeadLetterRecord archive(Message message, Throwable error,
                                    FailureClassifier.Classification classification) throws PublishException {
        return archive(message, error, classification, null);
    }

    /**
     * 补记最后一次失败, 投递到死信 destination 后再落归档记录
     * 投递失败时不落记录, PublishException 交由调用方 nack
     */
    public DeadLetterRecord archive(Message message, Throwable error,
                                    FailureClassifier.Classification classification,
                                    String handlerName) throws PublishException {
        Instant now = Instant.now(clock);
        String errorClass = classification == null ? null : classification.getErrorClass();
        RetryState last = tracker.read(message);
        RetryState finalState = last.finalFailure(now, errorClass);
        Message stamped = tracker.stamp(message, finalState)
                .withoutAttributes(List.of(RetryHeaders.RETRY_DELAY_MS));

        broker.publish(destinations.getDeadLetter(), stamped);

        DeadLetterRecord record = DeadLetterRecord.builder()
                .id(UUID.randomUUID().toString())
                .originalMessage(stamped)
                .failureHistory(finalState.getFailureHistory())
                .errorClass(errorClass)
                .lastError(truncate(error))
                .finalizedAt(now)
                .build();
        store.append(record);
        metrics.incDlq();
        metrics.recordAttempts(finalState.getAttempt());
        log.warn("[Relay-DLQ] archived id={} errorClass={} attempt={} failures={}",
                record.getId(), errorClass, finalState.getAttempt(), record.getFailureHistory().size());
        String reason = classification != null
                && classification.getKind() == FailureKind.PERMANENT
                ? "PERMANENT" : "MAX_RETRY";
        notifier.fire(NotifyContexts.ctxForDeadLetter(nodeId, handlerName, record,
                finalState.getAttempt(), policy.getMaxRetries(), reason, error, clock), Severity.ERROR);
        return record;
    }

    public List<DeadLetterRecord> list(DeadLetterFilter filter) {
        return store.list(filter == null ? DeadLetterFilter.all() : filter);
    }

    public DeadLetterRecord get(String recordId) {
        return store.find(recordId).orElseThrow(() -> new DeadLetterNotFoundException(recordId));
    }

    public Optional<DeadLetterRecord> find(String recordId) {
        return store.find(recordId);
    }

    /**
     * 以全新消息（attempt 归零, 重试属性清空）重新投递到主 destination
     * 允许重复重放, 每次刷新 replayedAt
     */
    public Message replay(String recordId) throws PublishException {
        DeadLetterRecord record = get(recordId);
        Message fresh = tracker.clear(record.getOriginalMessage());
        broker.publish(destinations.getMain(), fresh);
        Instant now = Instant.now(clock);
        DeadLetterRecord updated = store.markReplayed(recordId, now)
                .orElseThrow(() -> new DeadLetterNotFoundException(recordId));
        metrics.incDlqReplayed();
        log.info("[Relay-DLQ] replayed id={} to {}", recordId, destinations.getMain());
        notifier.fire(NotifyContexts.ctxForReplay(nodeId, updated, destinations.getMain(), clock), Severity.INFO);
        return fresh;
    }

    /** 未重放的记录数 */
    public long occupancyCount() {
        return store.countPending();
    }

    private static String truncate(Throwable e) {
        if (e == null) {
            return null;
        }
        String s = e.toString();
        return s.length() <= MAX_ERROR_LEN ? s : s.substring(0, MAX_ERROR_LEN);
    }
}
