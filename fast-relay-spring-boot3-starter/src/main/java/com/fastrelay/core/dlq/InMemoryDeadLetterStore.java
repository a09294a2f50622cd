package com.fastrelay.core.dlq;

import com.fastrelay.core.spi.DeadLetterStore;
import com.fastrelay.model.DeadLetterFilter;
import com.fastrelay.model.DeadLetterRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 默认的内存归档, 进程重启即丢失
 * 追加串行化, 记录之间相互独立
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final Map<String, DeadLetterRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void append(DeadLetterRecord record) {
        if (records.putIfAbsent(record.getId(), record) != null) {
            throw new IllegalStateException("dead letter record already exists: " + record.getId());
        }
    }

    @Override
    public synchronized Optional<DeadLetterRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Optional<DeadLetterRecord> markReplayed(String id, Instant when) {
        DeadLetterRecord r = records.get(id);
        if (r == null) {
            return Optional.empty();
        }
        DeadLetterRecord updated = r.withReplayedAt(when);
        records.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized List<DeadLetterRecord> list(DeadLetterFilter filter) {
        return records.values().stream()
                .filter(filter::matches)
                .limit(Math.max(0, filter.getLimit()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long countPending() {
        return records.values().stream().filter(r -> !r.isReplayed()).count();
    }
}
