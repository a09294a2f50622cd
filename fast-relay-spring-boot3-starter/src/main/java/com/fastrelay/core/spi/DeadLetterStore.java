package com.fastrelay.core.spi;

import com.fastrelay.model.DeadLetterFilter;
import com.fastrelay.model.DeadLetterRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 死信归档存储, 只追加
 */
public interface DeadLetterStore {

    void append(DeadLetterRecord record);

    Optional<DeadLetterRecord> find(String id);

    /**
     * 只更新审计字段 replayedAt, 记录内容不变
     * @return 更新后的记录, id 不存在返回 empty
     */
    Optional<DeadLetterRecord> markReplayed(String id, Instant when);

    /** 按归档顺序 */
    List<DeadLetterRecord> list(DeadLetterFilter filter);

    /** 未重放的记录数 */
    long countPending();
}
