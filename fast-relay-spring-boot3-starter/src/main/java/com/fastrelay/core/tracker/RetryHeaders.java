package com.fastrelay.core.tracker;

import java.util.List;

/**
 * 核心占用的消息属性, 业务负载不得另作他用
 */
public final class RetryHeaders {

    /** 重试次数, 十进制字符串 */
    public static final String RETRY_COUNT = "x-retry-count";

    /** 首次失败时间, ISO-8601 */
    public static final String FIRST_FAILURE_AT = "x-first-failure-at";

    /** 最近一次错误分类 */
    public static final String LAST_ERROR_CLASS = "x-last-error-class";

    /** 失败历史, JSON 数组 */
    public static final String FAILURE_HISTORY = "x-failure-history";

    /** 期望的投递延迟（毫秒）, 支持按消息延迟的 broker 使用 */
    public static final String RETRY_DELAY_MS = "x-retry-delay-ms";

    public static final List<String> CORE_OWNED =
            List.of(RETRY_COUNT, FIRST_FAILURE_AT, LAST_ERROR_CLASS, FAILURE_HISTORY, RETRY_DELAY_MS);

    private RetryHeaders() {}
}
