package com.upstream.gateway.pool;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * 限流退避时长计算
 * <p>
 * 服务端给出 retry-after 时取 max(retry-after, 2s)，否则按限流原因查表
 */
@Component
public class BackoffPolicy {

    static final List<Long> QUOTA_EXHAUSTED_LADDER = List.of(
            60_000L,
            5 * 60_000L,
            30 * 60_000L,
            2 * 60 * 60_000L
    );
    static final long RATE_LIMIT_EXCEEDED_MS = 30_000L;
    static final long MODEL_CAPACITY_MS = 45_000L;
    static final long SERVICE_UNAVAILABLE_MS = 60_000L;
    static final long UNKNOWN_MS = 60_000L;
    static final long JITTER_RANGE_MS = 15_000L;
    static final long MIN_RETRY_AFTER_MS = 2_000L;

    private final Random random;

    public BackoffPolicy(Random random) {
        this.random = random;
    }

    /**
     * @param reason       限流原因
     * @param failures     连续失败次数（QUOTA_EXHAUSTED 阶梯下标，超出取最后一档）
     * @param retryAfterMs 服务端建议的等待时间，可为 null
     */
    public long resolve(RateLimitReason reason, int failures, Long retryAfterMs) {
        if (retryAfterMs != null && retryAfterMs > 0) {
            return Math.max(retryAfterMs, MIN_RETRY_AFTER_MS);
        }
        return calculate(reason, failures);
    }

    public long calculate(RateLimitReason reason, int failures) {
        return switch (reason) {
            case QUOTA_EXHAUSTED -> {
                int index = Math.max(0, Math.min(failures, QUOTA_EXHAUSTED_LADDER.size() - 1));
                yield QUOTA_EXHAUSTED_LADDER.get(index);
            }
            case RATE_LIMIT_EXCEEDED -> RATE_LIMIT_EXCEEDED_MS;
            case MODEL_CAPACITY_EXHAUSTED -> MODEL_CAPACITY_MS + jitter(JITTER_RANGE_MS);
            case SERVICE_UNAVAILABLE -> SERVICE_UNAVAILABLE_MS + jitter(JITTER_RANGE_MS);
            case UNKNOWN -> UNKNOWN_MS;
        };
    }

    /**
     * [-range, +range] 均匀分布
     */
    long jitter(long range) {
        return (long) (random.nextDouble() * (2 * range + 1)) - range;
    }
}
