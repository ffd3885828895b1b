package com.upstream.gateway.pool;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 账号令牌桶
 * <p>
 * 容量 50，每满 60 秒补充 6 个（按整区间计算），用作 hybrid 策略的选择信号
 */
@Component
public class TokenBucketTracker {

    static final int CAPACITY = 50;
    static final int REFILL_AMOUNT = 6;
    static final long REFILL_INTERVAL_MS = 60_000L;

    private final Clock clock;
    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketTracker(Clock clock) {
        this.clock = clock;
    }

    public void initialize(String accountId) {
        buckets.putIfAbsent(accountId, new Bucket(CAPACITY, clock.millis()));
    }

    public boolean hasTokens(String accountId) {
        return hasTokens(accountId, 1);
    }

    public boolean hasTokens(String accountId, int required) {
        return refill(accountId).tokens >= required;
    }

    public boolean consumeTokens(String accountId) {
        return consumeTokens(accountId, 1);
    }

    /**
     * 令牌足够时原子扣减
     *
     * @return 是否扣减成功；不足时桶内令牌数不变
     */
    public boolean consumeTokens(String accountId, int count) {
        boolean[] consumed = new boolean[1];
        long now = clock.millis();
        buckets.compute(accountId, (id, b) -> {
            Bucket bucket = refilled(b != null ? b : new Bucket(CAPACITY, now), now);
            if (bucket.tokens >= count) {
                consumed[0] = true;
                return new Bucket(bucket.tokens - count, bucket.lastRefill);
            }
            return bucket;
        });
        return consumed[0];
    }

    public int getTokens(String accountId) {
        return refill(accountId).tokens;
    }

    /**
     * 恢复满桶
     */
    public void reset(String accountId) {
        buckets.put(accountId, new Bucket(CAPACITY, clock.millis()));
    }

    public void remove(String accountId) {
        buckets.remove(accountId);
    }

    private Bucket refill(String accountId) {
        long now = clock.millis();
        return buckets.compute(accountId, (id, b) -> refilled(b != null ? b : new Bucket(CAPACITY, now), now));
    }

    private static Bucket refilled(Bucket bucket, long now) {
        long intervals = (now - bucket.lastRefill) / REFILL_INTERVAL_MS;
        if (intervals <= 0) {
            return bucket;
        }
        long tokens = Math.min(CAPACITY, bucket.tokens + intervals * REFILL_AMOUNT);
        return new Bucket((int) tokens, now);
    }

    private record Bucket(int tokens, long lastRefill) {
    }
}
