package com.upstream.gateway.pool;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 账号健康分追踪
 * <p>
 * 成功 +1，限流 -10，硬失败 -20，范围 [-1000, 1000]；
 * 最后一次失败之后每空闲 5 分钟自动恢复 10 分
 */
@Component
public class HealthScoreTracker {

    static final int SUCCESS_DELTA = 1;
    static final int RATE_LIMIT_DELTA = -10;
    static final int FAILURE_DELTA = -20;
    static final int MAX_SCORE = 1000;
    static final int MIN_SCORE = -1000;
    static final long RECOVERY_INTERVAL_MS = 5 * 60 * 1000L;
    static final int RECOVERY_PER_INTERVAL = 10;

    private final Clock clock;
    private final ConcurrentHashMap<String, State> states = new ConcurrentHashMap<>();

    public HealthScoreTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * 用持久化的分数初始化（已存在则忽略）
     */
    public void initialize(String accountId, int score) {
        states.putIfAbsent(accountId, new State(clamp(score), 0, null));
    }

    public void recordSuccess(String accountId) {
        states.compute(accountId, (id, s) -> {
            State current = s != null ? s : State.fresh();
            return new State(clamp(current.score + SUCCESS_DELTA), 0, null);
        });
    }

    public void recordRateLimit(String accountId) {
        penalize(accountId, RATE_LIMIT_DELTA);
    }

    public void recordFailure(String accountId) {
        penalize(accountId, FAILURE_DELTA);
    }

    /**
     * 获取当前分数（先结算空闲恢复）
     */
    public int getScore(String accountId) {
        State state = states.computeIfPresent(accountId, (id, s) -> s.recover(clock.millis()));
        return state != null ? state.score : 0;
    }

    public int getConsecutiveFailures(String accountId) {
        State state = states.get(accountId);
        return state != null ? state.consecutiveFailures : 0;
    }

    public void reset(String accountId) {
        states.put(accountId, State.fresh());
    }

    public void remove(String accountId) {
        states.remove(accountId);
    }

    private void penalize(String accountId, int delta) {
        long now = clock.millis();
        states.compute(accountId, (id, s) -> {
            State current = s != null ? s : State.fresh();
            return new State(clamp(current.score + delta), current.consecutiveFailures + 1, now);
        });
    }

    private static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private record State(int score, int consecutiveFailures, Long lastFailureTime) {

        static State fresh() {
            return new State(0, 0, null);
        }

        /**
         * 按完整的 5 分钟区间恢复，并把失败时间前移已结算的区间，重复读取不会重复加分
         */
        State recover(long now) {
            if (lastFailureTime == null) {
                return this;
            }
            long elapsed = now - lastFailureTime;
            if (elapsed <= RECOVERY_INTERVAL_MS) {
                return this;
            }
            long intervals = elapsed / RECOVERY_INTERVAL_MS;
            long recovered = Math.min((long) MAX_SCORE - MIN_SCORE, intervals * RECOVERY_PER_INTERVAL);
            return new State(clamp((int) (score + recovered)), consecutiveFailures,
                    lastFailureTime + intervals * RECOVERY_INTERVAL_MS);
        }
    }
}
