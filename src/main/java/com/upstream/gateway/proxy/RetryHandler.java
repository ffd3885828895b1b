package com.upstream.gateway.proxy;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * 重试等待
 * <p>
 * 传输错误 / 认证错误 / 5xx：base × 2^(attempt-1) + 随机抖动，封顶 maxDelay；
 * 限流：等待 min(退避, 切号上限)，真正的冷却由限流窗口负责
 */
@Component
public class RetryHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    private final AppProperties.RetryConfig config;
    private final Random random;
    private final Sleeper sleeper;

    public RetryHandler(AppProperties properties, Random random, Sleeper sleeper) {
        this.config = properties.getRetry();
        this.random = random;
        this.sleeper = sleeper;
    }

    /**
     * 计算第 attempt 次（从 1 开始）失败后的等待时长（毫秒）
     */
    public long getDelay(int attempt) {
        long exponential = config.getBaseDelayMs() * (1L << Math.min(Math.max(attempt - 1, 0), 20));
        long jitter = config.getMaxJitterMs() > 0 ? (long) (random.nextDouble() * config.getMaxJitterMs()) : 0;
        return Math.min(config.getMaxDelayMs(), exponential + jitter);
    }

    /**
     * 执行重试等待
     */
    public void waitBeforeRetry(int attempt, String reason) {
        long delay = getDelay(attempt);
        log.warn("请求失败({}), 第{}次重试, 等待{}ms", reason, attempt, delay);
        sleeper.sleep(delay);
    }

    /**
     * 限流后切号前的短暂等待
     */
    public void waitBeforeRotate(long backoffMs) {
        sleeper.sleep(Math.min(backoffMs, config.getRateLimitSleepCapMs()));
    }

    public int maxRetries() {
        return config.getMaxRetries();
    }
}
