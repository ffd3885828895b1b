package com.upstream.gateway.pool;

/**
 * 限流原因（决定退避时长）
 */
public enum RateLimitReason {
    QUOTA_EXHAUSTED,
    RATE_LIMIT_EXCEEDED,
    MODEL_CAPACITY_EXHAUSTED,
    SERVICE_UNAVAILABLE,
    UNKNOWN
}
