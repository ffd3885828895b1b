package com.upstream.gateway.pool;

import java.util.Optional;

/**
 * Antigravity 账号的限流窗口键
 * <p>
 * claude 家族共用一个窗口，gemini 家族按请求路径（header 风格）分两个窗口
 */
public enum RateLimitKey {

    CLAUDE("claude"),
    GEMINI_ANTIGRAVITY("gemini-antigravity"),
    GEMINI_CLI("gemini-cli");

    private final String wireName;

    RateLimitKey(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RateLimitKey> fromWireName(String value) {
        for (RateLimitKey key : values()) {
            if (key.wireName.equals(value)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
