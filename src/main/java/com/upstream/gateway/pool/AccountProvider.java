package com.upstream.gateway.pool;

import java.util.Optional;

/**
 * 上游账号提供方
 */
public enum AccountProvider {

    CODEX("codex"),
    ANTIGRAVITY("antigravity"),
    OPENAI_COMPATIBLE("openai-compatible");

    private final String wireName;

    AccountProvider(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 持久化文件中使用的名称
     */
    public String wireName() {
        return wireName;
    }

    public static Optional<AccountProvider> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AccountProvider provider : values()) {
            if (provider.wireName.equals(value)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
