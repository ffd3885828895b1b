package com.upstream.gateway.pool;

/**
 * OpenAI 兼容 API Key 账号
 */
public final class OpenAiCompatibleAccount extends Account {

    private volatile String apiKey;
    private volatile String baseUrl;

    public OpenAiCompatibleAccount(String id, String email, String userId, long addedAt, long lastUsed,
                                   boolean enabled, int healthScore, String apiKey, String baseUrl) {
        super(id, AccountProvider.OPENAI_COMPATIBLE, email, userId, addedAt, lastUsed, enabled, healthScore);
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
    }

    public void updateKey(String apiKey, String baseUrl) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
    }

    public String apiKey() { return apiKey; }
    public String baseUrl() { return baseUrl; }
}
