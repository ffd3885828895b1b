package com.upstream.gateway.pool;

/**
 * Codex（ChatGPT OAuth）账号
 */
public final class CodexAccount extends Account {

    private volatile String accessToken;
    private volatile String refreshToken;
    private volatile Long expiresAt;

    public CodexAccount(String id, String email, String userId, long addedAt, long lastUsed,
                        boolean enabled, int healthScore,
                        String accessToken, String refreshToken, Long expiresAt) {
        super(id, AccountProvider.CODEX, email, userId, addedAt, lastUsed, enabled, healthScore);
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
    }

    /**
     * 刷新成功后整体替换凭证
     */
    public void updateCredentials(String accessToken, String refreshToken, Long expiresAt) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
    }

    public String accessToken() { return accessToken; }
    public String refreshToken() { return refreshToken; }
    public Long expiresAt() { return expiresAt; }
}
