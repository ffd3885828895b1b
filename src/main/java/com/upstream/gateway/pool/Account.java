package com.upstream.gateway.pool;

/**
 * 上游账号实体（按 provider 区分三种子类型）
 * <p>
 * 可变字段只在 {@link AccountStore} 的锁内修改
 */
public abstract sealed class Account permits CodexAccount, AntigravityAccount, OpenAiCompatibleAccount {

    private final String id;
    private final AccountProvider provider;
    private volatile String email;
    private volatile String userId;
    private final long addedAt;
    private volatile long lastUsed;
    private volatile boolean enabled;
    private volatile int healthScore;

    protected Account(String id, AccountProvider provider, String email, String userId,
                      long addedAt, long lastUsed, boolean enabled, int healthScore) {
        this.id = id;
        this.provider = provider;
        this.email = email;
        this.userId = userId;
        this.addedAt = addedAt;
        this.lastUsed = lastUsed;
        this.enabled = enabled;
        this.healthScore = healthScore;
    }

    /**
     * 是否匹配标识（id / email / userId）
     */
    public boolean matches(String identifier) {
        return identifier != null
                && (identifier.equals(id) || identifier.equals(email) || identifier.equals(userId));
    }

    /**
     * 展示用名称
     */
    public String displayName() {
        if (email != null) return email;
        if (userId != null) return userId;
        return id;
    }

    // --- getter / setter ---

    public String id() { return id; }
    public AccountProvider provider() { return provider; }
    public String email() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String userId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public long addedAt() { return addedAt; }
    public long lastUsed() { return lastUsed; }
    public void setLastUsed(long lastUsed) { this.lastUsed = lastUsed; }
    public boolean enabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int healthScore() { return healthScore; }
    public void setHealthScore(int healthScore) { this.healthScore = healthScore; }
}
