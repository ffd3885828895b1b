package com.upstream.gateway.pool;

import java.util.EnumMap;
import java.util.Map;

/**
 * Antigravity（Google OAuth）账号
 * <p>
 * 只持久化 refreshToken，access token 仅缓存在内存中
 */
public final class AntigravityAccount extends Account {

    private volatile String refreshToken;
    private volatile String projectId;
    private volatile String managedProjectId;
    private volatile DeviceFingerprint fingerprint;
    // 限流窗口 -> 解除时间（epoch ms），读写都在 AccountStore 锁内
    private final Map<RateLimitKey, Long> rateLimitResetTimes = new EnumMap<>(RateLimitKey.class);

    public AntigravityAccount(String id, String email, String userId, long addedAt, long lastUsed,
                              boolean enabled, int healthScore, String refreshToken,
                              String projectId, String managedProjectId,
                              Map<RateLimitKey, Long> rateLimitResetTimes, DeviceFingerprint fingerprint) {
        super(id, AccountProvider.ANTIGRAVITY, email, userId, addedAt, lastUsed, enabled, healthScore);
        this.refreshToken = refreshToken;
        this.projectId = projectId;
        this.managedProjectId = managedProjectId;
        this.fingerprint = fingerprint;
        if (rateLimitResetTimes != null) {
            this.rateLimitResetTimes.putAll(rateLimitResetTimes);
        }
    }

    public void updateProjects(String projectId, String managedProjectId) {
        this.projectId = projectId;
        this.managedProjectId = managedProjectId;
    }

    public Map<RateLimitKey, Long> rateLimitResetTimes() { return rateLimitResetTimes; }
    public String refreshToken() { return refreshToken; }
    public void setRefreshToken(String refreshToken) { this.refreshToken = refreshToken; }
    public String projectId() { return projectId; }
    public String managedProjectId() { return managedProjectId; }
    public DeviceFingerprint fingerprint() { return fingerprint; }
    public void setFingerprint(DeviceFingerprint fingerprint) { this.fingerprint = fingerprint; }
}
