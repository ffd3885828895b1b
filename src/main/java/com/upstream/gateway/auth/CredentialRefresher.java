package com.upstream.gateway.auth;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.exception.AuthenticationException;
import com.upstream.gateway.pool.Account;
import com.upstream.gateway.pool.AccountStore;
import com.upstream.gateway.pool.AntigravityAccount;
import com.upstream.gateway.pool.CodexAccount;
import com.upstream.gateway.pool.OpenAiCompatibleAccount;
import com.upstream.gateway.util.SingleFlight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 凭证刷新服务
 * <p>
 * 管理每个账号的 access token 生命周期：
 * - Codex：过期前 5 分钟刷新，新凭证写回账号配置；刷新失败时继续使用旧 token
 * - Antigravity：access token 只缓存在内存，过期前 5 分钟重新换取；轮换的 refresh token 写回配置
 * - 同一账号的并发刷新合并为一次网络请求
 */
@Service
public class CredentialRefresher {

    private static final Logger log = LoggerFactory.getLogger(CredentialRefresher.class);
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final AccountStore accountStore;
    private final TokenRefresher codexRefresher;
    private final TokenRefresher antigravityRefresher;
    private final Clock clock;
    private final long refreshBufferMs;

    // accountId -> Antigravity access token
    private final ConcurrentHashMap<String, CachedToken> accessCache = new ConcurrentHashMap<>();
    // "{provider}:{accountId}" -> 进行中的刷新
    private final SingleFlight<String, Optional<String>> refreshes = new SingleFlight<>();

    public CredentialRefresher(AccountStore accountStore,
                               @Qualifier("codexTokenRefresher") TokenRefresher codexRefresher,
                               @Qualifier("antigravityTokenRefresher") TokenRefresher antigravityRefresher,
                               AppProperties properties, Clock clock) {
        this.accountStore = accountStore;
        this.codexRefresher = codexRefresher;
        this.antigravityRefresher = antigravityRefresher;
        this.clock = clock;
        this.refreshBufferMs = properties.getRefresh().getBufferMinutes() * 60_000L;
    }

    /**
     * 获取账号当前可用的访问凭证
     *
     * @return 无法获得凭证时返回 empty
     */
    public Optional<String> accessToken(Account account) {
        if (account instanceof CodexAccount codex) {
            return codexAccessToken(codex);
        }
        if (account instanceof AntigravityAccount antigravity) {
            return antigravityAccessToken(antigravity);
        }
        if (account instanceof OpenAiCompatibleAccount openai) {
            return Optional.ofNullable(openai.apiKey()).filter(key -> !key.isBlank());
        }
        return Optional.empty();
    }

    public Optional<String> codexAccessToken(CodexAccount account) {
        if (shouldRefreshCodexToken(account)) {
            Optional<String> refreshed = refreshCodexToken(account);
            if (refreshed.isPresent()) {
                return refreshed;
            }
            log.warn("Codex 账号 {} 刷新失败, 继续使用旧 token", account.displayName());
        }
        return Optional.ofNullable(account.accessToken()).filter(token -> !token.isBlank());
    }

    public Optional<String> antigravityAccessToken(AntigravityAccount account) {
        CachedToken cached = accessCache.get(account.id());
        if (cached != null && !cached.needsRefresh(clock.millis(), refreshBufferMs)) {
            return Optional.of(cached.accessToken());
        }
        return refreshAntigravityToken(account);
    }

    /**
     * 丢弃缓存的 access token，下次请求强制刷新
     */
    public void invalidateAccess(String accountId) {
        if (accessCache.remove(accountId) != null) {
            log.info("账号 {} 的 access token 缓存已失效", accountId);
        }
    }

    boolean shouldRefreshCodexToken(CodexAccount account) {
        if (account.refreshToken() == null || account.expiresAt() == null) {
            return false;
        }
        return account.expiresAt() - refreshBufferMs < clock.millis();
    }

    private Optional<String> refreshCodexToken(CodexAccount account) {
        return refreshes.execute("codex:" + account.id(), () -> {
            // 双重检查：其他线程可能已刷新
            if (!shouldRefreshCodexToken(account)) {
                return Optional.ofNullable(account.accessToken()).filter(token -> !token.isBlank());
            }
            try {
                TokenRefresher.TokenResult result = codexRefresher.refresh(account.refreshToken());
                String refreshToken = result.refreshToken() != null ? result.refreshToken() : account.refreshToken();
                Long expiresAt = result.expiresInSeconds() != null
                        ? clock.millis() + result.expiresInSeconds() * 1000
                        : account.expiresAt();
                accountStore.updateCodexCredentials(account, result.accessToken(), refreshToken, expiresAt);
                log.info("Codex 账号 {} Token 刷新成功, 过期时间: {}", account.displayName(), expiresAt);
                return Optional.of(result.accessToken());
            } catch (AuthenticationException e) {
                log.warn("Codex 账号 {} Token 刷新失败: {}", account.displayName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    private Optional<String> refreshAntigravityToken(AntigravityAccount account) {
        return refreshes.execute("antigravity:" + account.id(), () -> {
            CachedToken cached = accessCache.get(account.id());
            if (cached != null && !cached.needsRefresh(clock.millis(), refreshBufferMs)) {
                return Optional.of(cached.accessToken());
            }
            try {
                TokenRefresher.TokenResult result = antigravityRefresher.refresh(account.refreshToken());
                if (result.refreshToken() != null && !result.refreshToken().equals(account.refreshToken())) {
                    accountStore.updateAntigravityRefreshToken(account, result.refreshToken());
                    log.info("Antigravity 账号 {} 的 refreshToken 已更新", account.displayName());
                }
                long expiresIn = result.expiresInSeconds() != null ? result.expiresInSeconds() : DEFAULT_EXPIRES_IN_SECONDS;
                CachedToken token = new CachedToken(result.accessToken(), clock.millis() + expiresIn * 1000);
                accessCache.put(account.id(), token);
                log.info("Antigravity 账号 {} Token 刷新成功, 有效期 {}s", account.displayName(), expiresIn);
                return Optional.of(token.accessToken());
            } catch (AuthenticationException e) {
                log.warn("Antigravity 账号 {} Token 刷新失败: {}", account.displayName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    // 缓存的 Token 信息
    private record CachedToken(String accessToken, long expiresAt) {

        boolean needsRefresh(long now, long bufferMs) {
            return expiresAt - bufferMs <= now;
        }
    }
}
