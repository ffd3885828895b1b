package com.upstream.gateway.pool;

import com.upstream.gateway.auth.CredentialRefresher;
import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.model.ModelFamily;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 多账号池管理
 * <p>
 * 对外统一入口：账号增删改、按策略选号、获取凭证、上报请求结果（成功 / 失败 / 限流）
 */
@Component
public class AccountPool {

    private static final Logger log = LoggerFactory.getLogger(AccountPool.class);

    private final AccountStore accountStore;
    private final AccountSelector accountSelector;
    private final RateLimitWindows rateLimitWindows;
    private final HealthScoreTracker healthScoreTracker;
    private final TokenBucketTracker tokenBucketTracker;
    private final BackoffPolicy backoffPolicy;
    private final CredentialRefresher credentialRefresher;
    private final AppProperties properties;
    private final Clock clock;

    public AccountPool(AccountStore accountStore, AccountSelector accountSelector, RateLimitWindows rateLimitWindows,
                       HealthScoreTracker healthScoreTracker, TokenBucketTracker tokenBucketTracker,
                       BackoffPolicy backoffPolicy, CredentialRefresher credentialRefresher,
                       AppProperties properties, Clock clock) {
        this.accountStore = accountStore;
        this.accountSelector = accountSelector;
        this.rateLimitWindows = rateLimitWindows;
        this.healthScoreTracker = healthScoreTracker;
        this.tokenBucketTracker = tokenBucketTracker;
        this.backoffPolicy = backoffPolicy;
        this.credentialRefresher = credentialRefresher;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<Account> accounts = accountStore.listAccounts(null);
        for (Account account : accounts) {
            initializeTrackers(account);
        }
        log.info("账号池初始化完成: {} 个账号, 策略={}", accounts.size(), accountStore.getStrategy().wireName());
    }

    // ==================== 账号管理 ====================

    public List<Account> listAccounts(AccountProvider provider) {
        return accountStore.listAccounts(provider);
    }

    public Optional<Account> getAccount(String identifier) {
        return accountStore.getAccount(identifier, null);
    }

    public CodexAccount addCodexAccount(AccountStore.CodexLogin login) {
        CodexAccount account = accountStore.addCodexAccount(login);
        initializeTrackers(account);
        return account;
    }

    public AntigravityAccount addAntigravityAccount(AccountStore.AntigravityLogin login) {
        AntigravityAccount account = accountStore.addAntigravityAccount(login);
        initializeTrackers(account);
        return account;
    }

    public OpenAiCompatibleAccount addOpenAiCompatibleAccount(AccountStore.OpenAiCompatibleLogin login) {
        OpenAiCompatibleAccount account = accountStore.addOpenAiCompatibleAccount(login);
        initializeTrackers(account);
        return account;
    }

    /**
     * 删除账号并清理它的追踪状态、凭证缓存和限流窗口
     */
    public boolean removeAccount(String identifier) {
        Optional<Account> removed = accountStore.removeAccount(identifier);
        removed.ifPresent(account -> forget(account.id()));
        return removed.isPresent();
    }

    public void clearAllAccounts() {
        for (Account account : accountStore.clearAllAccounts()) {
            forget(account.id());
        }
    }

    public boolean setCurrentAccount(String identifier) {
        return accountStore.setCurrentAccount(identifier);
    }

    public void setStrategy(LoadBalancingStrategy strategy) {
        accountStore.setStrategy(strategy);
    }

    public LoadBalancingStrategy getStrategy() {
        return accountStore.getStrategy();
    }

    public boolean setEnabled(String identifier, boolean enabled) {
        return accountStore.setEnabled(identifier, enabled);
    }

    /**
     * 当前账号是否持有可用凭证（不推进轮询游标）
     */
    public boolean isAuthenticated(AccountProvider provider) {
        return accountStore.withLock(() -> {
            List<Account> enabled = accountStore.enabledAccounts(provider);
            if (enabled.isEmpty()) {
                return false;
            }
            String currentId = accountStore.config().currentAccountIdByProvider().get(provider);
            Account account = enabled.stream()
                    .filter(a -> a.id().equals(currentId))
                    .findFirst()
                    .orElse(enabled.get(0));
            return hasUsableCredentials(account);
        });
    }

    private boolean hasUsableCredentials(Account account) {
        return switch (account.provider()) {
            case CODEX -> {
                CodexAccount codex = (CodexAccount) account;
                if (codex.refreshToken() != null) {
                    yield true;
                }
                if (codex.accessToken() == null || codex.accessToken().isEmpty()) {
                    yield false;
                }
                yield codex.expiresAt() == null || codex.expiresAt() >= clock.millis();
            }
            case ANTIGRAVITY -> ((AntigravityAccount) account).refreshToken() != null;
            case OPENAI_COMPATIBLE -> {
                OpenAiCompatibleAccount openai = (OpenAiCompatibleAccount) account;
                yield openai.apiKey() != null && !openai.apiKey().isEmpty();
            }
        };
    }

    // ==================== 选号与凭证 ====================

    /**
     * 按当前策略选择账号
     *
     * @param family 模型家族，仅影响 Antigravity 限流判断，可为 null
     */
    public Optional<Account> getCurrentAccount(AccountProvider provider, ModelFamily family) {
        return accountSelector.select(provider, family);
    }

    /**
     * 获取 provider 当前账号的访问凭证
     */
    public Optional<String> getAccessToken(AccountProvider provider) {
        if (provider == AccountProvider.ANTIGRAVITY) {
            return getAntigravitySession(ModelFamily.CLAUDE).map(AccountSession::accessToken);
        }
        return getCurrentAccount(provider, null).flatMap(credentialRefresher::accessToken);
    }

    /**
     * 为账号建立调用上下文；Antigravity 账号所有路径都在冷却时退化为 antigravity 风格
     *
     * @return 无法获得访问凭证时返回 empty
     */
    public Optional<AccountSession> openSession(Account account, ModelFamily family) {
        Optional<String> accessToken = credentialRefresher.accessToken(account);
        if (accessToken.isEmpty()) {
            return Optional.empty();
        }
        if (account instanceof AntigravityAccount antigravity) {
            HeaderStyle headerStyle = availableHeaderStyle(antigravity, family).orElse(HeaderStyle.ANTIGRAVITY);
            return Optional.of(new AccountSession(account, accessToken.get(), headerStyle,
                    projectIdOf(antigravity), antigravity.managedProjectId()));
        }
        return Optional.of(new AccountSession(account, accessToken.get(), null, null, null));
    }

    /**
     * Antigravity 会话：选号，且所选账号对该家族至少有一条未冷却的路径
     */
    public Optional<AccountSession> getAntigravitySession(ModelFamily family) {
        ModelFamily effective = family != null ? family : ModelFamily.CLAUDE;
        Optional<Account> account = getCurrentAccount(AccountProvider.ANTIGRAVITY, effective);
        if (account.isEmpty() || !(account.get() instanceof AntigravityAccount antigravity)) {
            return Optional.empty();
        }
        if (availableHeaderStyle(antigravity, effective).isEmpty()) {
            return Optional.empty();
        }
        return openSession(antigravity, effective);
    }

    public Optional<HeaderStyle> availableHeaderStyle(AntigravityAccount account, ModelFamily family) {
        return accountStore.withLock(() -> rateLimitWindows.availableHeaderStyle(account, family));
    }

    private String projectIdOf(AntigravityAccount account) {
        String projectId = account.projectId();
        return projectId != null && !projectId.isBlank()
                ? projectId : properties.getAntigravity().getDefaultProjectId();
    }

    // ==================== 结果上报 ====================

    public void markRequestSuccess(String accountId) {
        accountStore.withLock(() -> {
            healthScoreTracker.recordSuccess(accountId);
            accountStore.getAccount(accountId, null).ifPresent(account -> {
                account.setHealthScore(healthScoreTracker.getScore(accountId));
                account.setLastUsed(clock.millis());
                accountStore.persist();
            });
        });
    }

    public void markRequestFailure(String accountId) {
        accountStore.withLock(() -> {
            healthScoreTracker.recordFailure(accountId);
            accountStore.getAccount(accountId, null).ifPresent(account -> {
                account.setHealthScore(healthScoreTracker.getScore(accountId));
                accountStore.persist();
            });
        });
    }

    /**
     * 记录限流：扣健康分、计算退避、标记对应的限流窗口
     *
     * @return 退避时长（毫秒）
     */
    public long markRateLimited(String accountId, RateLimitMark mark) {
        return accountStore.withLock(() -> {
            healthScoreTracker.recordRateLimit(accountId);
            int failures = Math.max(0, healthScoreTracker.getConsecutiveFailures(accountId) - 1);
            long backoffMs = backoffPolicy.resolve(mark.reason(), failures, mark.retryAfterMs());

            Optional<Account> account = accountStore.getAccount(accountId, null);
            if (account.isPresent()) {
                rateLimitWindows.mark(account.get(), mark.resolveWindowKey(), clock.millis() + backoffMs);
                account.get().setHealthScore(healthScoreTracker.getScore(accountId));
                accountStore.persist();
            }
            log.warn("账号 {} 被限流: reason={}, window={}, backoff={}ms",
                    accountId, mark.reason(), mark.resolveWindowKey().wireName(), backoffMs);
            return backoffMs;
        });
    }

    /**
     * 丢弃账号缓存的 access token
     */
    public void invalidateAccess(String accountId) {
        credentialRefresher.invalidateAccess(accountId);
    }

    // ==================== 统计 ====================

    public PoolStats getStats() {
        return accountStore.withLock(() -> {
            List<Account> accounts = accountStore.config().accounts();
            int enabled = 0;
            int rateLimited = 0;
            Map<AccountProvider, Integer> counts = new EnumMap<>(AccountProvider.class);
            for (Account account : accounts) {
                counts.merge(account.provider(), 1, Integer::sum);
                if (!account.enabled()) {
                    continue;
                }
                enabled++;
                // 禁用账号不计入限流数
                if (rateLimitWindows.isRateLimited(account, ModelFamily.CLAUDE)
                        || rateLimitWindows.isRateLimited(account, ModelFamily.GEMINI)) {
                    rateLimited++;
                }
            }
            Map<String, Integer> byProvider = new LinkedHashMap<>();
            counts.forEach((provider, count) -> byProvider.put(provider.wireName(), count));
            return new PoolStats(accounts.size(), enabled, rateLimited, byProvider,
                    accountStore.config().strategy().wireName());
        });
    }

    private void initializeTrackers(Account account) {
        healthScoreTracker.initialize(account.id(), account.healthScore());
        tokenBucketTracker.initialize(account.id());
    }

    private void forget(String accountId) {
        healthScoreTracker.remove(accountId);
        tokenBucketTracker.remove(accountId);
        credentialRefresher.invalidateAccess(accountId);
        rateLimitWindows.clear(accountId);
    }

    // ==================== 统计 Record ====================

    public record PoolStats(int total, int enabled, int rateLimited, Map<String, Integer> byProvider,
                            String strategy) {}
}
