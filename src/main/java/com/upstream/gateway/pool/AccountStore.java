package com.upstream.gateway.pool;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.dao.AccountsFileDAO;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 账号配置存储
 * <p>
 * 持有 accounts.json 的内存副本，所有读写都在同一把锁内完成；
 * 每次变更后整文件回写，回写失败只记录日志，不影响内存状态
 */
@Component
public class AccountStore {

    private static final Logger log = LoggerFactory.getLogger(AccountStore.class);

    private final AccountsFileDAO accountsFileDAO;
    private final AccountNormalizer normalizer;
    private final FingerprintGenerator fingerprintGenerator;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private AccountsConfig config = AccountsConfig.empty();

    public AccountStore(AccountsFileDAO accountsFileDAO, AccountNormalizer normalizer,
                        FingerprintGenerator fingerprintGenerator, Clock clock) {
        this.accountsFileDAO = accountsFileDAO;
        this.normalizer = normalizer;
        this.fingerprintGenerator = fingerprintGenerator;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        withLock(() -> {
            migrateLegacyConfig();
            config = loadConfig();
            log.info("账号配置加载完成: {} 个账号, 策略={}, 文件={}",
                    config.accounts().size(), config.strategy().wireName(), accountsFileDAO.accountsPath());
        });
    }

    // ==================== 锁 ====================

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前配置，调用方必须持有锁
     */
    AccountsConfig config() {
        return config;
    }

    /**
     * 整文件回写，调用方必须持有锁
     */
    public void persist() {
        try {
            accountsFileDAO.writeAccounts(normalizer.toJson(config));
        } catch (IOException e) {
            log.error("写入账号配置失败: {}", accountsFileDAO.accountsPath(), e);
        }
    }

    // ==================== 查询 ====================

    /**
     * @param provider 为 null 时返回全部账号
     */
    public List<Account> listAccounts(AccountProvider provider) {
        return withLock(() -> config.accounts().stream()
                .filter(a -> provider == null || a.provider() == provider)
                .toList());
    }

    /**
     * 按 id / email / userId 查找
     */
    public Optional<Account> getAccount(String identifier, AccountProvider provider) {
        return withLock(() -> findAccount(identifier, provider));
    }

    public LoadBalancingStrategy getStrategy() {
        return withLock(() -> config.strategy());
    }

    List<Account> enabledAccounts(AccountProvider provider) {
        return config.accounts().stream()
                .filter(a -> a.provider() == provider && a.enabled())
                .toList();
    }

    // ==================== 添加 ====================

    /**
     * 添加 Codex 账号；email 或 userId 与已有账号相同时原地更新凭证
     */
    public CodexAccount addCodexAccount(CodexLogin login) {
        return withLock(() -> {
            long now = clock.millis();
            for (Account account : config.accounts()) {
                if (account instanceof CodexAccount existing
                        && (sameIdentity(existing.email(), login.email()) || sameIdentity(existing.userId(), login.userId()))) {
                    existing.updateCredentials(login.accessToken(), login.refreshToken(), login.expiresAt());
                    existing.setEmail(login.email());
                    existing.setUserId(login.userId());
                    existing.setLastUsed(now);
                    persist();
                    log.info("更新 Codex 账号: id={}, email={}", existing.id(), existing.email());
                    return existing;
                }
            }
            CodexAccount created = new CodexAccount(normalizer.generateAccountId(), login.email(), login.userId(),
                    now, now, true, 0, login.accessToken(), login.refreshToken(), login.expiresAt());
            append(created);
            return created;
        });
    }

    /**
     * 添加 Antigravity 账号；email 或 refreshToken 与已有账号相同时原地更新
     */
    public AntigravityAccount addAntigravityAccount(AntigravityLogin login) {
        return withLock(() -> {
            long now = clock.millis();
            for (Account account : config.accounts()) {
                if (account instanceof AntigravityAccount existing
                        && (sameIdentity(existing.email(), login.email())
                        || Objects.equals(existing.refreshToken(), login.refreshToken()))) {
                    existing.setRefreshToken(login.refreshToken());
                    existing.updateProjects(login.projectId(), login.managedProjectId());
                    if (login.fingerprint() != null) {
                        existing.setFingerprint(login.fingerprint());
                    }
                    existing.setEmail(login.email());
                    existing.setUserId(login.userId());
                    existing.setLastUsed(now);
                    persist();
                    log.info("更新 Antigravity 账号: id={}, email={}", existing.id(), existing.email());
                    return existing;
                }
            }
            DeviceFingerprint fingerprint = login.fingerprint() != null
                    ? login.fingerprint() : fingerprintGenerator.generate();
            AntigravityAccount created = new AntigravityAccount(normalizer.generateAccountId(), login.email(),
                    login.userId(), now, now, true, 0, login.refreshToken(), login.projectId(),
                    login.managedProjectId(), Map.of(), fingerprint);
            append(created);
            return created;
        });
    }

    /**
     * 添加 OpenAI 兼容账号；email 相同时原地更新 key
     */
    public OpenAiCompatibleAccount addOpenAiCompatibleAccount(OpenAiCompatibleLogin login) {
        return withLock(() -> {
            long now = clock.millis();
            for (Account account : config.accounts()) {
                if (account instanceof OpenAiCompatibleAccount existing && sameIdentity(existing.email(), login.email())) {
                    existing.updateKey(login.apiKey(), login.baseUrl());
                    existing.setLastUsed(now);
                    persist();
                    log.info("更新 OpenAI 兼容账号: id={}, email={}", existing.id(), existing.email());
                    return existing;
                }
            }
            OpenAiCompatibleAccount created = new OpenAiCompatibleAccount(normalizer.generateAccountId(),
                    login.email(), login.email(), now, now, true, 0, login.apiKey(), login.baseUrl());
            append(created);
            return created;
        });
    }

    private void append(Account account) {
        config.accounts().add(account);
        config.setCurrentAccountId(account.id());
        config.currentAccountIdByProvider().put(account.provider(), account.id());
        persist();
        log.info("添加账号: id={}, provider={}, name={}", account.id(), account.provider().wireName(), account.displayName());
    }

    // ==================== 变更 ====================

    /**
     * 删除账号，当前账号指针回退到同 provider 的第一个账号
     *
     * @return 被删除的账号
     */
    public Optional<Account> removeAccount(String identifier) {
        return withLock(() -> {
            Optional<Account> found = findAccount(identifier, null);
            if (found.isEmpty()) {
                return Optional.<Account>empty();
            }
            Account removed = found.get();
            config.accounts().remove(removed);

            if (removed.id().equals(config.currentAccountId())) {
                config.setCurrentAccountId(config.accounts().isEmpty() ? null : config.accounts().get(0).id());
            }
            AccountProvider provider = removed.provider();
            if (removed.id().equals(config.currentAccountIdByProvider().get(provider))) {
                Optional<Account> next = config.accounts().stream().filter(a -> a.provider() == provider).findFirst();
                if (next.isPresent()) {
                    config.currentAccountIdByProvider().put(provider, next.get().id());
                } else {
                    config.currentAccountIdByProvider().remove(provider);
                }
            }
            persist();
            log.info("删除账号: id={}, name={}", removed.id(), removed.displayName());
            return Optional.of(removed);
        });
    }

    /**
     * 指定当前账号，同时切换为 stick 策略
     */
    public boolean setCurrentAccount(String identifier) {
        return withLock(() -> {
            Optional<Account> account = findAccount(identifier, null);
            if (account.isEmpty()) {
                return false;
            }
            config.setCurrentAccountId(account.get().id());
            config.currentAccountIdByProvider().put(account.get().provider(), account.get().id());
            config.setStrategy(LoadBalancingStrategy.STICK);
            persist();
            return true;
        });
    }

    /**
     * 切换策略；切到 round-robin 时轮询游标归零
     */
    public void setStrategy(LoadBalancingStrategy strategy) {
        withLock(() -> {
            config.setStrategy(strategy);
            if (strategy == LoadBalancingStrategy.ROUND_ROBIN) {
                config.setRoundRobinIndex(0);
                config.roundRobinIndexByProvider().clear();
            }
            persist();
        });
        log.info("账号池策略切换为: {}", strategy.wireName());
    }

    public boolean setEnabled(String identifier, boolean enabled) {
        return withLock(() -> {
            Optional<Account> account = findAccount(identifier, null);
            if (account.isEmpty()) {
                return false;
            }
            account.get().setEnabled(enabled);
            persist();
            log.info("账号 {} 已{}", account.get().displayName(), enabled ? "启用" : "禁用");
            return true;
        });
    }

    /**
     * 清空全部账号并恢复 stick 策略
     *
     * @return 被清除的账号
     */
    public List<Account> clearAllAccounts() {
        return withLock(() -> {
            List<Account> removed = new ArrayList<>(config.accounts());
            config.accounts().clear();
            config.setStrategy(LoadBalancingStrategy.STICK);
            config.setCurrentAccountId(null);
            config.currentAccountIdByProvider().clear();
            config.setRoundRobinIndex(0);
            config.roundRobinIndexByProvider().clear();
            persist();
            log.info("已清空全部账号: {} 个", removed.size());
            return removed;
        });
    }

    /**
     * 刷新成功后写回 Codex 凭证
     */
    public void updateCodexCredentials(CodexAccount account, String accessToken, String refreshToken, Long expiresAt) {
        withLock(() -> {
            account.updateCredentials(accessToken, refreshToken, expiresAt);
            persist();
        });
    }

    /**
     * refreshToken 被轮换时写回
     */
    public void updateAntigravityRefreshToken(AntigravityAccount account, String refreshToken) {
        withLock(() -> {
            account.setRefreshToken(refreshToken);
            persist();
        });
    }

    // ==================== 加载 / 迁移 ====================

    private AccountsConfig loadConfig() {
        Optional<JSONObject> raw;
        try {
            raw = accountsFileDAO.readAccounts();
        } catch (IOException | JSONException e) {
            log.warn("账号配置解析失败, 使用默认配置: {}", e.getMessage());
            return AccountsConfig.empty();
        }
        if (raw.isEmpty()) {
            return AccountsConfig.empty();
        }
        AccountNormalizer.Normalized<AccountsConfig> normalized = normalizer.normalizeConfig(raw.get());
        config = normalized.value();
        if (normalized.changed()) {
            log.info("账号配置已规范化, 回写文件");
            persist();
        }
        return config;
    }

    /**
     * 旧版 auth.json 存在且 accounts.json 不存在时，迁移为单账号 v2 配置
     */
    private void migrateLegacyConfig() {
        if (!accountsFileDAO.legacyFileExists() || accountsFileDAO.accountsFileExists()) {
            return;
        }
        try {
            Optional<JSONObject> legacy = accountsFileDAO.readLegacy();
            if (legacy.isEmpty()) {
                return;
            }
            JSONObject old = legacy.get();
            String accessToken = AccountNormalizer.asString(old.get("accessToken"));
            String refreshToken = AccountNormalizer.asString(old.get("refreshToken"));
            if (accessToken == null && refreshToken == null) {
                return;
            }
            long now = clock.millis();
            CodexAccount account = new CodexAccount(normalizer.generateAccountId(),
                    AccountNormalizer.asString(old.get("email")), AccountNormalizer.asString(old.get("userId")),
                    now, now, true, 0, accessToken != null ? accessToken : "", refreshToken,
                    AccountNormalizer.asLong(old.get("expiresAt")));

            AccountsConfig migrated = AccountsConfig.empty();
            migrated.accounts().add(account);
            migrated.setCurrentAccountId(account.id());
            migrated.currentAccountIdByProvider().put(AccountProvider.CODEX, account.id());
            migrated.roundRobinIndexByProvider().put(AccountProvider.CODEX, 0);
            accountsFileDAO.writeAccounts(normalizer.toJson(migrated));
            log.info("旧版 auth.json 已迁移为多账号格式: id={}", account.id());
        } catch (IOException | JSONException e) {
            log.warn("迁移旧版 auth.json 失败: {}", e.getMessage());
        }
    }

    // ==================== 工具方法 ====================

    private Optional<Account> findAccount(String identifier, AccountProvider provider) {
        return config.accounts().stream()
                .filter(a -> provider == null || a.provider() == provider)
                .filter(a -> a.matches(identifier))
                .findFirst();
    }

    private static boolean sameIdentity(String existing, String incoming) {
        return existing != null && existing.equals(incoming);
    }

    // ==================== 添加参数 ====================

    public record CodexLogin(String email, String userId, String accessToken, String refreshToken, Long expiresAt) {
    }

    public record AntigravityLogin(String email, String userId, String refreshToken, String projectId,
                                   String managedProjectId, DeviceFingerprint fingerprint) {
    }

    public record OpenAiCompatibleLogin(String email, String apiKey, String baseUrl) {
    }
}
