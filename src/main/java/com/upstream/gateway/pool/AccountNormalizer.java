package com.upstream.gateway.pool;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * accounts.json 与内存模型之间的转换
 * <p>
 * 读取时把每条记录规范化为合法账号：补齐 id / 时间戳 / 指纹，丢弃缺少凭证的记录，
 * 有任何修补时通过 {@link Normalized#changed()} 通知调用方回写文件
 */
@Component
public class AccountNormalizer {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final FingerprintGenerator fingerprintGenerator;
    private final Random random;
    private final Clock clock;

    public AccountNormalizer(FingerprintGenerator fingerprintGenerator, Random random, Clock clock) {
        this.fingerprintGenerator = fingerprintGenerator;
        this.random = random;
        this.clock = clock;
    }

    /**
     * 生成账号 ID，格式 acc_{毫秒时间戳}_{7 位 base36}
     */
    public String generateAccountId() {
        StringBuilder suffix = new StringBuilder(7);
        for (int i = 0; i < 7; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "acc_" + clock.millis() + "_" + suffix;
    }

    // ==================== 读取 ====================

    public Normalized<AccountsConfig> normalizeConfig(JSONObject raw) {
        AccountsConfig config = AccountsConfig.empty();
        boolean changed = !Integer.valueOf(AccountsConfig.VERSION).equals(raw.get("version"));
        long now = clock.millis();

        Object rawAccounts = raw.get("accounts");
        if (rawAccounts instanceof JSONArray array) {
            Set<String> seenIds = new HashSet<>();
            for (Object item : array) {
                Optional<Normalized<Account>> normalized = normalizeAccount(item, now);
                if (normalized.isEmpty() || !seenIds.add(normalized.get().value().id())) {
                    changed = true;
                    continue;
                }
                config.accounts().add(normalized.get().value());
                changed |= normalized.get().changed();
            }
        } else {
            changed = true;
        }

        Object rawStrategy = raw.get("strategy");
        Optional<LoadBalancingStrategy> strategy = rawStrategy instanceof String s
                ? LoadBalancingStrategy.fromWireName(s) : Optional.empty();
        config.setStrategy(strategy.orElse(LoadBalancingStrategy.STICK));
        if (strategy.isEmpty() || !strategy.get().wireName().equals(rawStrategy)) {
            changed = true;
        }

        Long roundRobinIndex = asLong(raw.get("roundRobinIndex"));
        config.setRoundRobinIndex(roundRobinIndex != null ? roundRobinIndex.intValue() : 0);
        if (roundRobinIndex == null) {
            changed = true;
        }

        config.setCurrentAccountId(asString(raw.get("currentAccountId")));

        if (raw.get("currentAccountIdByProvider") instanceof JSONObject byProvider) {
            for (Map.Entry<String, Object> entry : byProvider.entrySet()) {
                Optional<AccountProvider> provider = AccountProvider.fromWireName(entry.getKey());
                String id = asString(entry.getValue());
                if (provider.isPresent() && id != null) {
                    config.currentAccountIdByProvider().put(provider.get(), id);
                }
            }
        }
        if (raw.get("roundRobinIndexByProvider") instanceof JSONObject byProvider) {
            for (Map.Entry<String, Object> entry : byProvider.entrySet()) {
                Optional<AccountProvider> provider = AccountProvider.fromWireName(entry.getKey());
                Long index = asLong(entry.getValue());
                if (provider.isPresent() && index != null) {
                    config.roundRobinIndexByProvider().put(provider.get(), index.intValue());
                }
            }
        }

        return new Normalized<>(config, changed);
    }

    /**
     * 规范化单条账号记录
     *
     * @return 记录不可用（非对象、缺少凭证）时返回 empty
     */
    public Optional<Normalized<Account>> normalizeAccount(Object item, long fallbackTime) {
        if (!(item instanceof JSONObject raw)) {
            return Optional.empty();
        }

        Object rawProvider = raw.get("provider");
        AccountProvider provider = rawProvider instanceof String s
                ? AccountProvider.fromWireName(s).orElse(AccountProvider.CODEX)
                : AccountProvider.CODEX;
        boolean changed = !provider.wireName().equals(rawProvider);

        String id = asString(raw.get("id"));
        if (id == null) {
            id = generateAccountId();
            changed = true;
        }

        Long addedAtValue = asLong(raw.get("addedAt"));
        long addedAt = addedAtValue != null ? addedAtValue : fallbackTime;
        Long lastUsedValue = asLong(raw.get("lastUsed"));
        long lastUsed = lastUsedValue != null ? lastUsedValue : addedAt;
        boolean enabled = !Boolean.FALSE.equals(raw.get("enabled"));
        Long healthValue = asLong(raw.get("healthScore"));
        int healthScore = healthValue != null ? healthValue.intValue() : 0;

        String email = asString(raw.get("email"));
        String userId = asString(raw.get("userId"));

        switch (provider) {
            case ANTIGRAVITY -> {
                String refreshToken = asString(raw.get("refreshToken"));
                if (refreshToken == null) {
                    return Optional.empty();
                }
                DeviceFingerprint fingerprint = readFingerprint(raw.get("fingerprint"));
                if (fingerprint == null) {
                    fingerprint = fingerprintGenerator.generate();
                    changed = true;
                }
                Map<RateLimitKey, Long> resetTimes = new EnumMap<>(RateLimitKey.class);
                if (raw.get("rateLimitResetTimes") instanceof JSONObject times) {
                    for (Map.Entry<String, Object> entry : times.entrySet()) {
                        Optional<RateLimitKey> key = RateLimitKey.fromWireName(entry.getKey());
                        Long until = asLong(entry.getValue());
                        if (key.isPresent() && until != null) {
                            resetTimes.put(key.get(), until);
                        }
                    }
                } else {
                    changed = true;
                }
                return Optional.of(new Normalized<>(new AntigravityAccount(id, email, userId, addedAt, lastUsed,
                        enabled, healthScore, refreshToken, asString(raw.get("projectId")),
                        asString(raw.get("managedProjectId")), resetTimes, fingerprint), changed));
            }
            case OPENAI_COMPATIBLE -> {
                String apiKey = asString(raw.get("apiKey"));
                if (apiKey == null) {
                    return Optional.empty();
                }
                return Optional.of(new Normalized<>(new OpenAiCompatibleAccount(id, email,
                        userId != null ? userId : email, addedAt, lastUsed, enabled, healthScore,
                        apiKey, asString(raw.get("baseURL"))), changed));
            }
            default -> {
                String accessToken = asString(raw.get("accessToken"));
                String refreshToken = asString(raw.get("refreshToken"));
                if (accessToken == null && refreshToken == null) {
                    return Optional.empty();
                }
                return Optional.of(new Normalized<>(new CodexAccount(id, email, userId, addedAt, lastUsed,
                        enabled, healthScore, accessToken != null ? accessToken : "", refreshToken,
                        asLong(raw.get("expiresAt"))), changed));
            }
        }
    }

    // ==================== 写出 ====================

    public JSONObject toJson(AccountsConfig config) {
        JSONObject json = new JSONObject();
        json.put("version", AccountsConfig.VERSION);
        JSONArray accounts = new JSONArray();
        for (Account account : config.accounts()) {
            accounts.add(toJson(account));
        }
        json.put("accounts", accounts);
        json.put("strategy", config.strategy().wireName());
        json.put("currentAccountId", config.currentAccountId());
        JSONObject currentByProvider = new JSONObject();
        config.currentAccountIdByProvider().forEach((p, id) -> currentByProvider.put(p.wireName(), id));
        json.put("currentAccountIdByProvider", currentByProvider);
        json.put("roundRobinIndex", config.roundRobinIndex());
        JSONObject indexByProvider = new JSONObject();
        config.roundRobinIndexByProvider().forEach((p, index) -> indexByProvider.put(p.wireName(), index));
        json.put("roundRobinIndexByProvider", indexByProvider);
        return json;
    }

    public JSONObject toJson(Account account) {
        JSONObject json = new JSONObject();
        json.put("id", account.id());
        json.put("provider", account.provider().wireName());
        json.put("email", account.email());
        json.put("userId", account.userId());
        if (account instanceof CodexAccount codex) {
            json.put("accessToken", codex.accessToken());
            json.put("refreshToken", codex.refreshToken());
            json.put("expiresAt", codex.expiresAt());
        } else if (account instanceof AntigravityAccount antigravity) {
            json.put("refreshToken", antigravity.refreshToken());
            json.put("projectId", antigravity.projectId());
            json.put("managedProjectId", antigravity.managedProjectId());
            JSONObject resetTimes = new JSONObject();
            antigravity.rateLimitResetTimes().forEach((key, until) -> resetTimes.put(key.wireName(), until));
            json.put("rateLimitResetTimes", resetTimes);
            DeviceFingerprint fingerprint = antigravity.fingerprint();
            if (fingerprint != null) {
                JSONObject fp = new JSONObject();
                fp.put("userAgent", fingerprint.userAgent());
                fp.put("platform", fingerprint.platform());
                fp.put("arch", fingerprint.arch());
                json.put("fingerprint", fp);
            }
        } else if (account instanceof OpenAiCompatibleAccount openai) {
            json.put("apiKey", openai.apiKey());
            json.put("baseURL", openai.baseUrl());
        }
        json.put("addedAt", account.addedAt());
        json.put("lastUsed", account.lastUsed());
        json.put("enabled", account.enabled());
        json.put("healthScore", account.healthScore());
        return json;
    }

    // ==================== 工具方法 ====================

    private static DeviceFingerprint readFingerprint(Object value) {
        if (value instanceof JSONObject fp && asString(fp.get("userAgent")) != null) {
            return new DeviceFingerprint(asString(fp.get("userAgent")),
                    asString(fp.get("platform")), asString(fp.get("arch")));
        }
        return null;
    }

    static String asString(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    static Long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : null;
    }

    /**
     * 规范化结果
     *
     * @param changed 是否对原始数据做过修补（需要回写）
     */
    public record Normalized<T>(T value, boolean changed) {
    }
}
