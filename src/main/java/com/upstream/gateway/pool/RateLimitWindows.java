package com.upstream.gateway.pool;

import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流窗口
 * <p>
 * Codex / OpenAI 兼容账号：每个账号一个冷却时间（仅内存）；
 * Antigravity 账号：claude / gemini-antigravity / gemini-cli 三个独立窗口（随账号持久化）。
 * 过期窗口在读取时清除。Antigravity 部分必须在 {@link AccountStore} 锁内调用
 */
@Component
public class RateLimitWindows {

    private final Clock clock;
    private final ConcurrentHashMap<String, Long> cooldowns = new ConcurrentHashMap<>();

    public RateLimitWindows(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param family      为 null 时按 claude 处理
     * @param headerStyle gemini 家族指定路径时只看该路径的窗口；为 null 时两条路径都受限才算受限
     */
    public boolean isRateLimited(Account account, ModelFamily family, HeaderStyle headerStyle) {
        if (account instanceof AntigravityAccount antigravity) {
            return isAntigravityRateLimited(antigravity, family, headerStyle);
        }
        Long resetTime = cooldowns.get(account.id());
        if (resetTime == null) {
            return false;
        }
        if (clock.millis() >= resetTime) {
            cooldowns.remove(account.id(), resetTime);
            return false;
        }
        return true;
    }

    public boolean isRateLimited(Account account, ModelFamily family) {
        return isRateLimited(account, family, null);
    }

    /**
     * 选出可用的请求路径：claude 只走 antigravity 风格；gemini 优先 antigravity，其次 gemini-cli
     *
     * @return 对应窗口都在冷却中时返回 empty
     */
    public Optional<HeaderStyle> availableHeaderStyle(AntigravityAccount account, ModelFamily family) {
        if (family != ModelFamily.GEMINI) {
            return isRateLimited(account, ModelFamily.CLAUDE, null)
                    ? Optional.empty() : Optional.of(HeaderStyle.ANTIGRAVITY);
        }
        if (!isRateLimited(account, ModelFamily.GEMINI, HeaderStyle.ANTIGRAVITY)) {
            return Optional.of(HeaderStyle.ANTIGRAVITY);
        }
        if (!isRateLimited(account, ModelFamily.GEMINI, HeaderStyle.GEMINI_CLI)) {
            return Optional.of(HeaderStyle.GEMINI_CLI);
        }
        return Optional.empty();
    }

    /**
     * 标记窗口冷却到 until（epoch ms）；非 Antigravity 账号只有一个冷却时间，忽略 key
     */
    public void mark(Account account, RateLimitKey key, long until) {
        if (account instanceof AntigravityAccount antigravity) {
            antigravity.rateLimitResetTimes().put(key, until);
            return;
        }
        cooldowns.put(account.id(), until);
    }

    public void clear(String accountId) {
        cooldowns.remove(accountId);
    }

    static RateLimitKey keyFor(ModelFamily family, HeaderStyle headerStyle) {
        if (family != ModelFamily.GEMINI) {
            return RateLimitKey.CLAUDE;
        }
        return headerStyle == HeaderStyle.GEMINI_CLI ? RateLimitKey.GEMINI_CLI : RateLimitKey.GEMINI_ANTIGRAVITY;
    }

    private boolean isAntigravityRateLimited(AntigravityAccount account, ModelFamily family, HeaderStyle headerStyle) {
        long now = clock.millis();
        Map<RateLimitKey, Long> resetTimes = account.rateLimitResetTimes();
        resetTimes.values().removeIf(resetTime -> now >= resetTime);

        if (family != ModelFamily.GEMINI) {
            return resetTimes.containsKey(RateLimitKey.CLAUDE);
        }
        if (headerStyle != null) {
            return resetTimes.containsKey(keyFor(family, headerStyle));
        }
        return resetTimes.containsKey(RateLimitKey.GEMINI_ANTIGRAVITY)
                && resetTimes.containsKey(RateLimitKey.GEMINI_CLI);
    }
}
