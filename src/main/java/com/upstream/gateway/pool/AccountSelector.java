package com.upstream.gateway.pool;

import com.upstream.gateway.model.ModelFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 账号选择
 * <p>
 * 支持 3 种策略：stick / round-robin / hybrid；
 * 所有候选都处于限流窗口时退化为在全部启用账号中选择，而不是阻塞等待
 */
@Component
public class AccountSelector {

    private static final Logger log = LoggerFactory.getLogger(AccountSelector.class);

    private final AccountStore accountStore;
    private final RateLimitWindows rateLimitWindows;
    private final HealthScoreTracker healthScoreTracker;
    private final TokenBucketTracker tokenBucketTracker;
    private final Clock clock;
    private final Map<LoadBalancingStrategy, SelectionStrategy> strategies = new EnumMap<>(LoadBalancingStrategy.class);

    public AccountSelector(AccountStore accountStore, RateLimitWindows rateLimitWindows,
                           HealthScoreTracker healthScoreTracker, TokenBucketTracker tokenBucketTracker, Clock clock) {
        this.accountStore = accountStore;
        this.rateLimitWindows = rateLimitWindows;
        this.healthScoreTracker = healthScoreTracker;
        this.tokenBucketTracker = tokenBucketTracker;
        this.clock = clock;
        strategies.put(LoadBalancingStrategy.STICK, new StickStrategy());
        strategies.put(LoadBalancingStrategy.ROUND_ROBIN, new RoundRobinStrategy());
        strategies.put(LoadBalancingStrategy.HYBRID, new HybridStrategy());
    }

    /**
     * 按当前策略选择账号
     *
     * @return 该 provider 没有启用的账号时返回 empty
     */
    public Optional<Account> select(AccountProvider provider, ModelFamily family) {
        return accountStore.withLock(() -> {
            List<Account> enabled = accountStore.enabledAccounts(provider);
            if (enabled.isEmpty()) {
                return Optional.<Account>empty();
            }
            LoadBalancingStrategy strategy = accountStore.config().strategy();
            Account selected = strategies.get(strategy).select(provider, enabled, family);
            log.debug("选择账号: provider={}, strategy={}, account={}",
                    provider.wireName(), strategy.wireName(), selected.id());
            return Optional.of(selected);
        });
    }

    private List<Account> notRateLimited(List<Account> accounts, ModelFamily family) {
        return accounts.stream()
                .filter(a -> !rateLimitWindows.isRateLimited(a, family))
                .toList();
    }

    // ==================== 策略实现 ====================

    private class StickStrategy implements SelectionStrategy {
        @Override
        public Account select(AccountProvider provider, List<Account> enabled, ModelFamily family) {
            AccountsConfig config = accountStore.config();
            String currentId = config.currentAccountIdByProvider().get(provider);
            Optional<Account> current = enabled.stream().filter(a -> a.id().equals(currentId)).findFirst();
            if (current.isPresent() && !rateLimitWindows.isRateLimited(current.get(), family)) {
                return current.get();
            }

            Account selected = enabled.stream()
                    .filter(a -> !rateLimitWindows.isRateLimited(a, family))
                    .findFirst()
                    .orElse(enabled.get(0));
            if (!selected.id().equals(currentId)) {
                config.currentAccountIdByProvider().put(provider, selected.id());
                accountStore.persist();
                log.info("当前账号不可用, 切换到: provider={}, account={}", provider.wireName(), selected.displayName());
            }
            return selected;
        }
    }

    private class RoundRobinStrategy implements SelectionStrategy {
        @Override
        public Account select(AccountProvider provider, List<Account> enabled, ModelFamily family) {
            List<Account> available = notRateLimited(enabled, family);
            List<Account> candidates = available.isEmpty() ? enabled : available;

            AccountsConfig config = accountStore.config();
            int index = Math.max(0, config.roundRobinIndexByProvider().getOrDefault(provider, 0));
            Account selected = candidates.get(index % candidates.size());
            config.roundRobinIndexByProvider().put(provider, (index + 1) % candidates.size());
            config.currentAccountIdByProvider().put(provider, selected.id());
            accountStore.persist();
            return selected;
        }
    }

    private class HybridStrategy implements SelectionStrategy {
        @Override
        public Account select(AccountProvider provider, List<Account> enabled, ModelFamily family) {
            List<Account> available = notRateLimited(enabled, family);
            List<Account> candidates = available.isEmpty() ? enabled : available;

            // 有令牌优先，其次健康分高，最后最久未使用
            Comparator<Account> ranking = Comparator
                    .comparing((Account a) -> tokenBucketTracker.getTokens(a.id()) <= 0)
                    .thenComparing(a -> healthScoreTracker.getScore(a.id()), Comparator.reverseOrder())
                    .thenComparingLong(Account::lastUsed);
            Account selected = candidates.stream().min(ranking).orElse(enabled.get(0));

            tokenBucketTracker.consumeTokens(selected.id());
            selected.setLastUsed(clock.millis());
            accountStore.config().currentAccountIdByProvider().put(provider, selected.id());
            accountStore.persist();
            return selected;
        }
    }
}
