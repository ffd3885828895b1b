package com.upstream.gateway.pool;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * accounts.json（v2）在内存中的形态，只在 {@link AccountStore} 的锁内读写
 */
public class AccountsConfig {

    public static final int VERSION = 2;

    private final List<Account> accounts = new ArrayList<>();
    private LoadBalancingStrategy strategy = LoadBalancingStrategy.STICK;
    // 旧版全局字段，只做读写透传
    private String currentAccountId;
    private int roundRobinIndex;
    private final Map<AccountProvider, String> currentAccountIdByProvider = new EnumMap<>(AccountProvider.class);
    private final Map<AccountProvider, Integer> roundRobinIndexByProvider = new EnumMap<>(AccountProvider.class);

    public static AccountsConfig empty() {
        return new AccountsConfig();
    }

    public List<Account> accounts() { return accounts; }
    public LoadBalancingStrategy strategy() { return strategy; }
    public void setStrategy(LoadBalancingStrategy strategy) { this.strategy = strategy; }
    public String currentAccountId() { return currentAccountId; }
    public void setCurrentAccountId(String currentAccountId) { this.currentAccountId = currentAccountId; }
    public int roundRobinIndex() { return roundRobinIndex; }
    public void setRoundRobinIndex(int roundRobinIndex) { this.roundRobinIndex = roundRobinIndex; }
    public Map<AccountProvider, String> currentAccountIdByProvider() { return currentAccountIdByProvider; }
    public Map<AccountProvider, Integer> roundRobinIndexByProvider() { return roundRobinIndexByProvider; }
}
