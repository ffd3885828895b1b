package com.upstream.gateway.pool;

import com.upstream.gateway.model.ModelFamily;

import java.util.List;

/**
 * 账号选择策略接口
 */
public interface SelectionStrategy {

    /**
     * 从启用的账号中选择一个（在 {@link AccountStore} 锁内调用）
     *
     * @param provider 账号提供方
     * @param enabled  该 provider 下启用的账号，非空
     * @param family   模型家族，仅用于 Antigravity 限流判断，可为 null
     * @return 选中的账号，不返回 null
     */
    Account select(AccountProvider provider, List<Account> enabled, ModelFamily family);
}
