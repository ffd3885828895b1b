package com.upstream.gateway.exception;

import com.upstream.gateway.pool.AccountProvider;

/**
 * 无可用账号异常（该 provider 没有任何启用的账号）
 */
public class NoAvailableAccountException extends UpstreamGatewayException {

    public NoAvailableAccountException(AccountProvider provider) {
        super("没有配置可用的 " + provider.wireName() + " 账号", 503);
    }
}
