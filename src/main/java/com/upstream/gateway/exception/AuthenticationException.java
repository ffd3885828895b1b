package com.upstream.gateway.exception;

/**
 * 认证异常（凭证缺失、刷新失败等）
 */
public class AuthenticationException extends UpstreamGatewayException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause);
    }
}
