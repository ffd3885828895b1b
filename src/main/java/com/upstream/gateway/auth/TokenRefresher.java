package com.upstream.gateway.auth;

/**
 * Token 刷新接口
 * <p>
 * 不同 provider 实现不同的 OAuth 刷新端点
 */
public interface TokenRefresher {

    /**
     * 用 refresh token 换取新的 access token
     *
     * @param refreshToken 刷新令牌
     * @return 刷新结果
     * @throws com.upstream.gateway.exception.AuthenticationException 刷新失败
     */
    TokenResult refresh(String refreshToken);

    /**
     * 刷新结果
     *
     * @param accessToken      新的访问令牌
     * @param refreshToken     轮换后的刷新令牌，未轮换时为 null
     * @param expiresInSeconds 有效期（秒），上游未返回时为 null
     */
    record TokenResult(String accessToken, String refreshToken, Long expiresInSeconds) {}
}
