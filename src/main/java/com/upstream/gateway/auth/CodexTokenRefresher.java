package com.upstream.gateway.auth;

import com.upstream.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.Map;

/**
 * Codex（ChatGPT）Token 刷新，使用 auth.openai.com 的 OAuth 端点
 */
@Component("codexTokenRefresher")
public class CodexTokenRefresher extends OAuthTokenRefresher {

    private final AppProperties.RefreshConfig config;

    public CodexTokenRefresher(HttpClient upstreamHttpClient, AppProperties properties) {
        super(upstreamHttpClient, "Codex");
        this.config = properties.getRefresh();
    }

    @Override
    protected String tokenUrl() {
        return config.getCodexTokenUrl();
    }

    @Override
    protected Map<String, String> clientParams() {
        return Map.of("client_id", config.getCodexClientId());
    }
}
