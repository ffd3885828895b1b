package com.upstream.gateway.auth;

import com.upstream.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Antigravity（Google OAuth）Token 刷新
 */
@Component("antigravityTokenRefresher")
public class AntigravityTokenRefresher extends OAuthTokenRefresher {

    private final AppProperties.RefreshConfig config;

    public AntigravityTokenRefresher(HttpClient upstreamHttpClient, AppProperties properties) {
        super(upstreamHttpClient, "Antigravity");
        this.config = properties.getRefresh();
    }

    @Override
    protected String tokenUrl() {
        return config.getAntigravityTokenUrl();
    }

    @Override
    protected Map<String, String> clientParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.getAntigravityClientId());
        if (config.getAntigravityClientSecret() != null && !config.getAntigravityClientSecret().isEmpty()) {
            params.put("client_secret", config.getAntigravityClientSecret());
        }
        return params;
    }
}
