package com.upstream.gateway.auth;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.exception.AuthenticationException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OAuthTokenRefresherTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();

    @Test
    void codex_sendsPublicClientId() {
        CodexTokenRefresher refresher = new CodexTokenRefresher(httpClient, new AppProperties());

        assertEquals("https://auth.openai.com/oauth/token", refresher.tokenUrl());
        assertEquals(Map.of("client_id", "app_EMoamEEZ73f0CkXaXp7hrann"), refresher.clientParams());
    }

    @Test
    void antigravity_omitsSecretUntilConfigured() {
        AppProperties properties = new AppProperties();
        AntigravityTokenRefresher refresher = new AntigravityTokenRefresher(httpClient, properties);

        assertFalse(refresher.clientParams().containsKey("client_secret"));

        properties.getRefresh().setAntigravityClientSecret("configured-secret");
        assertEquals("configured-secret", refresher.clientParams().get("client_secret"));
        assertEquals(properties.getRefresh().getAntigravityClientId(), refresher.clientParams().get("client_id"));
    }

    @Test
    void refresh_blankRefreshTokenFailsBeforeAnyRequest() {
        CodexTokenRefresher refresher = new CodexTokenRefresher(httpClient, new AppProperties());

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> refresher.refresh(" "));
        assertEquals(401, e.getStatusCode());
    }
}
