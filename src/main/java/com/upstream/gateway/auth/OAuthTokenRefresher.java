package com.upstream.gateway.auth;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.exception.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OAuth2 refresh_token 授权（application/x-www-form-urlencoded）
 */
public abstract class OAuthTokenRefresher implements TokenRefresher {

    private static final Logger log = LoggerFactory.getLogger(OAuthTokenRefresher.class);

    private final HttpClient httpClient;
    private final String name;

    protected OAuthTokenRefresher(HttpClient httpClient, String name) {
        this.httpClient = httpClient;
        this.name = name;
    }

    protected abstract String tokenUrl();

    /**
     * client_id / client_secret 等客户端参数
     */
    protected abstract Map<String, String> clientParams();

    @Override
    public TokenResult refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthenticationException(name + " 缺少 refreshToken");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.putAll(clientParams());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl()))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.error("{} Token 刷新失败: status={}, body={}", name, response.statusCode(), response.body());
                throw new AuthenticationException(name + " Token 刷新失败: " + response.statusCode());
            }

            JSONObject json = JSONObject.parseObject(response.body());
            String accessToken = json != null ? json.getString("access_token") : null;
            if (accessToken == null || accessToken.isEmpty()) {
                throw new AuthenticationException(name + " 刷新未返回 access_token");
            }
            String newRefreshToken = json.getString("refresh_token");
            Long expiresIn = json.getLong("expires_in");

            log.debug("{} Token 刷新成功: expiresIn={}s", name, expiresIn);
            return new TokenResult(accessToken,
                    newRefreshToken != null && !newRefreshToken.isEmpty() ? newRefreshToken : null,
                    expiresIn);

        } catch (IOException | JSONException e) {
            throw new AuthenticationException(name + " Token 刷新异常: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException(name + " Token 刷新被中断", e);
        }
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
