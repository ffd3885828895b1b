package com.upstream.gateway.proxy;

import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.pool.DeviceFingerprint;
import com.upstream.gateway.pool.FingerprintGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Antigravity 请求头
 * <p>
 * 两种风格各自模拟一类客户端；antigravity 风格优先使用账号指纹中的 User-Agent
 */
@Component
public class AntigravityHeaders {

    static final String ANTIGRAVITY_CLIENT_METADATA =
            "{\"ideType\":\"IDE_UNSPECIFIED\",\"platform\":\"PLATFORM_UNSPECIFIED\",\"pluginType\":\"GEMINI\"}";
    static final String GEMINI_CLI_CLIENT_METADATA =
            "ideType=IDE_UNSPECIFIED,platform=PLATFORM_UNSPECIFIED,pluginType=GEMINI";

    private static final List<String> ANTIGRAVITY_USER_AGENTS = List.of(
            "windows/amd64", "darwin/arm64", "linux/amd64", "darwin/amd64", "linux/arm64"
    ).stream().map(p -> "antigravity/" + FingerprintGenerator.ANTIGRAVITY_VERSION + " " + p).toList();

    private static final List<String> ANTIGRAVITY_API_CLIENTS = List.of(
            "google-cloud-sdk vscode_cloudshelleditor/0.1",
            "google-cloud-sdk vscode/1.96.0",
            "google-cloud-sdk jetbrains/2024.3",
            "google-cloud-sdk vscode/1.95.0"
    );

    private static final List<String> GEMINI_CLI_USER_AGENTS = List.of(
            "google-api-nodejs-client/9.15.1",
            "google-api-nodejs-client/9.14.0",
            "google-api-nodejs-client/9.13.0"
    );

    private static final List<String> GEMINI_CLI_API_CLIENTS = List.of(
            "gl-node/22.17.0",
            "gl-node/22.12.0",
            "gl-node/20.18.0",
            "gl-node/21.7.0"
    );

    private final Random random;

    public AntigravityHeaders(Random random) {
        this.random = random;
    }

    public Map<String, String> build(HeaderStyle style, DeviceFingerprint fingerprint, String accessToken) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + accessToken);
        headers.put("Content-Type", "application/json");
        if (style == HeaderStyle.GEMINI_CLI) {
            headers.put("User-Agent", pick(GEMINI_CLI_USER_AGENTS));
            headers.put("X-Goog-Api-Client", pick(GEMINI_CLI_API_CLIENTS));
            headers.put("Client-Metadata", GEMINI_CLI_CLIENT_METADATA);
        } else {
            String userAgent = fingerprint != null && fingerprint.userAgent() != null
                    ? fingerprint.userAgent() : pick(ANTIGRAVITY_USER_AGENTS);
            headers.put("User-Agent", userAgent);
            headers.put("X-Goog-Api-Client", pick(ANTIGRAVITY_API_CLIENTS));
            headers.put("Client-Metadata", ANTIGRAVITY_CLIENT_METADATA);
        }
        return headers;
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }
}
