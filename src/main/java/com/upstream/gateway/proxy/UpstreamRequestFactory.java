package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.pool.AccountSession;
import com.upstream.gateway.pool.AntigravityAccount;
import com.upstream.gateway.pool.OpenAiCompatibleAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 按 provider 组装上游请求（URL、请求头、请求体）
 */
@Component
public class UpstreamRequestFactory {

    private static final Logger log = LoggerFactory.getLogger(UpstreamRequestFactory.class);
    private static final String OPENAI_AUTH_CLAIM = "https://api.openai.com/auth";

    private final AppProperties properties;
    private final EndpointResolver endpointResolver;
    private final AntigravityHeaders antigravityHeaders;
    private final Random random;
    private final Clock clock;

    public UpstreamRequestFactory(AppProperties properties, EndpointResolver endpointResolver,
                                  AntigravityHeaders antigravityHeaders, Random random, Clock clock) {
        this.properties = properties;
        this.endpointResolver = endpointResolver;
        this.antigravityHeaders = antigravityHeaders;
        this.random = random;
        this.clock = clock;
    }

    public UpstreamRequest build(AccountSession session, CompletionRequest request, boolean streaming) {
        return switch (session.account().provider()) {
            case ANTIGRAVITY -> antigravity(session, request, streaming);
            case CODEX -> codex(session, request, streaming);
            case OPENAI_COMPATIBLE -> openAiCompatible(session, request, streaming);
        };
    }

    private UpstreamRequest antigravity(AccountSession session, CompletionRequest request, boolean streaming) {
        String endpoint = endpointResolver.resolve(session.headerStyle());
        String url = streaming
                ? endpoint + "/v1internal:streamGenerateContent?alt=sse"
                : endpoint + "/v1internal:generateContent";

        AntigravityAccount account = (AntigravityAccount) session.account();
        Map<String, String> headers = antigravityHeaders.build(session.headerStyle(), account.fingerprint(),
                session.accessToken());
        if (streaming) {
            headers.put("Accept", "text/event-stream");
        }

        JSONObject body = new JSONObject();
        body.put("project", session.projectId());
        body.put("model", request.model());
        body.put("request", request.payload());
        body.put("userAgent", "antigravity");
        body.put("requestId", createRequestId());
        return new UpstreamRequest(url, headers, body.toJSONString());
    }

    private UpstreamRequest codex(AccountSession session, CompletionRequest request, boolean streaming) {
        String url = EndpointResolver.stripTrailingSlash(properties.getCodex().getBaseUrl()) + "/codex/responses";

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + session.accessToken());
        headers.put("Content-Type", "application/json");
        extractChatGptAccountId(session.accessToken())
                .ifPresentOrElse(id -> headers.put("ChatGPT-Account-Id", id),
                        () -> log.debug("access token 中没有 ChatGPT 账号 ID: account={}", session.account().id()));
        headers.put("OpenAI-Beta", "responses=experimental");
        headers.put("originator", "codex_cli_rs");
        if (streaming) {
            headers.put("Accept", "text/event-stream");
        }
        return new UpstreamRequest(url, headers, passthroughBody(request, streaming));
    }

    private UpstreamRequest openAiCompatible(AccountSession session, CompletionRequest request, boolean streaming) {
        OpenAiCompatibleAccount account = (OpenAiCompatibleAccount) session.account();
        String baseUrl = account.baseUrl() != null && !account.baseUrl().isBlank()
                ? account.baseUrl() : properties.getOpenai().getDefaultBaseUrl();
        String url = EndpointResolver.stripTrailingSlash(baseUrl) + "/chat/completions";

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + session.accessToken());
        headers.put("Content-Type", "application/json");
        if (streaming) {
            headers.put("Accept", "text/event-stream");
        }
        return new UpstreamRequest(url, headers, passthroughBody(request, streaming));
    }

    private static String passthroughBody(CompletionRequest request, boolean streaming) {
        JSONObject body = request.payload() != null ? new JSONObject(request.payload()) : new JSONObject();
        if (request.model() != null) {
            body.putIfAbsent("model", request.model());
        }
        body.put("stream", streaming);
        return body.toJSONString();
    }

    String createRequestId() {
        byte[] bytes = new byte[4];
        random.nextBytes(bytes);
        return "gw_" + clock.millis() + "_" + HexFormat.of().formatHex(bytes);
    }

    /**
     * 从 ChatGPT access token（JWT）中读取 chatgpt_account_id
     */
    static Optional<String> extractChatGptAccountId(String accessToken) {
        String[] parts = accessToken != null ? accessToken.split("\\.") : new String[0];
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            String json = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            if (JSON.parse(json) instanceof JSONObject payload
                    && payload.get(OPENAI_AUTH_CLAIM) instanceof JSONObject auth
                    && auth.get("chatgpt_account_id") instanceof String accountId && !accountId.isEmpty()) {
                return Optional.of(accountId);
            }
            return Optional.empty();
        } catch (IllegalArgumentException | JSONException e) {
            return Optional.empty();
        }
    }
}
