package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.exception.AuthenticationException;
import com.upstream.gateway.exception.NoAvailableAccountException;
import com.upstream.gateway.exception.TransportException;
import com.upstream.gateway.exception.UpstreamApiException;
import com.upstream.gateway.exception.UpstreamGatewayException;
import com.upstream.gateway.model.ModelFamily;
import com.upstream.gateway.model.ModelFamilyResolver;
import com.upstream.gateway.pool.Account;
import com.upstream.gateway.pool.AccountPool;
import com.upstream.gateway.pool.AccountSession;
import com.upstream.gateway.pool.RateLimitMark;
import com.upstream.gateway.util.TokenMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * 上游请求路由
 * <p>
 * 每次尝试都重新选号：
 * - 传输错误：指数退避后重试
 * - 429/503：标记限流窗口，短暂等待后换号重试
 * - 401/403：丢弃缓存的 access token，退避后重试
 * - 其他 5xx：退避后重试
 * - 其他 4xx：直接失败，不扣账号分
 * 流式响应开始后的读取错误不再重试
 */
@Component
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final AccountPool accountPool;
    private final UpstreamTransport transport;
    private final UpstreamRequestFactory requestFactory;
    private final RateLimitParser rateLimitParser;
    private final RetryHandler retryHandler;
    private final ModelFamilyResolver modelFamilyResolver;

    public RequestRouter(AccountPool accountPool, UpstreamTransport transport, UpstreamRequestFactory requestFactory,
                         RateLimitParser rateLimitParser, RetryHandler retryHandler,
                         ModelFamilyResolver modelFamilyResolver) {
        this.accountPool = accountPool;
        this.transport = transport;
        this.requestFactory = requestFactory;
        this.rateLimitParser = rateLimitParser;
        this.retryHandler = retryHandler;
        this.modelFamilyResolver = modelFamilyResolver;
    }

    /**
     * 非流式调用，返回上游响应 JSON
     */
    public JSONObject complete(CompletionRequest request) {
        return execute(request, null);
    }

    /**
     * 流式调用，文本增量通过回调返回
     */
    public void stream(CompletionRequest request, StreamCallback callback) {
        execute(request, callback);
    }

    private JSONObject execute(CompletionRequest request, StreamCallback callback) {
        boolean streaming = callback != null;
        int maxRetries = request.maxRetries() != null ? Math.max(0, request.maxRetries()) : retryHandler.maxRetries();
        int maxAttempts = maxRetries + 1;
        ModelFamily family = request.modelFamily() != null
                ? request.modelFamily() : modelFamilyResolver.resolve(request.model());
        String provider = request.provider().wireName();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean lastAttempt = attempt >= maxAttempts;
            if (request.cancellation() != null) {
                request.cancellation().throwIfCancelled();
            }

            Account account = accountPool.getCurrentAccount(request.provider(), family)
                    .orElseThrow(() -> new NoAvailableAccountException(request.provider()));

            Optional<AccountSession> opened = accountPool.openSession(account, family);
            if (opened.isEmpty()) {
                accountPool.markRequestFailure(account.id());
                if (lastAttempt) {
                    throw new AuthenticationException("账号 " + account.displayName() + " 无法获取访问凭证");
                }
                retryHandler.waitBeforeRetry(attempt, "凭证获取失败");
                continue;
            }
            AccountSession session = opened.get();
            UpstreamRequest upstreamRequest = requestFactory.build(session, request, streaming);

            log.debug("发送上游请求: provider={}, account={}, token={}, model={}, attempt={}/{}, headerStyle={}, streaming={}",
                    provider, account.id(), TokenMasker.mask(session.accessToken()), request.model(),
                    attempt, maxAttempts, session.headerStyle(), streaming);

            UpstreamResponse response;
            try {
                response = transport.send(upstreamRequest, request.cancellation());
            } catch (IOException e) {
                log.error("调用上游异常: provider={}, account={}, attempt={}", provider, account.id(), attempt, e);
                if (lastAttempt) {
                    throw new TransportException(provider + " 请求失败: " + e.getMessage(), e);
                }
                retryHandler.waitBeforeRetry(attempt, "传输错误");
                continue;
            }

            try (response) {
                int statusCode = response.statusCode();

                if (response.isSuccess()) {
                    if (streaming) {
                        consumeStream(response, request, callback);
                        accountPool.markRequestSuccess(account.id());
                        return null;
                    }
                    JSONObject payload = parseBody(response.readBody());
                    accountPool.markRequestSuccess(account.id());
                    return payload;
                }

                String body = response.readBody();

                // 限流：标记窗口后换号
                if (statusCode == 429 || statusCode == 503) {
                    RateLimitInfo info = rateLimitParser.parse(response, body, request.model(), session.headerStyle());
                    long backoffMs = accountPool.markRateLimited(account.id(),
                            new RateLimitMark(family, info.reason(), info.retryAfterMs(), session.headerStyle(), info.windowKey()));
                    log.warn("账号被限流, 切换账号: provider={}, account={}, reason={}, backoff={}ms",
                            provider, account.displayName(), info.reason(), backoffMs);
                    if (lastAttempt) {
                        throw new UpstreamApiException(statusCode, body);
                    }
                    retryHandler.waitBeforeRotate(backoffMs);
                    continue;
                }

                // 认证错误：丢弃缓存凭证后重试
                if (statusCode == 401 || statusCode == 403) {
                    accountPool.markRequestFailure(account.id());
                    if (lastAttempt) {
                        throw new UpstreamApiException(statusCode, body);
                    }
                    accountPool.invalidateAccess(account.id());
                    retryHandler.waitBeforeRetry(attempt, "status=" + statusCode);
                    continue;
                }

                if (statusCode >= 500) {
                    accountPool.markRequestFailure(account.id());
                    if (lastAttempt) {
                        throw new UpstreamApiException(statusCode, body);
                    }
                    retryHandler.waitBeforeRetry(attempt, "status=" + statusCode);
                    continue;
                }

                // 其他 4xx：请求本身有问题，不重试
                log.warn("上游返回客户端错误: provider={}, status={}, body={}", provider, statusCode, body);
                throw new UpstreamApiException(statusCode, body);
            }
        }

        throw new UpstreamGatewayException(provider + " 请求重试次数已用尽", 502);
    }

    private void consumeStream(UpstreamResponse response, CompletionRequest request, StreamCallback callback) {
        SseStreamParser parser = new SseStreamParser(callback);
        CancellationToken cancellation = request.cancellation();
        try (CancellationToken.Registration ignored = cancellation != null
                ? cancellation.onCancel(response::close)
                : CancellationToken.Registration.NONE) {
            parser.parse(response.body());
        } catch (IOException e) {
            if (cancellation != null) {
                cancellation.throwIfCancelled();
            }
            throw new TransportException("流式响应读取中断: " + e.getMessage(), e);
        }
    }

    private static JSONObject parseBody(String body) {
        try {
            if (JSON.parse(body) instanceof JSONObject payload) {
                return payload;
            }
        } catch (JSONException e) {
            throw new UpstreamGatewayException("上游返回了无法解析的响应体", 502, e);
        }
        throw new UpstreamGatewayException("上游返回了无法解析的响应体", 502);
    }
}
