package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.model.ModelFamily;
import com.upstream.gateway.pool.AccountProvider;

/**
 * 一次补全调用
 *
 * @param provider     上游提供方
 * @param model        模型名
 * @param modelFamily  模型家族，为 null 时按模型名推断
 * @param payload      透传给上游的请求体
 * @param maxRetries   最大重试次数，为 null 时使用配置值
 * @param cancellation 取消信号，可为 null
 */
public record CompletionRequest(AccountProvider provider, String model, ModelFamily modelFamily,
                                JSONObject payload, Integer maxRetries, CancellationToken cancellation) {

    public static CompletionRequest of(AccountProvider provider, String model, JSONObject payload) {
        return new CompletionRequest(provider, model, null, payload, null, null);
    }

    public CompletionRequest withModelFamily(ModelFamily family) {
        return new CompletionRequest(provider, model, family, payload, maxRetries, cancellation);
    }

    public CompletionRequest withMaxRetries(int retries) {
        return new CompletionRequest(provider, model, modelFamily, payload, retries, cancellation);
    }

    public CompletionRequest withCancellation(CancellationToken token) {
        return new CompletionRequest(provider, model, modelFamily, payload, maxRetries, token);
    }
}
