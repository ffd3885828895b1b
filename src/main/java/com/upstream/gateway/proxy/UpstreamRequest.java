package com.upstream.gateway.proxy;

import java.util.Map;

/**
 * 发往上游的 POST 请求
 *
 * @param url     完整 URL
 * @param headers 请求头（有序）
 * @param body    JSON 请求体
 */
public record UpstreamRequest(String url, Map<String, String> headers, String body) {
}
