package com.upstream.gateway.exception;

import lombok.Getter;

/**
 * 上游 API 调用异常（携带 HTTP 状态码和响应体）
 */
@Getter
public class UpstreamApiException extends UpstreamGatewayException {

    private final String responseBody;

    public UpstreamApiException(int statusCode, String responseBody) {
        super("上游 API 错误: " + statusCode + " - " + responseBody, statusCode);
        this.responseBody = responseBody;
    }
}
