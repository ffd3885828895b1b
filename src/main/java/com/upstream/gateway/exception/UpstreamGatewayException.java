package com.upstream.gateway.exception;

import lombok.Getter;

/**
 * 网关异常基类
 */
@Getter
public class UpstreamGatewayException extends RuntimeException {

    private final int statusCode;

    public UpstreamGatewayException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public UpstreamGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamGatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
