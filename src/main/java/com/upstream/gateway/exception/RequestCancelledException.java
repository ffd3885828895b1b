package com.upstream.gateway.exception;

/**
 * 调用方取消了请求
 */
public class RequestCancelledException extends UpstreamGatewayException {

    public RequestCancelledException() {
        super("请求已被调用方取消", 499);
    }

    public RequestCancelledException(Throwable cause) {
        super("请求已被调用方取消", 499, cause);
    }
}
