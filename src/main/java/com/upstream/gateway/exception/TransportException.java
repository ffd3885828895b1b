package com.upstream.gateway.exception;

/**
 * 网络传输异常（未拿到响应，或流式读取中断）
 */
public class TransportException extends UpstreamGatewayException {

    public TransportException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
