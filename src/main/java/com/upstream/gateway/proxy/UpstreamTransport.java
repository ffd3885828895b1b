package com.upstream.gateway.proxy;

import java.io.IOException;

/**
 * 上游 HTTP 传输
 */
public interface UpstreamTransport {

    /**
     * 发送请求并返回响应头已到达的响应，响应体由调用方读取并关闭
     *
     * @param cancellation 取消信号，可为 null
     * @throws IOException 未拿到响应（连接失败、超时等）
     * @throws com.upstream.gateway.exception.RequestCancelledException 调用方取消
     */
    UpstreamResponse send(UpstreamRequest request, CancellationToken cancellation) throws IOException;
}
