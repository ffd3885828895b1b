package com.upstream.gateway.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 上游响应（状态码、响应头、未读取的响应体流）
 */
public class UpstreamResponse implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(UpstreamResponse.class);

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;

    public UpstreamResponse(int statusCode, Map<String, List<String>> headers, InputStream body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * 按名称（忽略大小写）取第一个响应头
     */
    public String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    public InputStream body() {
        return body;
    }

    /**
     * 读取完整响应体（错误分支使用）
     */
    public String readBody() {
        try {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("读取上游响应体失败: status={}, error={}", statusCode, e.getMessage());
            return "读取响应体失败: " + e.getMessage();
        }
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("关闭响应体失败: {}", e.getMessage());
        }
    }
}
