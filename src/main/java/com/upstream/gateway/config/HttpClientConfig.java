package com.upstream.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * HttpClient 配置
 * <p>
 * 上游请求与 token 刷新共用同一个客户端；连接超时和代理来自 gateway.* 配置，
 * 单次请求超时由 {@code gateway.request-timeout-seconds} 在发送时设置
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient upstreamHttpClient(AppProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1);
        proxySelector(properties.getProxy()).ifPresent(builder::proxy);
        return builder.build();
    }

    /**
     * 解析代理配置；未启用、URL 为空或无法解析时返回 empty
     */
    static Optional<ProxySelector> proxySelector(AppProperties.ProxyConfig proxy) {
        if (!proxy.isEnabled() || proxy.getUrl() == null || proxy.getUrl().isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = URI.create(proxy.getUrl().trim());
        } catch (IllegalArgumentException e) {
            log.warn("代理 URL 解析失败: {}, 将不使用代理", proxy.getUrl());
            return Optional.empty();
        }
        String host = uri.getHost();
        if (host == null) {
            log.warn("代理 URL 缺少主机名: {}, 将不使用代理", proxy.getUrl());
            return Optional.empty();
        }
        int port = uri.getPort() > 0 ? uri.getPort() : proxy.getDefaultPort();
        log.info("HTTP 代理已配置: {}:{}", host, port);
        return Optional.of(ProxySelector.of(new InetSocketAddress(host, port)));
    }
}
