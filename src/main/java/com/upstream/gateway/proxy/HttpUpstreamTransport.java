package com.upstream.gateway.proxy;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.exception.RequestCancelledException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 基于 java.net.http.HttpClient 的传输实现，取消信号会中止等待中的请求
 */
@Component
public class HttpUpstreamTransport implements UpstreamTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpUpstreamTransport(HttpClient upstreamHttpClient, AppProperties properties) {
        this.httpClient = upstreamHttpClient;
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    @Override
    public UpstreamResponse send(UpstreamRequest request, CancellationToken cancellation) throws IOException {
        if (cancellation != null) {
            cancellation.throwIfCancelled();
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.url()))
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(request.body()));
        request.headers().forEach(builder::header);

        CompletableFuture<HttpResponse<InputStream>> future =
                httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream());

        try (CancellationToken.Registration ignored = cancellation != null
                ? cancellation.onCancel(() -> future.cancel(true))
                : CancellationToken.Registration.NONE) {
            HttpResponse<InputStream> response = future.get();
            return new UpstreamResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (CancellationException e) {
            throw new RequestCancelledException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("上游请求失败: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RequestCancelledException(e);
        }
    }
}
