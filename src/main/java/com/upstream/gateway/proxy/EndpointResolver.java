package com.upstream.gateway.proxy;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.model.HeaderStyle;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Antigravity endpoint 选择：显式 endpoint > 环境选择（prod / autopush / daily / sandbox）> header 风格默认值
 */
@Component
public class EndpointResolver {

    static final String ENDPOINT_DAILY = "https://daily-cloudcode-pa.sandbox.googleapis.com";
    static final String ENDPOINT_AUTOPUSH = "https://autopush-cloudcode-pa.sandbox.googleapis.com";
    static final String ENDPOINT_PROD = "https://cloudcode-pa.googleapis.com";

    private final AppProperties.AntigravityConfig config;

    public EndpointResolver(AppProperties properties) {
        this.config = properties.getAntigravity();
    }

    public String resolve(HeaderStyle headerStyle) {
        String override = config.getEndpoint();
        if (override != null && !override.isBlank()) {
            return stripTrailingSlash(override.trim());
        }

        String env = config.getEnv() != null ? config.getEnv().trim().toLowerCase(Locale.ROOT) : "";
        switch (env) {
            case "prod":
                return ENDPOINT_PROD;
            case "autopush":
                return ENDPOINT_AUTOPUSH;
            case "daily":
            case "sandbox":
                return ENDPOINT_DAILY;
            default:
                break;
        }

        return headerStyle == HeaderStyle.GEMINI_CLI ? ENDPOINT_PROD : ENDPOINT_DAILY;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
