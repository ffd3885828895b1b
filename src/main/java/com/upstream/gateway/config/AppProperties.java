package com.upstream.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "gateway")
public class AppProperties {

    // accounts.json / auth.json 所在目录
    private String configDir = System.getProperty("user.home") + "/.upstream-gateway";
    private int connectTimeoutSeconds = 30;
    private int requestTimeoutSeconds = 300;
    private ProxyConfig proxy = new ProxyConfig();
    private RetryConfig retry = new RetryConfig();
    private RefreshConfig refresh = new RefreshConfig();
    private AntigravityConfig antigravity = new AntigravityConfig();
    private CodexConfig codex = new CodexConfig();
    private OpenAiConfig openai = new OpenAiConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
        // URL 未写端口时使用
        private int defaultPort = 8080;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 3;
        private long baseDelayMs = 500;
        private long maxJitterMs = 250;
        private long maxDelayMs = 8000;
        // 限流后切号前的最长等待
        private long rateLimitSleepCapMs = 2000;
    }

    @Data
    public static class RefreshConfig {
        private int bufferMinutes = 5;
        private String codexTokenUrl = "https://auth.openai.com/oauth/token";
        private String codexClientId = "app_EMoamEEZ73f0CkXaXp7hrann";
        private String antigravityTokenUrl = "https://oauth2.googleapis.com/token";
        private String antigravityClientId = "1071006060591-tmhssin2h21lcre235vtolojh4g403ep.apps.googleusercontent.com";
        // 通过 GATEWAY_ANTIGRAVITY_CLIENT_SECRET 注入
        private String antigravityClientSecret = "";
    }

    @Data
    public static class AntigravityConfig {
        // 显式指定的 endpoint，优先级最高
        private String endpoint = "";
        // prod / autopush / daily / sandbox
        private String env = "";
        private String defaultProjectId = "rising-fact-p41fc";
    }

    @Data
    public static class CodexConfig {
        private String baseUrl = "https://chatgpt.com/backend-api";
    }

    @Data
    public static class OpenAiConfig {
        private String defaultBaseUrl = "https://api.openai.com/v1";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
