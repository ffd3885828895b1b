package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.model.ModelFamily;
import com.upstream.gateway.model.ModelFamilyResolver;
import com.upstream.gateway.pool.RateLimitKey;
import com.upstream.gateway.pool.RateLimitReason;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 限流响应解析
 * <p>
 * 等待时间优先级：Google RetryInfo.retryDelay > 错误信息中的 "reset after Ns" > retry-after 类响应头
 */
@Component
public class RateLimitParser {

    static final List<String> RETRY_AFTER_HEADERS = List.of(
            "retry-after",
            "x-retry-after",
            "x-ratelimit-reset",
            "x-goog-retry-after",
            "x-goog-quota-reset"
    );

    private static final String GOOGLE_ERROR_INFO = "type.googleapis.com/google.rpc.ErrorInfo";
    private static final String GOOGLE_RETRY_INFO = "type.googleapis.com/google.rpc.RetryInfo";

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private static final Pattern SECONDS = Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)s$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC = Pattern.compile("^[0-9]+(?:\\.[0-9]+)?$");
    private static final Pattern MESSAGE_RESET = Pattern.compile(
            "resets?\\s+(?:after|in)\\s+([0-9]+(?:\\.[0-9]+)?)\\s*(ms|s|sec|secs|seconds|m|min|minutes|h|hr|hours)?",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final ModelFamilyResolver modelFamilyResolver;

    public RateLimitParser(Clock clock, ModelFamilyResolver modelFamilyResolver) {
        this.clock = clock;
        this.modelFamilyResolver = modelFamilyResolver;
    }

    /**
     * @param response    限流响应（只读取响应头）
     * @param bodyText    已读取的响应体
     * @param model       请求的模型名
     * @param headerStyle Antigravity 请求路径，可为 null
     */
    public RateLimitInfo parse(UpstreamResponse response, String bodyText, String model, HeaderStyle headerStyle) {
        Long headerRetryMs = retryAfterFromHeaders(response);

        ErrorPayload payload = ErrorPayload.EMPTY;
        if (bodyText != null && !bodyText.isEmpty()) {
            try {
                Object parsed = JSON.parse(bodyText);
                if (parsed instanceof JSONObject object) {
                    payload = parseErrorPayload(object);
                }
            } catch (JSONException e) {
                payload = new ErrorPayload(bodyText, null, null);
            }
        }

        Long messageRetryMs = retryAfterFromMessage(payload.message());
        Long retryAfter = payload.retryDelayMs() != null ? payload.retryDelayMs()
                : messageRetryMs != null ? messageRetryMs : headerRetryMs;
        RateLimitReason reason = parseReason(payload.reason(), payload.message(), response.statusCode());

        RateLimitKey windowKey = null;
        Optional<ModelFamily> family = modelFamilyResolver.detect(payload.message(), model);
        if (family.isPresent()) {
            if (family.get() == ModelFamily.CLAUDE) {
                windowKey = RateLimitKey.CLAUDE;
            } else {
                windowKey = headerStyle == HeaderStyle.GEMINI_CLI ? RateLimitKey.GEMINI_CLI : RateLimitKey.GEMINI_ANTIGRAVITY;
            }
        }

        return new RateLimitInfo(reason, retryAfter, windowKey);
    }

    /**
     * 状态码优先，其次 ErrorInfo.reason，最后按错误信息关键字判断
     */
    RateLimitReason parseReason(String reason, String message, int status) {
        if (status == 529) return RateLimitReason.MODEL_CAPACITY_EXHAUSTED;
        if (status == 503 || status == 500) return RateLimitReason.SERVICE_UNAVAILABLE;

        if (reason != null) {
            switch (reason.toUpperCase(Locale.ROOT)) {
                case "QUOTA_EXHAUSTED":
                    return RateLimitReason.QUOTA_EXHAUSTED;
                case "RATE_LIMIT_EXCEEDED":
                    return RateLimitReason.RATE_LIMIT_EXCEEDED;
                case "MODEL_CAPACITY_EXHAUSTED":
                    return RateLimitReason.MODEL_CAPACITY_EXHAUSTED;
                case "SERVICE_UNAVAILABLE":
                    return RateLimitReason.SERVICE_UNAVAILABLE;
                default:
                    break;
            }
        }

        if (message != null) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("capacity") || lower.contains("overloaded") || lower.contains("resource exhausted")) {
                return RateLimitReason.MODEL_CAPACITY_EXHAUSTED;
            }
            if (lower.contains("rate limit") || lower.contains("too many requests") || lower.contains("per minute")) {
                return RateLimitReason.RATE_LIMIT_EXCEEDED;
            }
            if (lower.contains("quota") || lower.contains("exhausted")) {
                return RateLimitReason.QUOTA_EXHAUSTED;
            }
            if (lower.contains("service unavailable") || lower.contains("temporarily unavailable")) {
                return RateLimitReason.SERVICE_UNAVAILABLE;
            }
        }

        return RateLimitReason.UNKNOWN;
    }

    /**
     * 解析时长：12.5s / 秒数 / epoch 秒 / epoch 毫秒 / HTTP 日期
     *
     * @return 毫秒，无法识别返回 null
     */
    Long parseDurationMs(String value) {
        String trimmed = value.trim();
        Matcher seconds = SECONDS.matcher(trimmed);
        if (seconds.matches()) {
            return Math.round(Double.parseDouble(seconds.group(1)) * 1000);
        }

        long now = clock.millis();
        if (NUMERIC.matcher(trimmed).matches()) {
            double numeric = Double.parseDouble(trimmed);
            if (numeric > 1_000_000_000_000d) {
                return Math.max(0, Math.round(numeric - now));
            }
            if (numeric > 1_000_000_000d) {
                return Math.max(0, Math.round(numeric * 1000 - now));
            }
            return Math.max(0, Math.round(numeric * 1000));
        }

        Instant date = parseDate(trimmed);
        return date != null ? Math.max(0, date.toEpochMilli() - now) : null;
    }

    private Long retryAfterFromHeaders(UpstreamResponse response) {
        for (String name : RETRY_AFTER_HEADERS) {
            String value = response.header(name);
            if (value == null || value.isBlank()) {
                continue;
            }
            Long parsed = parseDurationMs(value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    static Long retryAfterFromMessage(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = MESSAGE_RESET.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) != null ? matcher.group(2).toLowerCase(Locale.ROOT) : "s";
        return switch (unit) {
            case "ms" -> Math.round(value);
            case "m", "min", "minutes" -> Math.round(value * 60_000);
            case "h", "hr", "hours" -> Math.round(value * 3_600_000);
            default -> Math.round(value * 1000);
        };
    }

    private ErrorPayload parseErrorPayload(JSONObject payload) {
        JSONObject error = payload.get("error") instanceof JSONObject nested ? nested : payload;
        String message = error.get("message") instanceof String s ? s : null;
        String reason = null;
        Long retryDelayMs = null;

        if (error.get("details") instanceof JSONArray details) {
            for (Object item : details) {
                if (!(item instanceof JSONObject detail)) {
                    continue;
                }
                Object type = detail.get("@type");
                if (GOOGLE_ERROR_INFO.equals(type) && detail.get("reason") instanceof String r) {
                    reason = r;
                }
                if (GOOGLE_RETRY_INFO.equals(type) && detail.get("retryDelay") instanceof String delay) {
                    Long parsed = parseDurationMs(delay);
                    if (parsed != null) {
                        retryDelayMs = parsed;
                    }
                }
            }
        }
        return new ErrorPayload(message, reason, retryDelayMs);
    }

    private static Instant parseDate(String value) {
        for (DateTimeFormatter formatter : DATE_FORMATS) {
            try {
                return formatter.parse(value, Instant::from);
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return null;
    }

    private record ErrorPayload(String message, String reason, Long retryDelayMs) {
        static final ErrorPayload EMPTY = new ErrorPayload(null, null, null);
    }
}
