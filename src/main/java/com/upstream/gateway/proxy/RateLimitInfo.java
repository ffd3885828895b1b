package com.upstream.gateway.proxy;

import com.upstream.gateway.pool.RateLimitKey;
import com.upstream.gateway.pool.RateLimitReason;

/**
 * 从 429/503 响应中解析出的限流信息
 *
 * @param reason       限流原因
 * @param retryAfterMs 服务端建议的等待时间，未给出时为 null
 * @param windowKey    从模型名 / 错误信息识别出的限流窗口，识别不出为 null
 */
public record RateLimitInfo(RateLimitReason reason, Long retryAfterMs, RateLimitKey windowKey) {
}
