package com.upstream.gateway.pool;

import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.model.ModelFamily;

/**
 * 一次限流事件
 *
 * @param family       请求的模型家族
 * @param reason       限流原因
 * @param retryAfterMs 服务端建议的等待时间，可为 null
 * @param headerStyle  Antigravity 请求路径，可为 null
 * @param windowKey    响应里识别出的限流窗口，可为 null（此时按 family + headerStyle 推断）
 */
public record RateLimitMark(ModelFamily family, RateLimitReason reason, Long retryAfterMs, HeaderStyle headerStyle,
                            RateLimitKey windowKey) {

    /**
     * 实际要标记的 Antigravity 窗口
     */
    public RateLimitKey resolveWindowKey() {
        return windowKey != null ? windowKey : RateLimitWindows.keyFor(family, headerStyle);
    }
}
