package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;

/**
 * 流式回调接口
 * <p>
 * 处理从上游 SSE 流中解析出的事件
 */
public interface StreamCallback {

    /**
     * 收到文本增量
     */
    void onText(String text);

    /**
     * 收到一条完整的事件（原始 JSON）
     */
    default void onEvent(JSONObject event) {
    }

    /**
     * 流式完成
     */
    default void onComplete() {
    }
}
