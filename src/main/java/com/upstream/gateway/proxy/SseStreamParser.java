package com.upstream.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * SSE（text/event-stream）解析器
 * <p>
 * 只处理 data: 行；[DONE] 和无法解析的行直接跳过。
 * 文本提取兼容 Gemini（candidates[0].content.parts[].text，可带 response 外层）
 * 和 OpenAI（choices[0].delta.content / output.content / text）两种格式
 */
public class SseStreamParser {

    private static final Logger log = LoggerFactory.getLogger(SseStreamParser.class);
    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final StreamCallback callback;

    public SseStreamParser(StreamCallback callback) {
        this.callback = callback;
    }

    /**
     * 逐行读取整个流，结束时回调 onComplete
     *
     * @throws IOException 读取中断
     */
    public void parse(InputStream stream) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            feedLine(line);
        }
        finish();
    }

    public void feedLine(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return;
        }
        String data = line.substring(DATA_PREFIX.length()).strip();
        if (data.isEmpty() || DONE.equals(data)) {
            return;
        }

        JSONObject event;
        try {
            if (!(JSON.parse(data) instanceof JSONObject parsed)) {
                return;
            }
            event = parsed;
        } catch (JSONException e) {
            log.debug("跳过无法解析的 SSE 行: {}", data);
            return;
        }

        callback.onEvent(event);
        String text = extractText(event);
        if (text != null && !text.isEmpty()) {
            callback.onText(text);
        }
    }

    public void finish() {
        callback.onComplete();
    }

    static String extractText(JSONObject event) {
        String gemini = extractGeminiText(event.get("response") instanceof JSONObject response ? response : event);
        if (gemini != null) {
            return gemini;
        }

        if (event.get("choices") instanceof JSONArray choices && !choices.isEmpty()
                && choices.get(0) instanceof JSONObject choice
                && choice.get("delta") instanceof JSONObject delta
                && delta.get("content") instanceof String content && !content.isEmpty()) {
            return content;
        }
        if (event.get("output") instanceof JSONObject output
                && output.get("content") instanceof String content && !content.isEmpty()) {
            return content;
        }
        if (event.get("text") instanceof String text && !text.isEmpty()) {
            return text;
        }
        return null;
    }

    private static String extractGeminiText(JSONObject response) {
        if (!(response.get("candidates") instanceof JSONArray candidates) || candidates.isEmpty()
                || !(candidates.get(0) instanceof JSONObject candidate)
                || !(candidate.get("content") instanceof JSONObject content)
                || !(content.get("parts") instanceof JSONArray parts)) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof JSONObject p && p.get("text") instanceof String value) {
                text.append(value);
            }
        }
        return text.isEmpty() ? null : text.toString();
    }
}
