package com.upstream.gateway.model;

/**
 * Antigravity 请求的 header 风格，对应上游两条独立的配额路径
 */
public enum HeaderStyle {

    ANTIGRAVITY("antigravity"),
    GEMINI_CLI("gemini-cli");

    private final String wireName;

    HeaderStyle(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
