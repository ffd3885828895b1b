package com.upstream.gateway.model;

/**
 * 模型家族（决定 Antigravity 账号使用哪个限流窗口）
 */
public enum ModelFamily {
    CLAUDE,
    GEMINI
}
