package com.upstream.gateway.util;

/**
 * 日志脱敏：token 只保留前 8 位
 */
public final class TokenMasker {

    private TokenMasker() {
    }

    public static String mask(String token) {
        if (token == null || token.length() <= 8) {
            return "***";
        }
        return token.substring(0, 8) + "***";
    }
}
