package com.upstream.gateway.pool;

/**
 * 模拟的客户端身份（每个 Antigravity 账号固定一份）
 *
 * @param userAgent 例如 antigravity/1.15.8 darwin/arm64
 * @param platform  darwin / windows / linux
 * @param arch      x64 / arm64
 */
public record DeviceFingerprint(String userAgent, String platform, String arch) {
}
