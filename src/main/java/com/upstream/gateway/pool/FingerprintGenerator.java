package com.upstream.gateway.pool;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * 生成 Antigravity 客户端指纹（随机平台/架构）
 */
@Component
public class FingerprintGenerator {

    public static final String ANTIGRAVITY_VERSION = "1.15.8";

    private static final List<String> PLATFORMS = List.of("darwin", "windows", "linux");
    private static final List<String> ARCHS = List.of("x64", "arm64");

    private final Random random;

    public FingerprintGenerator(Random random) {
        this.random = random;
    }

    public DeviceFingerprint generate() {
        String platform = PLATFORMS.get(random.nextInt(PLATFORMS.size()));
        String arch = ARCHS.get(random.nextInt(ARCHS.size()));
        return new DeviceFingerprint(buildUserAgent(platform, arch), platform, arch);
    }

    static String buildUserAgent(String platform, String arch) {
        String uaArch = "x64".equals(arch) ? "amd64" : "arm64";
        return "antigravity/" + ANTIGRAVITY_VERSION + " " + platform + "/" + uaArch;
    }
}
