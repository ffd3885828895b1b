package com.upstream.gateway.util;

/**
 * 重试等待
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis);

    /**
     * 基于 Thread.sleep，被中断时恢复中断标记后直接返回
     */
    static Sleeper threadSleep() {
        return millis -> {
            if (millis <= 0) {
                return;
            }
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }
}
