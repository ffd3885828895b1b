package com.upstream.gateway.pool;

import java.util.Optional;

/**
 * 账号负载均衡策略
 */
public enum LoadBalancingStrategy {

    STICK("stick"),
    ROUND_ROBIN("round-robin"),
    HYBRID("hybrid");

    private final String wireName;

    LoadBalancingStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<LoadBalancingStrategy> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.wireName.equalsIgnoreCase(value)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
