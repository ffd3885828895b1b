package com.upstream.gateway.config;

import com.upstream.gateway.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * 账号池的时间、随机数与等待来源（测试中可替换）
 */
@Configuration
public class PoolConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new SecureRandom();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }
}
