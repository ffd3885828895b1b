package com.upstream.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class UpstreamGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(UpstreamGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(UpstreamGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║         Upstream Gateway Java v1.0.0              ║");
        log.info("║   Codex / Antigravity / OpenAI Account Pool       ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("  GET  /health");
    }
}
