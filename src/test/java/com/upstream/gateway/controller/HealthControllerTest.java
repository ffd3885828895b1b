package com.upstream.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.upstream.gateway.pool.AccountStore;
import com.upstream.gateway.pool.OpenAiCompatibleAccount;
import com.upstream.gateway.pool.RateLimitKey;
import com.upstream.gateway.support.PoolFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HealthControllerTest {

    @TempDir
    Path dir;

    @Test
    void health_emptyPoolIsDegraded() {
        PoolFixture fixture = new PoolFixture(dir);

        JSONObject body = JSON.parseObject(new HealthController(fixture.pool).health().block());

        assertEquals("degraded", body.getString("status"));
        assertEquals(0, body.getJSONObject("accounts").getIntValue("total"));
        assertEquals("stick", body.getString("strategy"));
    }

    @Test
    void health_reportsAccountsByProvider() {
        PoolFixture fixture = new PoolFixture(dir);
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("a@x", "sk", null));
        fixture.pool.addCodexAccount(new AccountStore.CodexLogin("c@x", null, "at", null, null));

        JSONObject body = JSON.parseObject(new HealthController(fixture.pool).health().block());

        assertEquals("ok", body.getString("status"));
        assertEquals(2, body.getJSONObject("accounts").getIntValue("enabled"));
        assertEquals(1, body.getJSONObject("byProvider").getIntValue("openai-compatible"));
        assertEquals(1, body.getJSONObject("byProvider").getIntValue("codex"));
    }

    @Test
    void health_rateLimitedDisabledAccountDoesNotDegradeStatus() {
        PoolFixture fixture = new PoolFixture(dir);
        OpenAiCompatibleAccount parked = fixture.pool.addOpenAiCompatibleAccount(
                new AccountStore.OpenAiCompatibleLogin("a@x", "sk-a", null));
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("b@x", "sk-b", null));
        fixture.windows.mark(parked, RateLimitKey.CLAUDE, PoolFixture.START + 60_000L);
        fixture.pool.setEnabled(parked.id(), false);

        JSONObject body = JSON.parseObject(new HealthController(fixture.pool).health().block());

        assertEquals("ok", body.getString("status"));
        JSONObject accounts = body.getJSONObject("accounts");
        assertEquals(2, accounts.getIntValue("total"));
        assertEquals(1, accounts.getIntValue("enabled"));
        assertEquals(0, accounts.getIntValue("rateLimited"));
    }
}
