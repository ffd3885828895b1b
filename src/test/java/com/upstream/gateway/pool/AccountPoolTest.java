package com.upstream.gateway.pool;

import com.upstream.gateway.auth.TokenRefresher;
import com.upstream.gateway.model.HeaderStyle;
import com.upstream.gateway.model.ModelFamily;
import com.upstream.gateway.support.MutableClock;
import com.upstream.gateway.support.PoolFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccountPoolTest {

    @TempDir
    Path dir;

    private final AtomicInteger antigravityRefreshes = new AtomicInteger();

    private PoolFixture fixture() {
        TokenRefresher antigravity = refreshToken ->
                new TokenRefresher.TokenResult("ya29." + antigravityRefreshes.incrementAndGet(), null, 3600L);
        return new PoolFixture(dir, PoolFixture.unavailable("Codex"), antigravity);
    }

    @Test
    void isAuthenticated_reflectsCurrentAccountCredentials() {
        PoolFixture fixture = fixture();
        AccountPool pool = fixture.pool;

        assertFalse(pool.isAuthenticated(AccountProvider.CODEX));

        pool.addCodexAccount(new AccountStore.CodexLogin("a@x", null, "at", null, PoolFixture.START - 1));
        assertFalse(pool.isAuthenticated(AccountProvider.CODEX));

        pool.addCodexAccount(new AccountStore.CodexLogin("b@x", null, "at", "rt", PoolFixture.START - 1));
        assertTrue(pool.isAuthenticated(AccountProvider.CODEX));

        pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("o@x", "sk", null));
        assertTrue(pool.isAuthenticated(AccountProvider.OPENAI_COMPATIBLE));
    }

    @Test
    void isAuthenticated_doesNotAdvanceRoundRobin() {
        PoolFixture fixture = fixture();
        Account a = fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("a@x", "sk-a", null));
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("b@x", "sk-b", null));
        fixture.pool.setStrategy(LoadBalancingStrategy.ROUND_ROBIN);

        fixture.pool.isAuthenticated(AccountProvider.OPENAI_COMPATIBLE);
        fixture.pool.isAuthenticated(AccountProvider.OPENAI_COMPATIBLE);

        assertEquals(a.id(), fixture.pool.getCurrentAccount(AccountProvider.OPENAI_COMPATIBLE, null).orElseThrow().id());
    }

    @Test
    void getAccessToken_returnsKeyOrStoredToken() {
        PoolFixture fixture = fixture();
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("o@x", "sk-live", null));
        fixture.pool.addCodexAccount(new AccountStore.CodexLogin("c@x", null, "codex-at", null, null));

        assertEquals("sk-live", fixture.pool.getAccessToken(AccountProvider.OPENAI_COMPATIBLE).orElseThrow());
        assertEquals("codex-at", fixture.pool.getAccessToken(AccountProvider.CODEX).orElseThrow());
        assertTrue(fixture.pool.getAccessToken(AccountProvider.ANTIGRAVITY).isEmpty());
    }

    @Test
    void openSession_antigravityFallsBackToDefaultProject() {
        PoolFixture fixture = fixture();
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", null, "managed-1", null));

        AccountSession session = fixture.pool.openSession(account, ModelFamily.CLAUDE).orElseThrow();

        assertEquals("ya29.1", session.accessToken());
        assertEquals(HeaderStyle.ANTIGRAVITY, session.headerStyle());
        assertEquals("rising-fact-p41fc", session.projectId());
        assertEquals("managed-1", session.managedProjectId());
    }

    @Test
    void openSession_geminiUsesCliPathWhenAntigravityPathCoolsDown() {
        PoolFixture fixture = fixture();
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", "proj", null, null));
        fixture.pool.markRateLimited(account.id(),
                new RateLimitMark(ModelFamily.GEMINI, RateLimitReason.RATE_LIMIT_EXCEEDED, null, HeaderStyle.ANTIGRAVITY, null));

        AccountSession session = fixture.pool.getAntigravitySession(ModelFamily.GEMINI).orElseThrow();

        assertEquals(HeaderStyle.GEMINI_CLI, session.headerStyle());
        assertEquals("proj", session.projectId());
    }

    @Test
    void getAntigravitySession_emptyWhenFamilyWindowClosed() {
        PoolFixture fixture = fixture();
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", "proj", null, null));
        fixture.pool.markRateLimited(account.id(),
                new RateLimitMark(ModelFamily.CLAUDE, RateLimitReason.QUOTA_EXHAUSTED, null, HeaderStyle.ANTIGRAVITY, null));

        assertTrue(fixture.pool.getAntigravitySession(ModelFamily.CLAUDE).isEmpty());
        assertTrue(fixture.pool.getAntigravitySession(ModelFamily.GEMINI).isPresent());
    }

    @Test
    void markRateLimited_windowReportedByUpstreamWinsOverRequestFamily() {
        PoolFixture fixture = fixture();
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", "proj", null, null));

        long backoff = fixture.pool.markRateLimited(account.id(), new RateLimitMark(ModelFamily.GEMINI,
                RateLimitReason.RATE_LIMIT_EXCEEDED, null, HeaderStyle.GEMINI_CLI, RateLimitKey.CLAUDE));

        assertEquals(30_000L, backoff);
        assertEquals(Map.of(RateLimitKey.CLAUDE, PoolFixture.START + 30_000L), account.rateLimitResetTimes());
        assertTrue(fixture.pool.getAntigravitySession(ModelFamily.CLAUDE).isEmpty());
    }

    @Test
    void openSession_emptyWhenRefreshFails() {
        PoolFixture fixture = new PoolFixture(dir);
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", "proj", null, null));

        assertTrue(fixture.pool.openSession(account, ModelFamily.CLAUDE).isEmpty());
    }

    @Test
    void markRateLimited_honoursRetryAfterAndPenalizes() {
        PoolFixture fixture = fixture();
        Account account = fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("o@x", "sk", null));

        long backoff = fixture.pool.markRateLimited(account.id(),
                new RateLimitMark(null, RateLimitReason.RATE_LIMIT_EXCEEDED, 5_000L, null, null));

        assertEquals(5_000L, backoff);
        assertEquals(-10, fixture.health.getScore(account.id()));
        assertEquals(-10, account.healthScore());
        assertTrue(fixture.windows.isRateLimited(account, null));

        fixture.clock.advanceMillis(5_000L);
        assertFalse(fixture.windows.isRateLimited(account, null));
    }

    @Test
    void markRateLimited_quotaExhaustedClimbsLadder() {
        PoolFixture fixture = fixture();
        Account account = fixture.pool.addCodexAccount(new AccountStore.CodexLogin("c@x", null, "at", null, null));
        RateLimitMark quota = new RateLimitMark(null, RateLimitReason.QUOTA_EXHAUSTED, null, null, null);

        assertEquals(60_000L, fixture.pool.markRateLimited(account.id(), quota));
        assertEquals(5 * 60_000L, fixture.pool.markRateLimited(account.id(), quota));
        assertEquals(30 * 60_000L, fixture.pool.markRateLimited(account.id(), quota));

        fixture.pool.markRequestSuccess(account.id());
        assertEquals(60_000L, fixture.pool.markRateLimited(account.id(), quota));
    }

    @Test
    void markRequestSuccess_updatesScoreAndLastUsed() {
        PoolFixture fixture = fixture();
        Account account = fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("o@x", "sk", null));
        fixture.pool.markRequestFailure(account.id());
        fixture.clock.advanceMillis(1_000L);

        fixture.pool.markRequestSuccess(account.id());

        assertEquals(-19, account.healthScore());
        assertEquals(PoolFixture.START + 1_000L, account.lastUsed());
        assertEquals(0, fixture.health.getConsecutiveFailures(account.id()));
    }

    @Test
    void init_restoresPersistedHealthScores() {
        PoolFixture fixture = fixture();
        Account account = fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("o@x", "sk", null));
        fixture.pool.markRequestFailure(account.id());
        fixture.pool.markRequestFailure(account.id());

        PoolFixture reloaded = new PoolFixture(dir, new MutableClock(PoolFixture.START),
                PoolFixture.unavailable("Codex"), PoolFixture.unavailable("Antigravity"));

        assertEquals(-40, reloaded.health.getScore(account.id()));
    }

    @Test
    void removeAccount_forgetsTrackerStateAndCachedToken() {
        PoolFixture fixture = fixture();
        AntigravityAccount account = fixture.pool.addAntigravityAccount(
                new AccountStore.AntigravityLogin("g@x", null, "rt", "proj", null, null));
        fixture.pool.openSession(account, ModelFamily.CLAUDE);
        fixture.pool.markRequestFailure(account.id());

        assertTrue(fixture.pool.removeAccount("g@x"));
        assertFalse(fixture.pool.removeAccount("g@x"));

        assertEquals(0, fixture.health.getScore(account.id()));
        fixture.pool.openSession(account, ModelFamily.CLAUDE);
        assertEquals(2, antigravityRefreshes.get());
    }

    @Test
    void getStats_countsByProvider() {
        PoolFixture fixture = fixture();
        Account a = fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("a@x", "sk", null));
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("b@x", "sk", null));
        Account c = fixture.pool.addCodexAccount(new AccountStore.CodexLogin("c@x", null, "at", null, null));
        fixture.pool.setEnabled(c.id(), false);
        fixture.pool.markRateLimited(a.id(), new RateLimitMark(null, RateLimitReason.UNKNOWN, null, null, null));
        fixture.pool.setStrategy(LoadBalancingStrategy.HYBRID);

        AccountPool.PoolStats stats = fixture.pool.getStats();

        assertEquals(3, stats.total());
        assertEquals(2, stats.enabled());
        assertEquals(1, stats.rateLimited());
        assertEquals(Map.of("codex", 1, "openai-compatible", 2), stats.byProvider());
        assertEquals("hybrid", stats.strategy());
    }

    @Test
    void clearAllAccounts_emptiesPool() {
        PoolFixture fixture = fixture();
        fixture.pool.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("a@x", "sk", null));

        fixture.pool.clearAllAccounts();

        assertTrue(fixture.pool.listAccounts(null).isEmpty());
        assertFalse(fixture.pool.isAuthenticated(AccountProvider.OPENAI_COMPATIBLE));
    }
}
