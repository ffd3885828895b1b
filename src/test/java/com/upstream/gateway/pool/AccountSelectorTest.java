package com.upstream.gateway.pool;

import com.upstream.gateway.model.ModelFamily;
import com.upstream.gateway.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AccountSelectorTest {

    @TempDir
    Path dir;

    private PoolFixture fixture;
    private Account a;
    private Account b;
    private Account c;

    @BeforeEach
    void setUp() {
        fixture = new PoolFixture(dir);
        a = fixture.store.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("a@x", "sk-a", null));
        b = fixture.store.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("b@x", "sk-b", null));
        c = fixture.store.addOpenAiCompatibleAccount(new AccountStore.OpenAiCompatibleLogin("c@x", "sk-c", null));
    }

    @Test
    void select_noAccountsForProvider_isEmpty() {
        assertTrue(fixture.selector.select(AccountProvider.CODEX, null).isEmpty());
    }

    @Test
    void select_skipsDisabledAccounts() {
        fixture.store.setEnabled(a.id(), false);
        fixture.store.setEnabled(b.id(), false);
        fixture.store.setEnabled(c.id(), false);

        assertTrue(fixture.selector.select(AccountProvider.OPENAI_COMPATIBLE, null).isEmpty());
    }

    @Test
    void stick_keepsCurrentAccount() {
        fixture.store.setCurrentAccount(b.id());

        for (int i = 0; i < 3; i++) {
            assertEquals(b.id(), select().id());
        }
    }

    @Test
    void stick_rateLimitedCurrent_fallsBackAndMovesPointer() {
        fixture.store.setCurrentAccount(b.id());
        fixture.windows.mark(b, RateLimitKey.CLAUDE, PoolFixture.START + 60_000L);

        assertEquals(a.id(), select().id());
        fixture.store.withLock(() -> assertEquals(a.id(),
                fixture.store.config().currentAccountIdByProvider().get(AccountProvider.OPENAI_COMPATIBLE)));
    }

    @Test
    void stick_allRateLimited_usesFirstEnabled() {
        fixture.store.setCurrentAccount(c.id());
        for (Account account : fixture.store.listAccounts(null)) {
            fixture.windows.mark(account, RateLimitKey.CLAUDE, PoolFixture.START + 60_000L);
        }

        assertEquals(a.id(), select().id());
    }

    @Test
    void roundRobin_visitsEveryAccountOncePerCycle() {
        fixture.store.setStrategy(LoadBalancingStrategy.ROUND_ROBIN);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            seen.add(select().id());
        }

        assertEquals(Set.of(a.id(), b.id(), c.id()), seen);
        assertEquals(a.id(), select().id());
    }

    @Test
    void roundRobin_skipsRateLimitedAccounts() {
        fixture.store.setStrategy(LoadBalancingStrategy.ROUND_ROBIN);
        fixture.windows.mark(b, RateLimitKey.CLAUDE, PoolFixture.START + 60_000L);

        for (int i = 0; i < 4; i++) {
            assertNotEquals(b.id(), select().id());
        }
    }

    @Test
    void hybrid_prefersHealthierAccountAndConsumesToken() {
        fixture.store.setStrategy(LoadBalancingStrategy.HYBRID);
        fixture.health.recordFailure(a.id());
        fixture.health.recordSuccess(c.id());

        Account selected = select();

        assertEquals(c.id(), selected.id());
        assertEquals(49, fixture.buckets.getTokens(c.id()));
        assertEquals(PoolFixture.START, selected.lastUsed());
    }

    @Test
    void hybrid_skipsRateLimitedAccountWhileAnotherIsFree() {
        fixture.store.setStrategy(LoadBalancingStrategy.HYBRID);
        fixture.health.recordSuccess(a.id());
        fixture.health.recordFailure(b.id());
        fixture.windows.mark(a, RateLimitKey.CLAUDE, PoolFixture.START + 60_000L);

        assertEquals(c.id(), select().id());
        assertEquals(50, fixture.buckets.getTokens(a.id()));
    }

    @Test
    void hybrid_emptyBucketRanksLast() {
        fixture.store.setStrategy(LoadBalancingStrategy.HYBRID);
        fixture.health.recordSuccess(a.id());
        fixture.buckets.consumeTokens(a.id(), 50);
        fixture.health.recordFailure(c.id());

        assertEquals(b.id(), select().id());
    }

    @Test
    void hybrid_tieBreaksOnLeastRecentlyUsed() {
        fixture.store.setStrategy(LoadBalancingStrategy.HYBRID);

        fixture.clock.advanceMillis(1_000L);
        Account first = select();
        fixture.clock.advanceMillis(1_000L);
        Account second = select();
        fixture.clock.advanceMillis(1_000L);
        Account third = select();

        assertEquals(Set.of(a.id(), b.id(), c.id()), Set.of(first.id(), second.id(), third.id()));
    }

    private Account select() {
        return fixture.selector.select(AccountProvider.OPENAI_COMPATIBLE, ModelFamily.GEMINI).orElseThrow();
    }
}
