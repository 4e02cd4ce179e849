package org.example.storyteller.service.quota;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryQuotaAuthorityTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);

    @Test
    void estimateAndReserve_refusesOnceWindowIsSpent() {
        InMemoryQuotaAuthority quota = new InMemoryQuotaAuthority(1000, Duration.ofMinutes(60), now::get);

        assertTrue(quota.estimateAndReserve("remote", 600));
        assertFalse(quota.estimateAndReserve("remote", 600));
        assertTrue(quota.estimateAndReserve("remote", 400));
        assertEquals(Map.of("remote", 1000L), quota.usageSnapshot());
    }

    @Test
    void estimateAndReserve_tracksBackendsSeparately() {
        InMemoryQuotaAuthority quota = new InMemoryQuotaAuthority(500, Duration.ofMinutes(60), now::get);

        assertTrue(quota.estimateAndReserve("remote", 500));
        assertTrue(quota.estimateAndReserve("other", 500));
        assertFalse(quota.estimateAndReserve("remote", 1));
    }

    @Test
    void estimateAndReserve_newWindowResetsUsage() {
        InMemoryQuotaAuthority quota = new InMemoryQuotaAuthority(500, Duration.ofMinutes(1), now::get);
        assertTrue(quota.estimateAndReserve("remote", 500));
        assertFalse(quota.estimateAndReserve("remote", 10));

        now.addAndGet(Duration.ofMinutes(1).toMillis());

        assertTrue(quota.estimateAndReserve("remote", 10));
    }

    @Test
    void estimateAndReserve_invalidInput_isRefused() {
        InMemoryQuotaAuthority quota = new InMemoryQuotaAuthority(500, Duration.ofMinutes(1), now::get);

        assertFalse(quota.estimateAndReserve(" ", 10));
        assertFalse(quota.estimateAndReserve("remote", -1));
    }
}
