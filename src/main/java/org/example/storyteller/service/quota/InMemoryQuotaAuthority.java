package org.example.storyteller.service.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Fixed-window token quota per backend, kept in memory.
 * A reservation that would push a backend past its window total is refused without being recorded.
 */
@Component
public class InMemoryQuotaAuthority implements QuotaAuthority {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQuotaAuthority.class);

    private final long tokensPerWindow;
    private final long windowMillis;
    private final LongSupplier clock;
    private final ConcurrentHashMap<String, TokenWindow> windows = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryQuotaAuthority(
            @Value("${storyteller.quota.tokens-per-window:500000}") long tokensPerWindow,
            @Value("${storyteller.quota.window-minutes:60}") long windowMinutes) {
        this(tokensPerWindow, Duration.ofMinutes(Math.max(1, windowMinutes)), System::currentTimeMillis);
    }

    InMemoryQuotaAuthority(long tokensPerWindow, Duration window, LongSupplier clock) {
        this.tokensPerWindow = Math.max(0, tokensPerWindow);
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public boolean estimateAndReserve(String backendName, int estimatedTokens) {
        if (backendName == null || backendName.isBlank() || estimatedTokens < 0) {
            return false;
        }
        long now = clock.getAsLong();
        TokenWindow window = windows.computeIfAbsent(backendName, ignored -> new TokenWindow(now));
        boolean allowed = window.tryReserve(now, windowMillis, estimatedTokens, tokensPerWindow);
        if (!allowed) {
            log.warn("Quota refused {} tokens for backend {} ({} of {} used this window)",
                    estimatedTokens, backendName, window.getUsed(), tokensPerWindow);
        }
        return allowed;
    }

    public Map<String, Long> usageSnapshot() {
        Map<String, Long> usage = new TreeMap<>();
        windows.forEach((name, window) -> usage.put(name, window.getUsed()));
        return usage;
    }

    private static final class TokenWindow {
        private long windowStartMillis;
        private long used;

        private TokenWindow(long now) {
            this.windowStartMillis = now;
        }

        private synchronized boolean tryReserve(long now, long windowMillis, long tokens, long limit) {
            if (now - windowStartMillis >= windowMillis) {
                windowStartMillis = now;
                used = 0;
            }
            if (used + tokens > limit) {
                return false;
            }
            used += tokens;
            return true;
        }

        private synchronized long getUsed() {
            return used;
        }
    }
}
