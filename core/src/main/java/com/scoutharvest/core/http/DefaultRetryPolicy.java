package com.scoutharvest.core.http;

import com.scoutharvest.core.model.FetchOutcome;
import com.scoutharvest.core.model.ScrapeConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * TRANSIENT/BLOCKED 에서만 재시도.
 * 지연 = min(base × 2^(attempt-1), cap) × (1 ± jitter). 기본 500ms → 1s → 2s … 상한 8s.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long capMillis;
    private final double jitter;
    private final DoubleSupplier random; // [0,1)

    public DefaultRetryPolicy() { this(3, 500, 8_000, 0.1); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis, long capMillis, double jitter) {
        this(maxAttempts, baseMillis, capMillis, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    DefaultRetryPolicy(int maxAttempts, long baseMillis, long capMillis, double jitter, DoubleSupplier random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.capMillis = Math.max(this.baseMillis, capMillis);
        this.jitter = Math.max(0.0, Math.min(0.5, jitter));
        this.random = random;
    }

    public static DefaultRetryPolicy from(ScrapeConfig.RetryCfg r) {
        return new DefaultRetryPolicy(r.getMaxAttempts(), r.getBaseDelayMs(), r.getMaxDelayMs(), r.getJitter());
    }

    @Override public boolean shouldRetry(FetchOutcome outcome, int attempt) {
        if (attempt >= maxAttempts) return false;
        return outcome != null && outcome.isRetryable();
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));  // 오버플로 방지
        long raw = Math.min(capMillis, baseMillis << shift);
        if (jitter == 0.0) return Duration.ofMillis(raw);
        double factor = 1.0 - jitter + random.getAsDouble() * 2 * jitter;
        return Duration.ofMillis(Math.max(0L, Math.round(raw * factor)));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
