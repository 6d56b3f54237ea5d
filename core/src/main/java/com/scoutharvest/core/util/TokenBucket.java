package com.scoutharvest.core.util;

import java.time.Duration;
import java.util.Objects;

/**
 * 단일 호스트용 토큰 버킷. 고정 리필 속도 + 버스트 용량.
 * tryAcquire 는 절대 블록하지 않고, 토큰이 없으면 다음 토큰까지의 대기 힌트를 준다.
 */
public final class TokenBucket {
    private final double capacity;
    private final double refillPerMs;
    private final RunClock clock;
    private double tokens;
    private long lastMs;

    public TokenBucket(int burst, double refillPerSecond, RunClock clock) {
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.capacity = Math.max(1, burst);
        this.refillPerMs = refillPerSecond / 1000.0;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tokens = capacity;
        this.lastMs = clock.nowMillis();
    }

    public synchronized Admission tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return Admission.permit();
        }
        double missing = 1.0 - tokens;
        long waitMs = (long) Math.ceil(missing / refillPerMs);
        return Admission.waitFor(Duration.ofMillis(Math.max(1, waitMs)));
    }

    synchronized double available() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = clock.nowMillis();
        long elapsed = now - lastMs;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerMs);
            lastMs = now;
        }
    }
}
