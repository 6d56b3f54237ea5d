package com.scoutharvest.core.util;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트별 토큰 버킷 레이트리미터.
 * 버킷마다 자체 락(TokenBucket 모니터): 호스트 간 조율 없음.
 */
public final class HostRateLimiter {
    private final int burst;
    private final double rps;
    private final RunClock clock;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public HostRateLimiter(double rps, int burst) {
        this(rps, burst, RunClock.SYSTEM);
    }

    public HostRateLimiter(double rps, int burst, RunClock clock) {
        if (!(rps > 0)) throw new IllegalArgumentException("rps must be > 0");
        this.rps = rps;
        this.burst = Math.max(1, burst);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 허가 또는 대기 힌트. 블록하지 않는다. */
    public Admission admit(String host) {
        String key = (host == null ? "" : host.toLowerCase(Locale.ROOT));
        return buckets.computeIfAbsent(key, h -> new TokenBucket(burst, rps, clock)).tryAcquire();
    }

    /** 허가가 날 때까지 sleeper 로 대기. 워커 스레드용 편의 메서드. */
    public void acquire(String host, Sleeper sleeper) throws InterruptedException {
        for (;;) {
            Admission a = admit(host);
            if (a.granted()) return;
            sleeper.sleep(a.waitHint());
        }
    }

    int trackedHosts() { return buckets.size(); }
}
