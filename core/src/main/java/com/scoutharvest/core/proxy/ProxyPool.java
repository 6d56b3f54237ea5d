package com.scoutharvest.core.proxy;

import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.util.RunClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 프록시 풀: 건강도 추적 + 임대(acquire/release).
 *
 * - 건강도: 성공 +1(상한 +5), 차단 -2, 타임아웃/전송오류 -1, 반감기 기반 지수 감쇠로 0 에 수렴
 * - 임계치 미만 → cooldown 동안 격리, 해제 시 0 으로 복귀
 * - 전부 격리 → ProxyUnavailableException (즉시)
 * - 건강한 핸들이 모두 임대 상한이면 반납될 때까지 블록
 * - 핸들당 동시 임대 수 ≤ maxLeasesPerHandle
 */
public final class ProxyPool {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyPool.class);
    static final double MAX_HEALTH = 5.0;

    private final List<ProxyHandle> handles;
    private final int maxLeasesPerHandle;
    private final double quarantineThreshold;
    private final long cooldownMs;
    private final long halfLifeMs;
    private final RunClock clock;

    public ProxyPool(List<ProxyAddress> addresses, int maxLeasesPerHandle, double quarantineThreshold,
                     long cooldownMs, long halfLifeMs, RunClock clock) {
        Objects.requireNonNull(addresses, "addresses");
        if (addresses.isEmpty()) throw new IllegalArgumentException("at least one proxy address required");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxLeasesPerHandle = Math.max(1, maxLeasesPerHandle);
        this.quarantineThreshold = quarantineThreshold;
        this.cooldownMs = Math.max(0, cooldownMs);
        this.halfLifeMs = Math.max(1, halfLifeMs);
        long now = clock.nowMillis();
        List<ProxyHandle> hs = new ArrayList<>(addresses.size());
        for (int i = 0; i < addresses.size(); i++) hs.add(new ProxyHandle(i + 1, addresses.get(i), now));
        this.handles = List.copyOf(hs);
    }

    /**
     * 설정 기반 생성. 프록시가 없으면 DIRECT 핸들 1개(임대 상한 = 워커 수).
     */
    public static ProxyPool fromConfig(ScrapeConfig cfg, RunClock clock) {
        var p = cfg.getProxy();
        List<ProxyAddress> addrs = new ArrayList<>();
        for (String raw : p.getList()) addrs.add(ProxyAddress.parse(raw));
        if (addrs.isEmpty()) {
            LOG.info("ProxyPool running in direct mode (no proxies configured).");
            return new ProxyPool(List.of(ProxyAddress.DIRECT), Math.max(1, cfg.getConcurrency()),
                    p.getQuarantineThreshold(), p.getCooldownMs(), p.getHealthHalfLifeMs(), clock);
        }
        LOG.info("ProxyPool configured with {} proxies (maxLeases={}).", addrs.size(), p.getMaxLeasesPerHandle());
        return new ProxyPool(addrs, p.getMaxLeasesPerHandle(), p.getQuarantineThreshold(),
                p.getCooldownMs(), p.getHealthHalfLifeMs(), clock);
    }

    public ProxyHandle acquire() throws ProxyUnavailableException, InterruptedException {
        return acquire(null);
    }

    /**
     * 핸들 1개 임대. avoid 가 아닌 핸들을 우선(재시도 시 로테이션), 그다음 건강도 높은 순, 최근 사용이 오래된 순.
     * 다른 후보가 없으면 avoid 도 허용.
     */
    public synchronized ProxyHandle acquire(ProxyHandle avoid) throws ProxyUnavailableException, InterruptedException {
        for (;;) {
            long now = clock.nowMillis();
            long earliestRecovery = Long.MAX_VALUE;
            boolean anyHealthy = false;
            ProxyHandle best = null;

            for (ProxyHandle h : handles) {
                refreshQuarantine(h, now);
                if (h.quarantinedUntilMs > 0) {
                    earliestRecovery = Math.min(earliestRecovery, h.quarantinedUntilMs - now);
                    continue;
                }
                anyHealthy = true;
                if (h.leases >= maxLeasesPerHandle) continue;
                decay(h, now);
                if (best == null || better(h, best, avoid)) best = h;
            }

            if (!anyHealthy) {
                throw new ProxyUnavailableException(
                        "all " + handles.size() + " proxy handle(s) quarantined",
                        Duration.ofMillis(Math.max(0, earliestRecovery)));
            }
            if (best != null) {
                best.leases++;
                best.lastUsedMs = now;
                return best;
            }
            // 건강한 핸들이 모두 사용 중 → 반납 또는 격리 해제까지 대기
            long waitMs = (earliestRecovery == Long.MAX_VALUE) ? 1_000 : Math.max(1, Math.min(earliestRecovery, 1_000));
            wait(waitMs);
        }
    }

    /** 반납 + 결과 반영. 임계치 아래로 떨어지면 격리. */
    public synchronized void release(ProxyHandle h, ProxyOutcome outcome) {
        Objects.requireNonNull(h, "handle");
        if (!handles.contains(h)) throw new IllegalArgumentException("foreign handle: " + h);
        long now = clock.nowMillis();
        if (h.leases > 0) h.leases--;
        decay(h, now);
        h.health = Math.min(MAX_HEALTH, h.health + (outcome == null ? 0.0 : outcome.delta()));
        if (h.health < quarantineThreshold && h.quarantinedUntilMs == 0) {
            h.quarantinedUntilMs = now + cooldownMs;
            LOG.warn("Quarantining {} for {} ms (health={})", h, cooldownMs, String.format("%.2f", h.health));
        }
        notifyAll();
    }

    public int size() { return handles.size(); }

    public boolean isDirect() { return handles.size() == 1 && handles.get(0).isDirect(); }

    public int maxLeasesPerHandle() { return maxLeasesPerHandle; }

    /** 격리되지 않은 핸들 수 */
    public synchronized int healthyCount() {
        long now = clock.nowMillis();
        int n = 0;
        for (ProxyHandle h : handles) {
            refreshQuarantine(h, now);
            if (h.quarantinedUntilMs == 0) n++;
        }
        return n;
    }

    /** 현재 감쇠 반영된 건강도 (테스트/로그용) */
    public synchronized double healthOf(ProxyHandle h) {
        decay(h, clock.nowMillis());
        return h.health;
    }

    public List<ProxyHandle> handles() { return handles; }

    // ---------------- 내부 ----------------

    private static boolean better(ProxyHandle cand, ProxyHandle cur, ProxyHandle avoid) {
        boolean candAvoided = (cand == avoid);
        boolean curAvoided = (cur == avoid);
        if (candAvoided != curAvoided) return !candAvoided;
        if (cand.health != cur.health) return cand.health > cur.health;
        return cand.lastUsedMs < cur.lastUsedMs;
    }

    private void refreshQuarantine(ProxyHandle h, long now) {
        if (h.quarantinedUntilMs > 0 && h.quarantinedUntilMs <= now) {
            h.quarantinedUntilMs = 0;
            h.health = 0.0;
            h.healthUpdatedMs = now;
            LOG.info("{} released from quarantine", h);
        }
    }

    private void decay(ProxyHandle h, long now) {
        long elapsed = now - h.healthUpdatedMs;
        if (elapsed <= 0) return;
        h.health = h.health * Math.pow(0.5, (double) elapsed / halfLifeMs);
        h.healthUpdatedMs = now;
    }
}
