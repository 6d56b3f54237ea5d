package com.scoutharvest.core.proxy;

import java.util.Objects;

/**
 * 송신 아이덴티티 1개. 여러 워커가 공유하지만 상태 변경은 ProxyPool 락 안에서만.
 * 게터는 풀 락 밖에서 읽으면 근사치(로그/통계용).
 */
public final class ProxyHandle {
    private final int id;
    private final ProxyAddress address;

    // ---- ProxyPool 전용 상태 ----
    double health;              // 0 = 중립 기준선
    long healthUpdatedMs;
    long lastUsedMs = Long.MIN_VALUE;
    int leases;
    long quarantinedUntilMs;    // 0 = 격리 아님

    ProxyHandle(int id, ProxyAddress address, long nowMs) {
        this.id = id;
        this.address = Objects.requireNonNull(address, "address");
        this.healthUpdatedMs = nowMs;
    }

    public int getId() { return id; }
    public ProxyAddress getAddress() { return address; }
    public double getHealth() { return health; }
    public long getLastUsedMs() { return lastUsedMs; }
    public int getLeases() { return leases; }
    public long getQuarantinedUntilMs() { return quarantinedUntilMs; }

    public boolean isDirect() { return address.isDirect(); }

    @Override public String toString() {
        return "proxy#" + id + "(" + address.label() + ")";
    }
}
