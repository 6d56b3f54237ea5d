package com.scoutharvest.core.proxy;

import java.time.Duration;

/** 모든 핸들이 격리 상태: 호출자는 풀 전체를 일정 간격 뒤 재시도해야 한다. */
public class ProxyUnavailableException extends Exception {
    private final Duration earliestRecovery;

    public ProxyUnavailableException(String message, Duration earliestRecovery) {
        super(message);
        this.earliestRecovery = earliestRecovery;
    }

    /** 가장 빨리 격리가 풀리는 핸들까지 남은 시간 */
    public Duration getEarliestRecovery() { return earliestRecovery; }
}
