package com.scoutharvest.core.util;

/** 단조 시계(ms). 프록시 건강도 감쇠/격리, 토큰 버킷 리필에 사용. */
@FunctionalInterface
public interface RunClock {
    long nowMillis();

    RunClock SYSTEM = () -> System.nanoTime() / 1_000_000L;
}
