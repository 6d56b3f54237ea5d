package com.scoutharvest.core.dedupe;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** 한 실행 범위의 본 매물 집합. 동시 접근 안전. */
public final class DedupeStore {
    private final Set<DedupeKey> seen = ConcurrentHashMap.newKeySet();

    public boolean seen(String listingId) {
        return seen.contains(DedupeKey.of(listingId));
    }

    /** 멱등 */
    public void mark(String listingId) {
        seen.add(DedupeKey.of(listingId));
    }

    /** 원자적 확인+삽입. 처음 본 식별자면 true. */
    public boolean tryMark(String listingId) {
        return seen.add(DedupeKey.of(listingId));
    }

    public int size() { return seen.size(); }
}
