package com.scoutharvest.core.budget;

import java.util.concurrent.atomic.AtomicInteger;

/** per-run 레코드 예산: 발행된 상세 작업 수가 maxRecords 에 닿으면 닫힌다. */
public final class RecordBudget {
    private final AtomicInteger used = new AtomicInteger();
    private final int maxRecords;

    public RecordBudget(int maxRecords) {
        this.maxRecords = Math.max(1, maxRecords);
    }

    /** 예산이 남아있으면 1 소모하고 true, 아니면 false(초과 소모 없음) */
    public boolean tryConsume() {
        for (;;) {
            int cur = used.get();
            if (cur >= maxRecords) return false;
            if (used.compareAndSet(cur, cur + 1)) return true;
        }
    }

    public boolean isExhausted() { return used.get() >= maxRecords; }
    public int used() { return used.get(); }
    public int remaining() { return Math.max(0, maxRecords - used()); }
    public int max() { return maxRecords; }
}
