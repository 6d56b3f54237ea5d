package com.scoutharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScrapeStats {
    private final AtomicLong discoveryPages = new AtomicLong(0);
    private final AtomicLong detailTasks    = new AtomicLong(0);   // 디스패치된 상세 작업 수
    private final AtomicLong recordsEmitted = new AtomicLong(0);
    private final AtomicLong duplicates     = new AtomicLong(0);
    private final AtomicLong skipped        = new AtomicLong(0);
    private final AtomicLong attemptsTotal  = new AtomicLong(0);   // HTTP 시도(재시도 포함)
    private final AtomicLong retriesTotal   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addDiscoveryPage() { discoveryPages.incrementAndGet(); }
    public void addDetailTask() { detailTasks.incrementAndGet(); }
    public void addRecord() { recordsEmitted.incrementAndGet(); }
    public void addDuplicate() { duplicates.incrementAndGet(); }
    public void addSkip() { skipped.incrementAndGet(); }

    /** attempts = 1 + retries */
    public void addAttempts(long attempts) {
        attemptsTotal.addAndGet(attempts);
        retriesTotal.addAndGet(Math.max(0, attempts - 1));
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(discoveryPages.get(), detailTasks.get(), recordsEmitted.get(),
                duplicates.get(), skipped.get(), attemptsTotal.get(), retriesTotal.get(),
                maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long discoveryPages;
        public final long detailTasks;
        public final long recordsEmitted;
        public final long duplicates;
        public final long skipped;
        public final long attemptsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;

        public Snapshot(long pages, long details, long records, long dups, long skips,
                        long attempts, long retries, int maxCc) {
            this.discoveryPages = pages;
            this.detailTasks = details;
            this.recordsEmitted = records;
            this.duplicates = dups;
            this.skipped = skips;
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.maxObservedConcurrency = maxCc;
        }
    }
}
