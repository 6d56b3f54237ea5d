package com.scoutharvest.core.service;

import com.scoutharvest.core.api.IFieldExtractor;
import com.scoutharvest.core.api.IPageFetcher;
import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.api.SkipListener;
import com.scoutharvest.core.budget.RecordBudget;
import com.scoutharvest.core.crawler.JsoupSearchPageParser;
import com.scoutharvest.core.crawler.PaginationDriver;
import com.scoutharvest.core.crawler.PaginationState;
import com.scoutharvest.core.crawler.SearchPageParser;
import com.scoutharvest.core.dedupe.DedupeStore;
import com.scoutharvest.core.extract.ExtractionFailedException;
import com.scoutharvest.core.extract.JsoupFieldExtractor;
import com.scoutharvest.core.http.DefaultRetryPolicy;
import com.scoutharvest.core.http.FetchFailedException;
import com.scoutharvest.core.http.FetchWorkerPool;
import com.scoutharvest.core.http.HttpPageFetcher;
import com.scoutharvest.core.model.CrawlTask;
import com.scoutharvest.core.model.ErrorKind;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ListingRecord;
import com.scoutharvest.core.model.RawFieldMap;
import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.model.ScrapeStats;
import com.scoutharvest.core.model.SkipRecord;
import com.scoutharvest.core.normalize.ListingNormalizer;
import com.scoutharvest.core.proxy.ProxyPool;
import com.scoutharvest.core.util.DefaultSleeper;
import com.scoutharvest.core.util.HostRateLimiter;
import com.scoutharvest.core.util.ProgressListener;
import com.scoutharvest.core.util.RunClock;
import com.scoutharvest.core.util.Sleeper;
import com.scoutharvest.core.util.StructuredLog;
import com.scoutharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 스크레이프 오케스트레이터:
 *  - 시작 URL → 페이지네이션(호출 스레드, 단일 생산자) → 상세 작업 발행
 *  - 상세 작업: fetch → 추출 → 정규화 → 중복 제거 → RecordSink (워커 스레드, emit 은 락 안)
 *  - 작업 단위 실패는 스킵 채널로, 프록시 풀 장기 불가는 ScrapeAbortedException 으로 실행 종료
 *  - DI 생성자는 테스트용(가짜 fetcher/sleeper/clock 주입)
 */
public final class ScrapeService {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeService.class);

    private final ScrapeConfig config;
    private final IPageFetcher fetcher;
    private final IFieldExtractor extractor;
    private final SearchPageParser parser;
    private final ListingNormalizer normalizer = new ListingNormalizer();
    private final Sleeper sleeper;
    private final RunClock clock;

    private final Object emitLock = new Object();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile ScrapeStats stats = new ScrapeStats();

    /** 기본 구현 */
    public ScrapeService(ScrapeConfig config) {
        this(config, new HttpPageFetcher(config), new JsoupFieldExtractor(), new JsoupSearchPageParser(),
                new DefaultSleeper(), RunClock.SYSTEM);
    }

    /** DI/테스트용 */
    public ScrapeService(ScrapeConfig config, IPageFetcher fetcher, IFieldExtractor extractor,
                         SearchPageParser parser, Sleeper sleeper, RunClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScrapeResult run(RecordSink sink) {
        return run(sink, SkipListener.NONE, ProgressListener.NONE, null);
    }

    /**
     * 실행 1회. sink 는 닫지 않는다(호출자 소유).
     * @param cancelFlag true 가 되면 새 작업 발행 중단, 큐 작업은 CANCELLED, 진행 중 요청은 마저 끝냄
     * @throws ScrapeAbortedException 프록시 풀이 poolMaxWait 넘게 전부 격리, 또는 sink 쓰기 실패
     */
    public ScrapeResult run(RecordSink sink, SkipListener skipListener, ProgressListener listener,
                            AtomicBoolean cancelFlag) {
        Objects.requireNonNull(sink, "sink");
        final SkipListener userSkips = (skipListener != null) ? skipListener : SkipListener.NONE;
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final ScrapeStats runStats = new ScrapeStats();
        this.stats = runStats;
        stopRequested.set(false);

        final long t0 = clock.nowMillis();
        final int cc = config.getConcurrency();
        LOG.info("Scrape start: base={}, maxRecords={}, cc={}, rps={}",
                config.getBaseUrl(), config.getMaxRecords(), cc, config.getRate().getRps());
        SLOG.info("scrape-start",
                "base", config.getBaseUrl(),
                "startUrls", config.effectiveStartUrls().size(),
                "maxRecords", config.getMaxRecords(),
                "cc", cc,
                "proxies", config.getProxy().getList().size());

        ProxyPool proxies = ProxyPool.fromConfig(config, clock);
        HostRateLimiter limiter = new HostRateLimiter(config.getRate().getRps(), config.getRate().getBurst(), clock);
        RecordBudget budget = new RecordBudget(config.getMaxRecords());
        DedupeStore dedupe = new DedupeStore();
        AtomicReference<ScrapeAbortedException> aborted = new AtomicReference<>();
        AtomicInteger doneDetails = new AtomicInteger();

        SkipListener skips = s -> {
            runStats.addSkip();
            SLOG.info("task-skipped", "url", String.valueOf(s.url()), "reason", s.reason().name(),
                    "kind", s.kind().name(), "detail", s.detail());
            synchronized (emitLock) {
                userSkips.onSkip(s);
            }
        };

        List<PaginationState> states = new ArrayList<>();
        List<Future<?>> details = new ArrayList<>();

        FetchWorkerPool pool = new FetchWorkerPool(config, fetcher, proxies, limiter,
                DefaultRetryPolicy.from(config.getRetry()), sleeper, clock, runStats);
        try {
            PaginationDriver driver = new PaginationDriver(parser, budget, task -> fetchDiscovery(pool, task),
                    skips, runStats);
            PaginationDriver.DetailDispatcher dispatcher = task -> details.add(pool.execute(() -> {
                processDetail(pool, task, dedupe, sink, skips, aborted);
                int done = doneDetails.incrementAndGet();
                progress(pl, "detail", done, budget.used());
                return null;
            }));

            pl.onProgress(0.0, "discover", 0, -1);
            for (String raw : config.effectiveStartUrls()) {
                if (shouldStop(cancelFlag, pool) || budget.isExhausted()) break;
                URI start = UrlUtils.resolve(null, raw).orElse(null);
                if (start == null) {
                    LOG.warn("Ignoring malformed start URL: {}", raw);
                    continue;
                }
                if (UrlUtils.isDetailUrl(start)) {
                    driver.offerDetail(start, 0, dispatcher);
                    continue;
                }
                LOG.info("Expanding search URL: {}", start);
                PaginationState st = driver.walk(start, dispatcher, () -> shouldStop(cancelFlag, pool));
                states.add(st);
                LOG.info("Search URL {} finished in state {}", start, st);
            }
            LOG.info("Prepared {} detail task(s) (max={})", budget.used(), config.getMaxRecords());

            awaitAll(details, cancelFlag, pool);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pool.stop();
            LOG.warn("Scrape interrupted; draining workers");
        } catch (ScrapeAbortedException e) {
            aborted.compareAndSet(null, e);
        } finally {
            pool.stop();
            pool.close();
        }

        boolean cancelled = (cancelFlag != null && cancelFlag.get()) || stopRequested.get();
        ScrapeStats.Snapshot snap = runStats.snapshot();
        Duration elapsed = Duration.ofMillis(Math.max(0, clock.nowMillis() - t0));

        ScrapeAbortedException fatal = aborted.get();
        if (fatal != null) {
            LOG.error("Scrape aborted after {} record(s): {}", snap.recordsEmitted, fatal.getMessage());
            SLOG.error("scrape-aborted", fatal, "records", snap.recordsEmitted, "skipped", snap.skipped);
            throw fatal;
        }

        pl.onProgress(1.0, "done", snap.recordsEmitted, snap.detailTasks);
        LOG.info("Scrape done. pages={}, details={}, records={}, duplicates={}, skipped={}, retries={}, maxObservedCC={}",
                snap.discoveryPages, snap.detailTasks, snap.recordsEmitted, snap.duplicates, snap.skipped,
                snap.retriesTotal, snap.maxObservedConcurrency);
        SLOG.info("scrape-done",
                "pages", snap.discoveryPages,
                "details", snap.detailTasks,
                "records", snap.recordsEmitted,
                "duplicates", snap.duplicates,
                "skipped", snap.skipped,
                "cancelled", cancelled,
                "elapsedMs", elapsed.toMillis());
        return new ScrapeResult(states, snap, cancelled, elapsed);
    }

    /** 진행 중 실행에 중단 요청(run 의 cancelFlag 와 같은 효과) */
    public void stop() {
        stopRequested.set(true);
    }

    public ScrapeStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    /* =========================
       내부 단계
       ========================= */

    /** discovery 페이지는 워커 풀을 거쳐 fetch(동일한 레이트/프록시/재시도 적용) */
    private static FetchResult fetchDiscovery(FetchWorkerPool pool, CrawlTask task)
            throws FetchFailedException, InterruptedException {
        try {
            return pool.submit(task).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchFailedException ffe) throw ffe;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof InterruptedException ie) throw ie;
            throw new IllegalStateException("discovery fetch failed: " + task.url(), cause);
        }
    }

    private void processDetail(FetchWorkerPool pool, CrawlTask task, DedupeStore dedupe, RecordSink sink,
                               SkipListener skips, AtomicReference<ScrapeAbortedException> aborted)
            throws InterruptedException {
        if (pool.isStopped()) {
            skips.onSkip(SkipRecord.of(task, ErrorKind.CANCELLED, "not started before stop"));
            return;
        }
        try {
            FetchResult page = pool.fetch(task);
            RawFieldMap raw = extractor.extract(page.getBody(), task.url());
            ListingRecord rec = normalizer.normalize(raw);

            if (!dedupe.tryMark(rec.getId())) {
                stats.addDuplicate();
                LOG.debug("Duplicate listing {} ({})", rec.getId(), task.url());
                return;
            }
            emit(sink, rec, task);
        } catch (FetchFailedException e) {
            skips.onSkip(SkipRecord.of(task, e.getKind(), e.getMessage()));
        } catch (ExtractionFailedException e) {
            skips.onSkip(SkipRecord.of(task, ErrorKind.EXTRACTION_FAILED, e.getMessage()));
        } catch (IllegalArgumentException e) {
            // 정규화 불가(식별자/제목 없음)
            skips.onSkip(SkipRecord.of(task, ErrorKind.EXTRACTION_FAILED, e.toString()));
        } catch (ScrapeAbortedException e) {
            aborted.compareAndSet(null, e);
            pool.stop();
            skips.onSkip(SkipRecord.of(task, ErrorKind.UNAVAILABLE, e.getMessage()));
        }
    }

    private void emit(RecordSink sink, ListingRecord rec, CrawlTask task) {
        synchronized (emitLock) {
            try {
                sink.emit(rec);
            } catch (IOException e) {
                throw new ScrapeAbortedException("record sink failed on " + rec.getId(), e);
            }
            stats.addRecord();
        }
        SLOG.info("record-emitted", "id", rec.getId(), "page", task.pageNumber(), "url", rec.getUrl());
    }

    private void awaitAll(List<Future<?>> futures, AtomicBoolean cancelFlag, FetchWorkerPool pool)
            throws InterruptedException {
        for (Future<?> f : futures) {
            if (shouldStop(cancelFlag, pool)) pool.stop();
            try {
                f.get();
            } catch (CancellationException ce) {
                LOG.debug("Detail task cancelled");
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                if (cause instanceof ScrapeAbortedException sae) throw sae;
                LOG.warn("Detail task failed: {}", cause.toString());
                SLOG.error("task-failed", cause, "cause", cause.toString());
            }
        }
    }

    private boolean shouldStop(AtomicBoolean cancelFlag, FetchWorkerPool pool) {
        boolean cancel = Thread.currentThread().isInterrupted()
                || stopRequested.get()
                || (cancelFlag != null && cancelFlag.get());
        if (cancel && !pool.isStopped()) pool.stop();
        return cancel || pool.isStopped();
    }

    private static void progress(ProgressListener pl, String phase, long done, long total) {
        double p = (total > 0) ? Math.max(0.0, Math.min(1.0, (double) done / total)) : 0.0;
        try {
            pl.onProgress(p, phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }
}
