package com.scoutharvest.core.http;

import com.scoutharvest.core.api.IPageFetcher;
import com.scoutharvest.core.model.CrawlTask;
import com.scoutharvest.core.model.ErrorKind;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.model.ScrapeStats;
import com.scoutharvest.core.model.TaskKind;
import com.scoutharvest.core.proxy.ProxyHandle;
import com.scoutharvest.core.proxy.ProxyOutcome;
import com.scoutharvest.core.proxy.ProxyPool;
import com.scoutharvest.core.proxy.ProxyUnavailableException;
import com.scoutharvest.core.service.ScrapeAbortedException;
import com.scoutharvest.core.util.HostRateLimiter;
import com.scoutharvest.core.util.RunClock;
import com.scoutharvest.core.util.Sleeper;
import com.scoutharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 크기 fetch 워커 풀(공유 큐).
 *
 * 시도 1회: 레이트리미터 허가 → 프록시 임대 → GET → 프록시 반납(결과 보고) → 분류.
 * TRANSIENT/BLOCKED 는 RetryState 가 허용하는 만큼 다른 프록시로 재시도.
 * 프록시 풀이 poolMaxWait 넘게 전부 격리면 stop 후 ScrapeAbortedException.
 * 큐는 우선순위 큐: DISCOVERY fetch 가 대기 중인 상세 작업보다 먼저 나간다(같은 순위는 FIFO).
 */
public final class FetchWorkerPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FetchWorkerPool.class);
    private static final StructuredLog SLOG = StructuredLog.get(FetchWorkerPool.class);

    private final IPageFetcher fetcher;
    private final ProxyPool proxies;
    private final HostRateLimiter limiter;
    private final RetryPolicy policy;
    private final FetchClassifier classifier;
    private final Sleeper sleeper;
    private final RunClock clock;
    private final ScrapeStats stats;
    private final long poolBackoffMs;
    private final long poolMaxWaitMs;

    private final ThreadPoolExecutor exec;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicLong submitSeq = new AtomicLong(0);

    static final int RANK_DISCOVERY = 0;
    static final int RANK_DETAIL = 1;

    public FetchWorkerPool(ScrapeConfig config, IPageFetcher fetcher, ProxyPool proxies, HostRateLimiter limiter,
                           RetryPolicy policy, Sleeper sleeper, RunClock clock, ScrapeStats stats) {
        Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.proxies = Objects.requireNonNull(proxies, "proxies");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = (stats != null) ? stats : new ScrapeStats();
        this.classifier = new FetchClassifier(config.getBlockSignatures());
        this.poolBackoffMs = config.getProxy().getPoolBackoffMs();
        this.poolMaxWaitMs = config.getProxy().getPoolMaxWaitMs();
        int workers = Math.max(1, config.getConcurrency());
        this.exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(),
                new NamedThreadFactory("fetch-worker")) {
            @Override
            protected <T> RunnableFuture<T> newTaskFor(Callable<T> job) {
                int rank = (job instanceof Ranked<?> r) ? r.rank() : RANK_DETAIL;
                return new RankedTask<>(job, rank, submitSeq.getAndIncrement());
            }
        };
    }

    /** 공유 큐에 제출. 시작 전에 stop 되면 FetchFailedException(CANCELLED) 로 끝난다. */
    public Future<FetchResult> submit(CrawlTask task) {
        Objects.requireNonNull(task, "task");
        int rank = task.kind() == TaskKind.DISCOVERY ? RANK_DISCOVERY : RANK_DETAIL;
        return exec.submit(new Ranked<FetchResult>(rank, () -> fetch(task)));
    }

    /** fetch 를 포함한 임의 작업(상세 페이지 처리 등)을 같은 워커/큐에서 실행 */
    public <T> Future<T> execute(Callable<T> job) {
        Objects.requireNonNull(job, "job");
        return exec.submit(job);
    }

    /**
     * 호출 스레드에서 재시도 포함 fetch.
     * @return SUCCESS 결과(attempts 반영)
     * @throws FetchFailedException PERMANENT / RETRIES_EXHAUSTED / CANCELLED
     * @throws ScrapeAbortedException 프록시 풀 장기 불가
     */
    public FetchResult fetch(CrawlTask task) throws FetchFailedException, InterruptedException {
        RetryState state = new RetryState(policy);
        ProxyHandle previous = null;
        CrawlTask current = task;

        while (true) {
            if (stopped.get()) {
                recordAttempts(state.attempt());
                throw new FetchFailedException(ErrorKind.CANCELLED, "scrape stopped before " + task.url(), state.lastResult());
            }

            limiter.acquire(current.host(), sleeper);
            ProxyHandle proxy = acquireProxy(previous);

            FetchResult classified;
            int cur = inFlight.incrementAndGet();
            stats.observeConcurrency(cur);
            ProxyOutcome reported = ProxyOutcome.NEUTRAL;
            try {
                FetchResult raw = fetcher.fetchOnce(current.url(), proxy);
                classified = classifier.classify(raw);
                reported = FetchClassifier.proxyOutcome(classified);
            } finally {
                inFlight.decrementAndGet();
                proxies.release(proxy, reported);
            }
            previous = proxy;

            state.onResult(classified);
            LOG.debug("{} attempt {} via {} -> {} ({})", current.url(), state.attempt(), proxy,
                    classified.getOutcome(), classified.getStatusCode());

            if (state.isTerminal()) {
                recordAttempts(state.attempt());
                if (state.succeeded()) return classified.withAttempts(state.attempt());
                throw new FetchFailedException(state.failure(),
                        state.failure() + " after " + state.attempt() + " attempt(s): " + classified.getFailure(),
                        classified.withAttempts(state.attempt()));
            }

            SLOG.debug("fetch-retry",
                    "url", String.valueOf(current.url()),
                    "attempt", state.attempt(),
                    "outcome", String.valueOf(classified.getOutcome()),
                    "delayMs", state.nextDelay().toMillis());
            sleeper.sleep(state.nextDelay());
            current = current.nextAttempt();
        }
    }

    /** ProxyUnavailable → poolBackoff 간격으로 재시도, poolMaxWait 초과 시 실행 중단 */
    private ProxyHandle acquireProxy(ProxyHandle avoid) throws InterruptedException {
        long since = -1;
        for (;;) {
            try {
                return proxies.acquire(avoid);
            } catch (ProxyUnavailableException e) {
                long now = clock.nowMillis();
                if (since < 0) since = now;
                long waited = now - since;
                if (waited >= poolMaxWaitMs) {
                    stop();
                    LOG.error("Proxy pool unavailable for {} ms, aborting scrape", waited);
                    SLOG.error("pool-exhausted", e, "waitedMs", waited);
                    throw new ScrapeAbortedException("proxy pool unavailable for " + waited + " ms", e);
                }
                LOG.warn("All proxies quarantined (recovery in {} ms); backing off {} ms",
                        e.getEarliestRecovery().toMillis(), poolBackoffMs);
                sleeper.sleep(Duration.ofMillis(poolBackoffMs));
            }
        }
    }

    private void recordAttempts(int attempts) {
        if (attempts > 0) stats.addAttempts(attempts);
    }

    /** 새 시도 중단. 큐에 남은 작업은 시작 시 CANCELLED 로 끝나고, 진행 중 요청은 마저 끝난다. */
    public void stop() {
        if (stopped.compareAndSet(false, true)) LOG.info("Fetch worker pool stopping");
    }

    public boolean isStopped() { return stopped.get(); }

    /** graceful shutdown + awaitTermination */
    @Override
    public void close() {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(60, TimeUnit.SECONDS)) {
                LOG.warn("Workers did not drain in 60s; interrupting");
                exec.shutdownNow();
            }
        } catch (InterruptedException ie) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** 제출 순위 표시용 래퍼 */
    private record Ranked<T>(int rank, Callable<T> job) implements Callable<T> {
        @Override public T call() throws Exception { return job.call(); }
    }

    /** 순위 → 제출 순서로 정렬되는 큐 원소 */
    static final class RankedTask<T> extends FutureTask<T> implements Comparable<RankedTask<?>> {
        private final int rank;
        private final long seq;

        RankedTask(Callable<T> job, int rank, long seq) {
            super(job);
            this.rank = rank;
            this.seq = seq;
        }

        @Override
        public int compareTo(RankedTask<?> o) {
            int c = Integer.compare(rank, o.rank);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
