package com.scoutharvest.core.crawler;

import com.scoutharvest.core.api.SkipListener;
import com.scoutharvest.core.budget.RecordBudget;
import com.scoutharvest.core.http.FetchFailedException;
import com.scoutharvest.core.model.CrawlTask;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ScrapeStats;
import com.scoutharvest.core.model.SkipRecord;
import com.scoutharvest.core.util.StructuredLog;
import com.scoutharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * 검색 결과 페이지 순회기. 단일 생산자(호출 스레드)에서만 사용.
 *
 * - AT_PAGE(n) → AT_PAGE(n+1): 상세 링크 ≥1 + 다음 페이지 링크
 * - EXHAUSTED: 상세 링크 없음 / 다음 링크 없음 / discovery fetch 실패 / 이미 방문한 페이지
 * - BUDGET_REACHED: 발행된 상세 작업 수 == maxRecords
 *
 * 방문 키 = 페이지 번호 + 쿼리 시그니처(page 제외, 정렬). 발행 집합은 실행 전체(여러 시작 URL)에서 공유.
 */
public final class PaginationDriver {

    private static final Logger LOG = LoggerFactory.getLogger(PaginationDriver.class);
    private static final StructuredLog SLOG = StructuredLog.get(PaginationDriver.class);

    /** discovery 페이지 fetch(워커 풀 위임) */
    @FunctionalInterface
    public interface DiscoveryFetch {
        FetchResult fetch(CrawlTask task) throws FetchFailedException, InterruptedException;
    }

    /** 상세 작업 발행 대상 */
    @FunctionalInterface
    public interface DetailDispatcher {
        void dispatch(CrawlTask detail);
    }

    public enum Offer { DISPATCHED, DUPLICATE, BUDGET_REACHED }

    private final SearchPageParser parser;
    private final RecordBudget budget;
    private final DiscoveryFetch fetch;
    private final SkipListener skips;
    private final ScrapeStats stats;

    private final Set<String> visitedPages = new HashSet<>();
    private final Set<String> dispatched = new HashSet<>();
    private PaginationState state = PaginationState.atPage(0);

    public PaginationDriver(SearchPageParser parser, RecordBudget budget, DiscoveryFetch fetch,
                            SkipListener skips, ScrapeStats stats) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.fetch = Objects.requireNonNull(fetch, "fetch");
        this.skips = (skips != null) ? skips : SkipListener.NONE;
        this.stats = (stats != null) ? stats : new ScrapeStats();
    }

    /** 중단 신호 없이 순회 */
    public PaginationState walk(URI startUrl, DetailDispatcher dispatcher) throws InterruptedException {
        return walk(startUrl, dispatcher, () -> false);
    }

    /**
     * 시작 검색 URL 부터 종료 상태까지 순회.
     * stopRequested 가 true 가 되면 다음 페이지로 넘어가지 않고 EXHAUSTED.
     */
    public PaginationState walk(URI startUrl, DetailDispatcher dispatcher, BooleanSupplier stopRequested)
            throws InterruptedException {
        Objects.requireNonNull(dispatcher, "dispatcher");
        URI url = UrlUtils.normalize(Objects.requireNonNull(startUrl, "startUrl"));
        int n = pageNumberOf(url, 1);

        if (!visitedPages.add(visitKey(n, url))) {
            LOG.info("Search page already visited, skipping: {}", url);
            return finish(PaginationState.EXHAUSTED);
        }

        while (true) {
            if (budget.isExhausted()) return finish(PaginationState.BUDGET_REACHED);
            if (stopRequested.getAsBoolean()) return finish(PaginationState.EXHAUSTED);
            state = PaginationState.atPage(n);

            CrawlTask task = CrawlTask.discovery(url, n);
            FetchResult page;
            try {
                page = fetch.fetch(task);
            } catch (FetchFailedException e) {
                LOG.warn("Discovery fetch failed for page {} ({}): {}", n, url, e.getMessage());
                skips.onSkip(SkipRecord.of(task, e.getKind(), e.getMessage()));
                return finish(PaginationState.EXHAUSTED);
            }
            stats.addDiscoveryPage();

            DiscoveryPage parsed = parser.parse(page.getBody(), url);
            List<URI> links = parsed.listingLinks();
            SLOG.info("page-discovered",
                    "url", String.valueOf(url),
                    "page", n,
                    "links", links.size(),
                    "next", parsed.nextPage() != null);

            for (URI link : links) {
                if (offerDetail(link, n, dispatcher) == Offer.BUDGET_REACHED) {
                    return finish(PaginationState.BUDGET_REACHED);
                }
            }
            if (links.isEmpty()) return finish(PaginationState.EXHAUSTED);
            if (budget.isExhausted()) return finish(PaginationState.BUDGET_REACHED);

            URI next = parsed.nextPage();
            if (next == null) return finish(PaginationState.EXHAUSTED);
            int nextN = pageNumberOf(next, n + 1);
            if (!visitedPages.add(visitKey(nextN, next))) {
                LOG.info("Next page {} already visited (loop guard): {}", nextN, next);
                return finish(PaginationState.EXHAUSTED);
            }
            url = UrlUtils.normalize(next);
            n = nextN;
        }
    }

    /**
     * 상세 URL 1개를 예산/중복 검사 후 발행. 시작 URL 이 곧 상세 URL 인 경우에도 사용.
     */
    public Offer offerDetail(URI link, int foundOnPage, DetailDispatcher dispatcher) {
        URI u = UrlUtils.normalize(link);
        if (budget.isExhausted()) return Offer.BUDGET_REACHED;
        String key = UrlUtils.listingId(u).orElse(u.toString());
        if (dispatched.contains(key)) return Offer.DUPLICATE;
        if (!budget.tryConsume()) return Offer.BUDGET_REACHED;
        dispatched.add(key);
        stats.addDetailTask();
        dispatcher.dispatch(CrawlTask.detail(u, foundOnPage));
        return Offer.DISPATCHED;
    }

    public PaginationState state() { return state; }

    public int dispatchedCount() { return dispatched.size(); }

    private PaginationState finish(PaginationState s) {
        state = s;
        LOG.debug("Pagination finished: {}", s);
        return s;
    }

    private static int pageNumberOf(URI u, int fallback) {
        int p = UrlUtils.pageParam(u);
        return p > 0 ? p : fallback;
    }

    private static String visitKey(int page, URI u) {
        return page + "|" + UrlUtils.querySignature(u);
    }
}
