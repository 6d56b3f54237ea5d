package com.scoutharvest.core.crawler;

import com.scoutharvest.core.budget.RecordBudget;
import com.scoutharvest.core.http.FetchFailedException;
import com.scoutharvest.core.model.CrawlTask;
import com.scoutharvest.core.model.ErrorKind;
import com.scoutharvest.core.model.FetchOutcome;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ScrapeStats;
import com.scoutharvest.core.model.SkipRecord;
import com.scoutharvest.core.model.TaskKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationDriverTest {

    private static final String START = "https://ex.com/lst/bmw";

    /** URL → HTML 맵 기반 discovery fetch. 없는 URL 은 404 PERMANENT. */
    static final class MapDiscovery implements PaginationDriver.DiscoveryFetch {
        final Map<String, String> pages = new HashMap<>();
        final List<String> fetched = new ArrayList<>();

        MapDiscovery page(String url, String html) { pages.put(url, html); return this; }

        @Override
        public FetchResult fetch(CrawlTask task) throws FetchFailedException {
            String u = task.url().toString();
            fetched.add(u);
            String html = pages.get(u);
            if (html == null) {
                FetchResult r = FetchResult.builder().url(task.url()).statusCode(404).outcome(FetchOutcome.PERMANENT).build();
                throw new FetchFailedException(ErrorKind.PERMANENT, "HTTP 404", r);
            }
            return FetchResult.builder().url(task.url()).statusCode(200).body(html).outcome(FetchOutcome.SUCCESS).build();
        }
    }

    private final ScrapeStats stats = new ScrapeStats();
    private final List<SkipRecord> skips = new ArrayList<>();
    private final List<CrawlTask> dispatched = new ArrayList<>();

    private PaginationDriver driver(MapDiscovery fetch, int maxRecords) {
        return new PaginationDriver(new JsoupSearchPageParser(), new RecordBudget(maxRecords), fetch, skips::add, stats);
    }

    private static String page(String next, String... ids) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String id : ids) sb.append("<a href=\"/offers/").append(id).append("\">").append(id).append("</a>");
        if (next != null) sb.append("<a rel=\"next\" href=\"").append(next).append("\">next</a>");
        return sb.append("</body></html>").toString();
    }

    @Test
    @DisplayName("2페이지(2+1 상세), 예산 10 → EXHAUSTED, discovery 2회, 상세 3건")
    void walksUntilNoNextLink() throws Exception {
        MapDiscovery fetch = new MapDiscovery()
                .page(START, page("/lst/bmw?page=2", "a-1", "b-2"))
                .page(START + "?page=2", page(null, "c-3"));

        PaginationState end = driver(fetch, 10).walk(URI.create(START), dispatched::add);

        assertThat(end).isEqualTo(PaginationState.EXHAUSTED);
        assertThat(fetch.fetched).containsExactly(START, START + "?page=2");
        assertThat(dispatched).extracting(t -> t.url().getPath())
                .containsExactly("/offers/a-1", "/offers/b-2", "/offers/c-3");
        assertThat(dispatched).extracting(CrawlTask::pageNumber).containsExactly(1, 1, 2);
        assertThat(dispatched).allMatch(t -> t.kind() == TaskKind.DETAIL);
        assertThat(stats.snapshot().discoveryPages).isEqualTo(2);
        assertThat(stats.snapshot().detailTasks).isEqualTo(3);
    }

    @Test
    @DisplayName("예산 N 이면 정확히 N 건 발행 후 BUDGET_REACHED, 다음 페이지는 가져오지 않음")
    void stopsExactlyAtBudget() throws Exception {
        MapDiscovery fetch = new MapDiscovery()
                .page(START, page("/lst/bmw?page=2", "a-1", "b-2", "c-3", "d-4", "e-5"))
                .page(START + "?page=2", page(null, "f-6"));

        PaginationDriver d = driver(fetch, 3);
        PaginationState end = d.walk(URI.create(START), dispatched::add);

        assertThat(end).isEqualTo(PaginationState.BUDGET_REACHED);
        assertThat(dispatched).hasSize(3);
        assertThat(d.dispatchedCount()).isEqualTo(3);
        assertThat(fetch.fetched).containsExactly(START);
    }

    @Test
    void budgetFilledByLastLinkOfPageStillStops() throws Exception {
        MapDiscovery fetch = new MapDiscovery()
                .page(START, page("/lst/bmw?page=2", "a-1", "b-2"))
                .page(START + "?page=2", page(null, "c-3"));

        PaginationState end = driver(fetch, 2).walk(URI.create(START), dispatched::add);

        assertThat(end).isEqualTo(PaginationState.BUDGET_REACHED);
        assertThat(fetch.fetched).hasSize(1);
    }

    @Test
    @DisplayName("다음 링크가 방문한 페이지를 가리키면 루프 가드로 종료")
    void loopGuard() throws Exception {
        MapDiscovery fetch = new MapDiscovery()
                .page(START, page("/lst/bmw?page=2", "a-1"))
                .page(START + "?page=2", page("/lst/bmw?page=1", "b-2"));

        PaginationState end = driver(fetch, 10).walk(URI.create(START), dispatched::add);

        assertThat(end).isEqualTo(PaginationState.EXHAUSTED);
        assertThat(fetch.fetched).hasSize(2);
        assertThat(dispatched).hasSize(2);
    }

    @Test
    void duplicateListingsAcrossPagesAreDispatchedOnce() throws Exception {
        MapDiscovery fetch = new MapDiscovery()
                .page(START, page("/lst/bmw?page=2", "a-1", "b-2"))
                .page(START + "?page=2", page(null, "a-1?ref=dup", "c-3"));

        PaginationDriver d = driver(fetch, 10);
        d.walk(URI.create(START), dispatched::add);

        assertThat(dispatched).extracting(t -> t.url().getPath())
                .containsExactly("/offers/a-1", "/offers/b-2", "/offers/c-3");
        assertThat(d.offerDetail(URI.create("https://ex.com/offers/b-2"), 0, dispatched::add))
                .isEqualTo(PaginationDriver.Offer.DUPLICATE);
    }

    @Test
    void pageWithoutLinksIsExhausted() throws Exception {
        MapDiscovery fetch = new MapDiscovery().page(START, page("/lst/bmw?page=2"));

        assertThat(driver(fetch, 10).walk(URI.create(START), dispatched::add)).isEqualTo(PaginationState.EXHAUSTED);
        assertThat(dispatched).isEmpty();
        assertThat(fetch.fetched).hasSize(1);
    }

    @Test
    @DisplayName("discovery fetch 실패 → 스킵 기록 후 EXHAUSTED")
    void failedDiscoveryIsSkippedAndEnds() throws Exception {
        MapDiscovery fetch = new MapDiscovery().page(START, page("/lst/bmw?page=2", "a-1"));

        PaginationState end = driver(fetch, 10).walk(URI.create(START), dispatched::add);

        assertThat(end).isEqualTo(PaginationState.EXHAUSTED);
        assertThat(dispatched).hasSize(1);
        assertThat(skips).singleElement().satisfies(s -> {
            assertThat(s.reason()).isEqualTo(ErrorKind.PERMANENT);
            assertThat(s.kind()).isEqualTo(TaskKind.DISCOVERY);
            assertThat(s.url()).hasToString(START + "?page=2");
        });
    }

    @Test
    void stopRequestEndsBeforeFetching() throws Exception {
        MapDiscovery fetch = new MapDiscovery().page(START, page(null, "a-1"));

        PaginationState end = driver(fetch, 10).walk(URI.create(START), dispatched::add, () -> true);

        assertThat(end).isEqualTo(PaginationState.EXHAUSTED);
        assertThat(fetch.fetched).isEmpty();
    }
}
