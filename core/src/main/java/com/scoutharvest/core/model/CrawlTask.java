package com.scoutharvest.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 워커 풀에 제출되는 작업 단위.
 * pageNumber 는 DISCOVERY 면 해당 페이지 번호, DETAIL 이면 링크가 발견된 페이지 번호(직접 입력이면 0).
 */
public record CrawlTask(URI url, TaskKind kind, int pageNumber, int retryCount) {

    public CrawlTask {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(kind, "kind");
    }

    public static CrawlTask discovery(URI url, int pageNumber) {
        return new CrawlTask(url, TaskKind.DISCOVERY, pageNumber, 0);
    }

    public static CrawlTask detail(URI url, int foundOnPage) {
        return new CrawlTask(url, TaskKind.DETAIL, foundOnPage, 0);
    }

    /** 재시도 카운트만 올린 사본 */
    public CrawlTask nextAttempt() {
        return new CrawlTask(url, kind, pageNumber, retryCount + 1);
    }

    public String host() {
        return url.getHost() == null ? "" : url.getHost().toLowerCase(java.util.Locale.ROOT);
    }
}
