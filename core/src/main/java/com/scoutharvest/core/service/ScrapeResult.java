package com.scoutharvest.core.service;

import com.scoutharvest.core.crawler.PaginationState;
import com.scoutharvest.core.model.ScrapeStats;

import java.time.Duration;
import java.util.List;

/**
 * 실행 1회 요약.
 * @param pagination 검색 시작 URL 별 최종 페이지네이션 상태(상세 시작 URL 은 제외)
 */
public record ScrapeResult(List<PaginationState> pagination,
                           ScrapeStats.Snapshot stats,
                           boolean cancelled,
                           Duration elapsed) {

    public ScrapeResult {
        pagination = List.copyOf(pagination);
    }

    /** 마지막으로 순회한 검색 URL 의 상태. 검색 URL 이 없었으면 null. */
    public PaginationState finalState() {
        return pagination.isEmpty() ? null : pagination.get(pagination.size() - 1);
    }
}
