package com.scoutharvest.core.model;

import java.net.URI;
import java.time.Instant;

/** 실패/스킵 사이드 채널 항목: (url, reason) + 부가 정보 */
public record SkipRecord(URI url, ErrorKind reason, TaskKind kind, String detail, Instant at) {

    public static SkipRecord of(CrawlTask task, ErrorKind reason, String detail) {
        return new SkipRecord(task.url(), reason, task.kind(), detail == null ? "" : detail, Instant.now());
    }
}
