package com.scoutharvest.core.api;

import com.scoutharvest.core.model.SkipRecord;

/** 실패/스킵 사이드 채널. ScrapeService 가 emit 락 안에서 직렬화해 호출. */
@FunctionalInterface
public interface SkipListener {
    void onSkip(SkipRecord skip);

    SkipListener NONE = s -> {};
}
