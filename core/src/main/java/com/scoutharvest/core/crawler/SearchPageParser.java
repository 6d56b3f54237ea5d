package com.scoutharvest.core.crawler;

import java.net.URI;

/** 검색 결과 페이지에서 상세 링크/다음 페이지를 뽑는 전략 인터페이스. */
public interface SearchPageParser {
    /** 상대 href 는 pageUrl 기준으로 절대화. 파싱 실패는 빈 페이지로 처리. */
    DiscoveryPage parse(String html, URI pageUrl);
}
