package com.scoutharvest.core.crawler;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/** 검색 결과 페이지 1장의 파싱 결과: 상세 링크(문서 순서, 중복 제거) + 다음 페이지 링크 */
public record DiscoveryPage(List<URI> listingLinks, URI nextPage) {
    public DiscoveryPage {
        listingLinks = (listingLinks == null) ? List.of() : List.copyOf(listingLinks);
    }

    public Optional<URI> next() { return Optional.ofNullable(nextPage); }
}
