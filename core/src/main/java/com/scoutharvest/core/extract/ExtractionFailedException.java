package com.scoutharvest.core.extract;

import java.net.URI;
import java.util.List;

/** 필수 앵커 필드가 없는 페이지. 스킵 기록만 하고 재시도하지 않는다. */
public class ExtractionFailedException extends Exception {
    private final URI pageUrl;
    private final List<String> missing;

    public ExtractionFailedException(URI pageUrl, List<String> missing) {
        super("missing mandatory field(s) " + missing + " on " + pageUrl);
        this.pageUrl = pageUrl;
        this.missing = List.copyOf(missing);
    }

    public URI getPageUrl() { return pageUrl; }
    public List<String> getMissing() { return missing; }
}
