package com.scoutharvest.core.api;

import com.scoutharvest.core.model.ListingRecord;

import java.io.IOException;

/**
 * 정규화된 레코드 출력 스트림.
 * emit 은 ScrapeService 의 emit 락 안에서만 호출되므로 구현체는 스레드 안전할 필요 없음.
 */
public interface RecordSink extends AutoCloseable {
    void emit(ListingRecord record) throws IOException;

    @Override
    void close() throws IOException;
}
