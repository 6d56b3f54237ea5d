package com.scoutharvest.core.service.export;

import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.model.ListingRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 딜러별 집계(이름 → 위치, 평점, 매물 수). 이름 없는 매물은 "Unknown dealer" 로 묶는다.
 * RecordSink 로 꽂아서 실행 중에 누적.
 */
public final class DealerSummary implements RecordSink {

    public static final String UNKNOWN = "Unknown dealer";

    public record Entry(String dealerName, String location, String ratings, int listingCount) {}

    private final Map<String, Entry> byDealer = new LinkedHashMap<>();

    @Override
    public void emit(ListingRecord r) {
        String name = (r.getDealer() == null || r.getDealer().name() == null || r.getDealer().name().isBlank())
                ? UNKNOWN : r.getDealer().name().trim();
        Entry prev = byDealer.get(name);
        if (prev == null) {
            byDealer.put(name, new Entry(name, r.getLocation(),
                    r.getDealer() == null ? null : r.getDealer().ratingDisplay(), 1));
        } else {
            byDealer.put(name, new Entry(name, prev.location(), prev.ratings(), prev.listingCount() + 1));
        }
    }

    /** 첫 등장 순서 */
    public List<Entry> entries() { return new ArrayList<>(byDealer.values()); }

    public Entry get(String dealerName) { return byDealer.get(dealerName); }

    @Override
    public void close() {
        // 메모리 집계라 정리할 자원 없음
    }
}
