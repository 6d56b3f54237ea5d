package com.scoutharvest.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 추출기 출력: 필드명 → 단일 문자열 또는 문자열 목록.
 * 값이 없는 선택 필드는 아예 들어가지 않는다.
 */
public final class RawFieldMap {
    private final Map<String, String> singles = new LinkedHashMap<>();
    private final Map<String, List<String>> lists = new LinkedHashMap<>();

    public RawFieldMap put(String field, String value) {
        if (value != null && !value.isBlank()) singles.put(field, value);
        return this;
    }

    public RawFieldMap putAll(String field, List<String> values) {
        if (values != null && !values.isEmpty()) lists.put(field, List.copyOf(values));
        return this;
    }

    public String get(String field) { return singles.get(field); }

    public List<String> getList(String field) { return lists.getOrDefault(field, List.of()); }

    public boolean has(String field) { return singles.containsKey(field) || lists.containsKey(field); }

    public Map<String, String> singles() { return Collections.unmodifiableMap(singles); }

    public Map<String, List<String>> lists() { return Collections.unmodifiableMap(lists); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawFieldMap r)) return false;
        return singles.equals(r.singles) && lists.equals(r.lists);
    }

    @Override public int hashCode() { return 31 * singles.hashCode() + lists.hashCode(); }

    @Override public String toString() { return "RawFieldMap" + singles + lists; }
}
