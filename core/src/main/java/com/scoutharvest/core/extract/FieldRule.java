package com.scoutharvest.core.extract;

import java.util.List;
import java.util.Objects;

/**
 * 필드 1개 추출 규칙: 순서 있는 셀렉터 목록 + 카디널리티 + 값 출처.
 * attributes 가 비어 있으면 요소 텍스트, 아니면 나열 순서대로 첫 비어있지 않은 속성값.
 * absolute 면 속성값을 페이지 URL 기준 절대 URL 로 바꾼다.
 */
public record FieldRule(String field, List<String> selectors, Cardinality cardinality,
                        List<String> attributes, boolean absolute) {

    public FieldRule {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(cardinality, "cardinality");
        selectors = List.copyOf(selectors);
        attributes = (attributes == null) ? List.of() : List.copyOf(attributes);
        if (selectors.isEmpty()) throw new IllegalArgumentException("no selectors for " + field);
    }

    public static FieldRule text(String field, String... selectors) {
        return new FieldRule(field, List.of(selectors), Cardinality.ONE, List.of(), false);
    }

    public static FieldRule texts(String field, String... selectors) {
        return new FieldRule(field, List.of(selectors), Cardinality.MANY, List.of(), false);
    }

    public boolean fromText() { return attributes.isEmpty(); }
}
