package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** 가격: 원문 표기 + 정수 금액(통화 단위) + ISO 통화코드. 파싱 실패 값은 null. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Price(String display, Long amount, String currency) {}
