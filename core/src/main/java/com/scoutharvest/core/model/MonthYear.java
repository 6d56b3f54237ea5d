package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** 월/연도 (최초등록, 생산일). 일(day)은 보관하지 않는다. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonthYear(String display, Integer month, Integer year) {}
