package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** 주행거리: 원문 + 정수값 + 단위(km|mi). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Mileage(String display, Long value, String unit) {}
