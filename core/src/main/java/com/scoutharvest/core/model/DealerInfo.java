package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DealerInfo(String name, String ratingDisplay, Integer ratingCount) {}
