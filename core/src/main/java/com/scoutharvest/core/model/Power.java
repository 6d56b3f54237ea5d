package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** 출력: "240 kW (326 hp)" → kw=240, hp=326 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Power(String display, Integer kw, Integer hp) {}
