package com.scoutharvest.core.model;

/** 작업 종류: 검색 결과 페이지 / 매물 상세 페이지 */
public enum TaskKind { DISCOVERY, DETAIL }
