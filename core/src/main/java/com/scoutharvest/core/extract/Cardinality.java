package com.scoutharvest.core.extract;

/** ONE: 처음으로 비어있지 않은 값 / MANY: 모든 셀렉터에 걸쳐 순서 유지 + 중복 제거 */
public enum Cardinality { ONE, MANY }
