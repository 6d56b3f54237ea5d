package com.scoutharvest.core.model;

/** 단일 시도 결과 분류 */
public enum FetchOutcome {
    SUCCESS,
    /** 403/429 또는 차단 페이지 시그니처: 프록시 교체 후 재시도 */
    BLOCKED,
    /** 타임아웃/연결 실패: 재시도 */
    TRANSIENT,
    /** 그 밖의 non-2xx: 포기 */
    PERMANENT;

    public boolean isRetryable() {
        return this == BLOCKED || this == TRANSIENT;
    }
}
