package com.scoutharvest.core.model;

/** 스킵/실패 채널에서 쓰는 오류 분류 */
public enum ErrorKind {
    TRANSIENT,
    BLOCKED,
    PERMANENT,
    EXTRACTION_FAILED,
    UNAVAILABLE,
    RETRIES_EXHAUSTED,
    CANCELLED
}
